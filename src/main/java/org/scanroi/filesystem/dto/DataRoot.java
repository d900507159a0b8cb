package org.scanroi.filesystem.dto;

/**
 * 允许读取扫描数据的根目录。
 *
 * @param id   根目录标识（root0、root1...）
 * @param path 根目录的绝对路径
 */
public record DataRoot(String id, String path) {
}
