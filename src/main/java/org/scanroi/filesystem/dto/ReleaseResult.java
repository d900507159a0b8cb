package org.scanroi.filesystem.dto;

/**
 * {@code scan_release} 的返回结果。
 *
 * @param scanId   会话标识
 * @param released 是否确实释放了一个有效会话
 */
public record ReleaseResult(String scanId, boolean released) {
}
