package org.scanroi.filesystem.dto;

import org.scanroi.filesystem.SidecarMetadataParser;

/**
 * {@code scan_read_sidecar} 的返回结果。
 *
 * @param rootId 根目录标识
 * @param path   侧车文件路径（相对 root）
 * @param motors 电机位置与探测器标定参数
 */
public record SidecarReadResult(String rootId, String path, SidecarMetadataParser.SidecarMotors motors) {
}
