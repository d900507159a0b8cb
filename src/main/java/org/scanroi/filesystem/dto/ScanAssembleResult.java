package org.scanroi.filesystem.dto;

import java.time.Instant;
import java.util.List;

/**
 * {@code scan_assemble} 的返回结果。
 *
 * @param scanId       会话标识，后续工具用它引用这次扫描
 * @param rootId       根目录标识
 * @param metadataPath 扫描表路径（相对 root）
 * @param frameFolder  帧目录（相对 root）
 * @param layout       线站布局
 * @param size         扫描点数
 * @param frameRows    帧行数（空扫描为 -1）
 * @param frameColumns 帧列数（空扫描为 -1）
 * @param columns      可查询的列
 * @param points       每个扫描点的摘要
 * @param expiresAt    会话过期时间
 */
public record ScanAssembleResult(
        String scanId,
        String rootId,
        String metadataPath,
        String frameFolder,
        String layout,
        int size,
        int frameRows,
        int frameColumns,
        List<String> columns,
        List<ScanPointSummary> points,
        Instant expiresAt
) {
}
