package org.scanroi.filesystem.dto;

import java.util.Map;

/**
 * 扫描点摘要（不含帧数据）。
 *
 * @param index       扫描下标
 * @param frameId     对应的帧文件名
 * @param metadata    按布局选出的元数据列
 * @param foilCode    衰减片插入编码
 * @param attenuation 衰减修正因子
 * @param rawSum      原始帧计数总和
 */
public record ScanPointSummary(
        int index,
        String frameId,
        Map<String, Double> metadata,
        long foilCode,
        double attenuation,
        double rawSum
) {
}
