package org.scanroi.filesystem.dto;

import java.util.Map;

/**
 * {@code scan_view_point} 的返回结果：绘制某个扫描点裁剪帧所需的数据（本服务不做绘图）。
 *
 * @param scanId      会话标识
 * @param index       扫描下标
 * @param title       标题（布局含 l 列时为 {@code L = x.xxx}，否则为 null）
 * @param cropRows    裁剪帧行数
 * @param cropColumns 裁剪帧列数
 * @param peakX       最大值像素的列
 * @param peakY       最大值像素的行
 * @param peakValue   最大值像素的强度
 * @param yMedian     全部扫描点 px_y 的中位数
 * @param yBottom     纵向显示下限（yMedian - yWidth）
 * @param yTop        纵向显示上限（yMedian + yWidth）
 * @param metadata    该点的元数据
 */
public record PointViewResult(
        String scanId,
        int index,
        String title,
        int cropRows,
        int cropColumns,
        int peakX,
        int peakY,
        double peakValue,
        double yMedian,
        double yBottom,
        double yTop,
        Map<String, Double> metadata
) {
}
