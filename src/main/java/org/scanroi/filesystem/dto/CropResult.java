package org.scanroi.filesystem.dto;

import java.util.List;

/**
 * {@code scan_crop} 的返回结果。
 *
 * @param scanId      会话标识
 * @param lim1        列下限（含）
 * @param lim2        列上限（不含）
 * @param cropRows    裁剪帧行数
 * @param cropColumns 裁剪帧列数
 * @param peakX       每个点最大值像素的列（px_x）
 * @param peakY       每个点最大值像素的行（px_y）
 */
public record CropResult(
        String scanId,
        int lim1,
        int lim2,
        int cropRows,
        int cropColumns,
        List<Integer> peakX,
        List<Integer> peakY
) {
}
