package org.scanroi.filesystem.dto;

import java.util.List;

/**
 * {@code scan_extract_roi}/{@code scan_track_roi} 的返回结果。
 *
 * @param scanId  会话标识
 * @param mode    fixed（固定 ROI）或 tracked（水平中心跟随 px_x）
 * @param ceny    ROI 垂直中心
 * @param height  ROI 高度
 * @param width   ROI 宽度
 * @param centerX 每个点实际使用的 ROI 水平中心
 * @param signal  每个点的积分强度（扫描顺序）
 */
public record RoiSignalResult(
        String scanId,
        String mode,
        int ceny,
        int height,
        int width,
        List<Integer> centerX,
        List<Double> signal
) {
}
