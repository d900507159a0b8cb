package org.scanroi.filesystem.dto;

import java.util.List;

/**
 * {@code scan_suggest_crop_window} 的返回结果（仅供参考，奇数窗口宽度时可能差一个像素）。
 *
 * @param scanId      会话标识
 * @param windowWidth 请求的窗口宽度
 * @param center      窗口中心列
 * @param lim1        建议的列下限
 * @param lim2        建议的列上限
 * @param profile     参考剖面（超过 app.scan.max-profile-values 时为 null）
 * @param warnings    非致命告警
 */
public record CropWindowResult(
        String scanId,
        int windowWidth,
        int center,
        int lim1,
        int lim2,
        List<Double> profile,
        List<String> warnings
) {
}
