package org.scanroi.scan;

import java.util.List;

/**
 * 建议的裁剪窗口（仅供参考）。
 * <p>
 * lim1/lim2 由实数中点向零截断得到，奇数窗口宽度时可能差一个像素。
 *
 * @param lim1    建议的列下限
 * @param lim2    建议的列上限
 * @param center  窗口中心列（显式指定或剖面最大值位置）
 * @param profile 参考剖面：所有点归一化帧取平均后沿行求和（不可变）
 */
public record CropWindow(int lim1, int lim2, int center, List<Double> profile) {

    public CropWindow {
        profile = List.copyOf(profile);
    }
}
