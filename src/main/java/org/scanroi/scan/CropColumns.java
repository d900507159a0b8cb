package org.scanroi.scan;

import java.util.List;

/**
 * {@link Cropper} 附加到 {@link Scan} 上的派生列，按扫描下标与原始点一一对应。
 *
 * @param lim1   裁剪列下限（含）
 * @param lim2   裁剪列上限（不含）
 * @param points 每个扫描点的裁剪结果
 */
public record CropColumns(int lim1, int lim2, List<CroppedPoint> points) {

    public CropColumns {
        points = List.copyOf(points);
    }

    public CroppedPoint point(int index) {
        return points.get(index);
    }
}
