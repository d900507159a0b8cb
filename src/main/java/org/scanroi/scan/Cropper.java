package org.scanroi.scan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 按列裁剪扫描中的每一帧，并记录每帧裁剪后的最大值像素。
 * <p>
 * 裁剪总是基于归一化帧的绝对列坐标，而不是在上一次裁剪结果上累积；重复用同一窗口裁剪得到相同结果。
 */
public final class Cropper {

    private Cropper() {
    }

    /**
     * 把每帧的列范围裁剪到 [lim1, lim2)，并把裁剪帧与峰值像素整体附加到 scan 上。
     *
     * @throws ScanException {@code INVALID_CROP_WINDOW}：不满足 {@code 0 <= lim1 < lim2 <= 帧宽}
     */
    public static Scan crop(Scan scan, int lim1, int lim2) {
        int width = scan.frameColumns();
        if (lim1 < 0 || lim1 >= lim2 || (width >= 0 && lim2 > width)) {
            throw new ScanException(ScanException.Kind.INVALID_CROP_WINDOW,
                    "非法裁剪窗口 [" + lim1 + ", " + lim2 + ")，要求 0 <= lim1 < lim2 <= " + (width >= 0 ? width : "帧宽"));
        }
        List<CroppedPoint> cropped = new ArrayList<>(scan.size());
        for (ScanPoint point : scan.points()) {
            cropped.add(CroppedPoint.of(point.normalizedFrame().cropColumns(lim1, lim2)));
        }
        scan.attachCrop(new CropColumns(lim1, lim2, cropped));
        return scan;
    }

    /**
     * 给出建议的裁剪窗口（仅供参考）。
     * <p>
     * 把所有点的归一化帧取平均，再沿行求和得到“强度-列”剖面；中心取 explicitCenter，未指定时取剖面最大值位置
     * （并列取最小列号）。{@code lim1 = (int) (center - window / 2.0)}，{@code lim2 = (int) (center + window / 2.0)}，
     * 向零截断，不做四舍五入。
     *
     * @param windowWidth    窗口宽度（像素）
     * @param explicitCenter 显式中心列；null 表示自动取最大值位置
     * @throws ScanException {@code EMPTY_SCAN}
     */
    public static CropWindow suggestCropWindow(Scan scan, int windowWidth, Integer explicitCenter) {
        if (scan.isEmpty()) {
            throw new ScanException(ScanException.Kind.EMPTY_SCAN, "空扫描无法计算参考剖面");
        }
        if (windowWidth <= 0) {
            throw new ScanException(ScanException.Kind.INVALID_CROP_WINDOW, "窗口宽度必须为正：" + windowWidth);
        }
        int rows = scan.frameRows();
        int columns = scan.frameColumns();
        double[] accumulator = new double[rows * columns];
        for (ScanPoint point : scan.points()) {
            point.normalizedFrame().addTo(accumulator);
        }
        Frame mean = Frame.wrap(rows, columns, accumulator).scale(1.0 / scan.size());
        double[] profile = mean.columnSums();

        int center;
        if (explicitCenter != null) {
            center = explicitCenter;
        } else {
            center = 0;
            for (int c = 1; c < profile.length; c++) {
                if (profile[c] > profile[center]) {
                    center = c;
                }
            }
        }
        int lim1 = (int) (center - windowWidth / 2.0);
        int lim2 = (int) (center + windowWidth / 2.0);
        return new CropWindow(lim1, lim2, center, Arrays.stream(profile).boxed().toList());
    }
}
