package org.scanroi.scan;

import java.util.ArrayList;
import java.util.List;

/**
 * ROI 构造与积分。
 * <ul>
 *   <li>{@link #makeMask}：构造固定矩形掩膜。</li>
 *   <li>{@link #extract}：逐点对裁剪帧做掩膜求和。</li>
 *   <li>{@link #trackCenter}：每个点的 ROI 水平中心跟随该点的峰值列 px_x，垂直中心与尺寸固定。</li>
 * </ul>
 */
public final class RoiEngine {

    private RoiEngine() {
    }

    /**
     * 构造以 (cenx, ceny) 为中心、height×width 的矩形掩膜，中心上下各 {@code height / 2} 行、左右各 {@code width / 2} 列（含两端）。
     *
     * @throws ScanException {@code INVALID_ROI_DIMENSIONS}：height/width 不是正奇数；
     *                       {@code ROI_OUT_OF_BOUNDS}：窗口有任何部分落在帧外
     */
    public static RoiMask makeMask(int frameRows, int frameColumns, int cenx, int ceny, int height, int width) {
        checkDimensions(height, width);
        if (frameRows <= 0 || frameColumns <= 0) {
            throw new ScanException(ScanException.Kind.ROI_OUT_OF_BOUNDS, "帧尺寸必须为正：" + frameRows + "x" + frameColumns);
        }
        int halfHeight = height / 2;
        int halfWidth = width / 2;
        if (cenx - halfWidth < 0 || cenx + halfWidth >= frameColumns
                || ceny - halfHeight < 0 || ceny + halfHeight >= frameRows) {
            throw new ScanException(ScanException.Kind.ROI_OUT_OF_BOUNDS,
                    "ROI 中心 (" + cenx + "," + ceny + ")、尺寸 " + height + "x" + width
                            + " 超出帧 " + frameRows + "x" + frameColumns + " 的范围");
        }
        return new RoiMask(frameRows, frameColumns, cenx, ceny, height, width);
    }

    public static RoiMask makeMask(Frame like, int cenx, int ceny, int height, int width) {
        return makeMask(like.rows(), like.columns(), cenx, ceny, height, width);
    }

    /**
     * 逐点积分：{@code signal[i] = Σ cropFrame_i × mask_i}，按扫描顺序返回。
     *
     * @throws ScanException {@code SCAN_NOT_CROPPED} / {@code LENGTH_MISMATCH}（逐点掩膜数量与扫描长度不同）/
     *                       {@code MASK_SHAPE_MISMATCH}
     */
    public static double[] extract(Scan scan, RoiSelection selection) {
        return extract(scan.crop(), selection);
    }

    /**
     * 在给定的裁剪快照上积分。掩膜由同一快照构造时使用此形式，避免期间重新裁剪导致掩膜与裁剪帧错位。
     */
    public static double[] extract(CropColumns crop, RoiSelection selection) {
        int size = crop.points().size();
        if (selection instanceof RoiSelection.PerPoint perPoint && perPoint.masks().size() != size) {
            throw new ScanException(ScanException.Kind.LENGTH_MISMATCH,
                    "逐点 ROI 数量 " + perPoint.masks().size() + " 与扫描长度 " + size + " 不一致");
        }
        for (int i = 0; i < size; i++) {
            RoiMask mask = selection.maskFor(i);
            Frame frame = crop.point(i).cropFrame();
            if (!mask.fits(frame)) {
                throw new ScanException(ScanException.Kind.MASK_SHAPE_MISMATCH,
                        "ROI 尺寸 " + mask.shape() + " 与裁剪帧 " + frame.shape() + " 不一致", i, null);
            }
        }

        double[] signal = new double[size];
        for (int i = 0; i < signal.length; i++) {
            signal[i] = crop.point(i).cropFrame().maskedSum(selection.maskFor(i));
        }
        return signal;
    }

    /**
     * 为每个扫描点构造水平中心 = 该点 px_x 的掩膜。
     *
     * @throws ScanException {@code SCAN_NOT_CROPPED} / {@code INVALID_ROI_DIMENSIONS} /
     *                       {@code ROI_OUT_OF_BOUNDS}（带出错的扫描点下标）
     */
    public static RoiSelection.PerPoint trackCenter(Scan scan, int ceny, int height, int width) {
        return trackCenter(scan.crop(), ceny, height, width);
    }

    public static RoiSelection.PerPoint trackCenter(CropColumns crop, int ceny, int height, int width) {
        checkDimensions(height, width);
        List<RoiMask> masks = new ArrayList<>(crop.points().size());
        for (int i = 0; i < crop.points().size(); i++) {
            CroppedPoint point = crop.point(i);
            try {
                masks.add(makeMask(point.cropFrame(), point.peakX(), ceny, height, width));
            } catch (ScanException e) {
                throw new ScanException(e.kind(), e.getMessage(), i, e);
            }
        }
        return new RoiSelection.PerPoint(masks);
    }

    private static void checkDimensions(int height, int width) {
        if (height <= 0 || width <= 0 || height % 2 == 0 || width % 2 == 0) {
            throw new ScanException(ScanException.Kind.INVALID_ROI_DIMENSIONS,
                    "ROI 的高和宽必须是正奇数：height=" + height + ", width=" + width);
        }
    }
}
