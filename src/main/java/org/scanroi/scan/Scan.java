package org.scanroi.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 一次扫描：按扫描顺序排列的扫描点，以及逐步附加上去的派生列。
 * <p>
 * 所有派生（原始帧、归一化帧、裁剪帧、峰值像素、ROI）共用同一套位置下标；顺序永远等于输入元数据的顺序，不按数值重排。
 * 由 {@link ScanAssembler} 新建，{@link Cropper} 整体替换裁剪列，{@link RoiEngine} 只读。
 */
public final class Scan {

    public static final String ATTENUATION = "attenuation";
    public static final String PEAK_X = "px_x";
    public static final String PEAK_Y = "px_y";

    private final ScanLayout layout;
    private final List<ScanPoint> points;
    private volatile CropColumns crop;

    Scan(ScanLayout layout, List<ScanPoint> points) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.points = List.copyOf(points);
    }

    public ScanLayout layout() {
        return layout;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public ScanPoint point(int index) {
        return points.get(index);
    }

    public List<ScanPoint> points() {
        return points;
    }

    /**
     * 帧宽度（列数）；空扫描返回 -1。
     */
    public int frameColumns() {
        return points.isEmpty() ? -1 : points.get(0).rawFrame().columns();
    }

    public int frameRows() {
        return points.isEmpty() ? -1 : points.get(0).rawFrame().rows();
    }

    public boolean isCropped() {
        return crop != null;
    }

    /**
     * @throws ScanException {@code SCAN_NOT_CROPPED}
     */
    public CropColumns crop() {
        CropColumns current = crop;
        if (current == null) {
            throw new ScanException(ScanException.Kind.SCAN_NOT_CROPPED, "扫描尚未裁剪，请先执行 crop");
        }
        return current;
    }

    // 一次性整体替换，保证不会出现“只附加了一部分”的裁剪列
    void attachCrop(CropColumns columns) {
        if (columns.points().size() != points.size()) {
            throw new ScanException(ScanException.Kind.LENGTH_MISMATCH,
                    "裁剪列长度 " + columns.points().size() + " 与扫描长度 " + points.size() + " 不一致");
        }
        this.crop = columns;
    }

    /**
     * 可用于查询的列：布局元数据列 + attenuation，裁剪后再加 px_x/px_y。
     */
    public List<String> columns() {
        List<String> columns = new ArrayList<>(layout.columns());
        columns.add(ATTENUATION);
        if (isCropped()) {
            columns.add(PEAK_X);
            columns.add(PEAK_Y);
        }
        return columns;
    }

    /**
     * 取出某一列在所有扫描点上的值（按扫描顺序）。
     *
     * @throws ScanException {@code UNKNOWN_COLUMN}
     */
    public double[] columnValues(String column) {
        String name = column == null ? "" : column.trim().toLowerCase(Locale.ROOT);
        double[] values = new double[points.size()];
        if (layout.columns().contains(name)) {
            for (int i = 0; i < values.length; i++) {
                values[i] = points.get(i).metadata().get(name);
            }
        } else if (ATTENUATION.equals(name)) {
            for (int i = 0; i < values.length; i++) {
                values[i] = points.get(i).attenuationFactor();
            }
        } else if (isCropped() && (PEAK_X.equals(name) || PEAK_Y.equals(name))) {
            CropColumns columns = crop();
            for (int i = 0; i < values.length; i++) {
                CroppedPoint p = columns.point(i);
                values[i] = PEAK_X.equals(name) ? p.peakX() : p.peakY();
            }
        } else {
            throw new ScanException(ScanException.Kind.UNKNOWN_COLUMN,
                    "扫描中没有列：" + column + "（可用列：" + columns() + "）");
        }
        return values;
    }

    /**
     * 找出某列数值与 target 最接近（绝对差最小）的扫描下标；并列时取下标最小者，NaN 不参与比较。
     *
     * @throws ScanException {@code UNKNOWN_COLUMN} / {@code EMPTY_SCAN}
     */
    public int nearestIndex(String column, double target) {
        double[] values = columnValues(column);
        int best = -1;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < values.length; i++) {
            double distance = Math.abs(values[i] - target);
            if (Double.isNaN(distance)) {
                continue;
            }
            if (best < 0 || distance < bestDistance) {
                best = i;
                bestDistance = distance;
            }
        }
        if (best < 0) {
            throw new ScanException(ScanException.Kind.EMPTY_SCAN, "列 " + column + " 中没有可比较的数值");
        }
        return best;
    }
}
