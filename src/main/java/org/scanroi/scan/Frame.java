package org.scanroi.scan;

import java.util.Arrays;

/**
 * 一帧二维探测器图像（行优先存储，不可变）。
 * <p>
 * 原始帧的像素值是非负整数计数；归一化/裁剪后的帧是实数，因此统一用 {@code double} 保存。
 * 所有变换（缩放、按列裁剪、与掩膜相乘）都会返回新的 {@code Frame}，原帧保持不变。
 */
public final class Frame {

    private final int rows;
    private final int columns;
    private final double[] data;

    private Frame(int rows, int columns, double[] data) {
        this.rows = rows;
        this.columns = columns;
        this.data = data;
    }

    /**
     * 用行优先数组构造一帧（会复制入参）。
     */
    public static Frame of(int rows, int columns, double[] rowMajor) {
        if (rows <= 0 || columns <= 0) {
            throw new IllegalArgumentException("帧尺寸必须为正：" + rows + "x" + columns);
        }
        if (rowMajor.length != rows * columns) {
            throw new ScanException(ScanException.Kind.FRAME_SHAPE_MISMATCH,
                    "帧数据长度 " + rowMajor.length + " 与尺寸 " + rows + "x" + columns + " 不一致");
        }
        return new Frame(rows, columns, rowMajor.clone());
    }

    public static Frame of(double[][] grid) {
        int rows = grid.length;
        int columns = rows == 0 ? 0 : grid[0].length;
        double[] flat = new double[rows * columns];
        for (int r = 0; r < rows; r++) {
            if (grid[r].length != columns) {
                throw new ScanException(ScanException.Kind.FRAME_SHAPE_MISMATCH, "第 " + r + " 行长度与首行不一致");
            }
            System.arraycopy(grid[r], 0, flat, r * columns, columns);
        }
        return of(rows, columns, flat);
    }

    /**
     * 所有像素都等于 value 的帧。
     */
    public static Frame filled(int rows, int columns, double value) {
        double[] flat = new double[rows * columns];
        Arrays.fill(flat, value);
        return of(rows, columns, flat);
    }

    // 内部构造：调用方保证 data 不再被外部持有
    static Frame wrap(int rows, int columns, double[] data) {
        return new Frame(rows, columns, data);
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public double get(int row, int column) {
        return data[row * columns + column];
    }

    public boolean sameShape(Frame other) {
        return rows == other.rows && columns == other.columns;
    }

    public String shape() {
        return rows + "x" + columns;
    }

    /**
     * 逐像素乘以 factor 的新帧。
     */
    public Frame scale(double factor) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = data[i] * factor;
        }
        return wrap(rows, columns, out);
    }

    /**
     * 衰减修正并按 monitor 归一化：逐像素计算 {@code value × attenuation / monitor}。
     */
    public Frame normalize(double attenuation, double monitor) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = data[i] * attenuation / monitor;
        }
        return wrap(rows, columns, out);
    }

    /**
     * 只保留列区间 [from, to)（所有行都保留）。
     */
    public Frame cropColumns(int from, int to) {
        if (from < 0 || to > columns || from >= to) {
            throw new ScanException(ScanException.Kind.INVALID_CROP_WINDOW,
                    "列区间 [" + from + ", " + to + ") 不在帧宽度 " + columns + " 之内");
        }
        int width = to - from;
        double[] out = new double[rows * width];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(data, r * columns + from, out, r * width, width);
        }
        return wrap(rows, width, out);
    }

    /**
     * 最大值所在的行优先平铺下标；并列时取最先出现的那个。
     */
    public int argmax() {
        int best = 0;
        for (int i = 1; i < data.length; i++) {
            if (data[i] > data[best]) {
                best = i;
            }
        }
        return best;
    }

    public double sum() {
        double total = 0;
        for (double v : data) {
            total += v;
        }
        return total;
    }

    /**
     * 每一列沿行方向求和，得到“强度-列”剖面。
     */
    public double[] columnSums() {
        double[] profile = new double[columns];
        for (int r = 0; r < rows; r++) {
            int offset = r * columns;
            for (int c = 0; c < columns; c++) {
                profile[c] += data[offset + c];
            }
        }
        return profile;
    }

    /**
     * 掩膜内像素之和（相当于逐像素相乘后全部求和）。
     */
    public double maskedSum(RoiMask mask) {
        double total = 0;
        for (int i = 0; i < data.length; i++) {
            if (mask.isSetFlat(i)) {
                total += data[i];
            }
        }
        return total;
    }

    // 累加到 accumulator（同尺寸），用于跨帧求平均
    void addTo(double[] accumulator) {
        for (int i = 0; i < data.length; i++) {
            accumulator[i] += data[i];
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frame other)) {
            return false;
        }
        return rows == other.rows && columns == other.columns && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + columns) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Frame[" + shape() + "]";
    }
}
