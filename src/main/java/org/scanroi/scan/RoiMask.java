package org.scanroi.scan;

/**
 * ROI 掩膜：与帧同尺寸的布尔数组，其中恰好有一个以 (cenx, ceny) 为中心、height×width 的轴对齐矩形为 1。
 * <p>
 * 只能通过 {@link RoiEngine#makeMask} 创建；窗口越出帧边界时直接失败，不做截断。
 */
public final class RoiMask {

    private final int rows;
    private final int columns;
    private final int cenx;
    private final int ceny;
    private final int height;
    private final int width;

    RoiMask(int rows, int columns, int cenx, int ceny, int height, int width) {
        this.rows = rows;
        this.columns = columns;
        this.cenx = cenx;
        this.ceny = ceny;
        this.height = height;
        this.width = width;
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public int cenx() {
        return cenx;
    }

    public int ceny() {
        return ceny;
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    public String shape() {
        return rows + "x" + columns;
    }

    public boolean fits(Frame frame) {
        return frame.rows() == rows && frame.columns() == columns;
    }

    /**
     * (row, column) 是否在 ROI 内。
     */
    public boolean isSet(int row, int column) {
        return Math.abs(row - ceny) <= height / 2 && Math.abs(column - cenx) <= width / 2;
    }

    boolean isSetFlat(int flatIndex) {
        return isSet(flatIndex / columns, flatIndex % columns);
    }

    /**
     * 掩膜中 1 的个数（窗口完整落在帧内，恒等于 height × width）。
     */
    public int count() {
        return height * width;
    }

    @Override
    public String toString() {
        return "RoiMask[" + shape() + ", center=(" + cenx + "," + ceny + "), " + height + "x" + width + "]";
    }
}
