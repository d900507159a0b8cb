package org.scanroi.scan;

import java.util.List;
import java.util.Locale;

/**
 * 线站相关的元数据列布局（封闭枚举）。
 * <p>
 * 不同线站导出的扫描表列名不同；组装扫描时按布局选出所需的列，缺列直接失败，不返回“残缺”数据。
 */
public enum ScanLayout {

    /**
     * BL 7-2：倒易空间坐标 h/k/l。
     */
    BL72("72", List.of("h", "k", "l", "monitor", "foils")),

    /**
     * BL 2-1：角度扫描 twotheta/theta。
     */
    BL21("21", List.of("twotheta", "theta", "monitor", "foils", "normalized"));

    public static final String MONITOR = "monitor";
    public static final String FOILS = "foils";

    private final String tag;
    private final List<String> columns;

    ScanLayout(String tag, List<String> columns) {
        this.tag = tag;
        this.columns = columns;
    }

    public String tag() {
        return tag;
    }

    /**
     * 该布局要求的元数据列（小写，按输出顺序）。
     */
    public List<String> columns() {
        return columns;
    }

    /**
     * 按线站标识（{@code 72}/{@code 21}）或枚举名（{@code BL72}/{@code BL21}，不区分大小写）选择布局。
     *
     * @throws ScanException {@code UNSUPPORTED_LAYOUT}
     */
    public static ScanLayout fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toUpperCase(Locale.ROOT);
            for (ScanLayout layout : values()) {
                if (layout.tag.equals(normalized) || layout.name().equals(normalized)) {
                    return layout;
                }
            }
        }
        throw new ScanException(ScanException.Kind.UNSUPPORTED_LAYOUT,
                "不支持的线站布局：" + tag + "（可选 72 / 21）");
    }
}
