package org.scanroi.scan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 一个扫描点的元数据（列名 -> 数值）。
 * <p>
 * 列名统一去掉首尾空白并转为小写；行的先后顺序就是扫描顺序，与帧顺序按位置对齐，没有显式的关联键。
 */
public final class MetadataRow {

    private final Map<String, Double> values;

    private MetadataRow(Map<String, Double> values) {
        this.values = values;
    }

    public static MetadataRow of(Map<String, Double> values) {
        Map<String, Double> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            normalized.put(normalizeColumn(entry.getKey()), entry.getValue());
        }
        return new MetadataRow(Collections.unmodifiableMap(normalized));
    }

    public static String normalizeColumn(String column) {
        return column == null ? "" : column.trim().toLowerCase(Locale.ROOT);
    }

    public boolean has(String column) {
        return values.containsKey(normalizeColumn(column));
    }

    /**
     * @throws ScanException {@code UNKNOWN_COLUMN}
     */
    public double value(String column) {
        Double value = values.get(normalizeColumn(column));
        if (value == null) {
            throw new ScanException(ScanException.Kind.UNKNOWN_COLUMN, "元数据缺少列：" + column);
        }
        return value;
    }

    public Set<String> columns() {
        return values.keySet();
    }

    public Map<String, Double> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "MetadataRow" + values;
    }
}
