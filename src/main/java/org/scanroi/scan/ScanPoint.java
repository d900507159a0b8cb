package org.scanroi.scan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一个扫描点：元数据 + 原始帧 + 派生的衰减因子与归一化帧。
 * <p>
 * 衰减因子只由衰减片编码决定，归一化帧只由原始帧、衰减因子和 monitor 决定；二者只能经由 {@link #derive} 一起算出，
 * 不能单独修改。
 */
public final class ScanPoint {

    private final int index;
    private final Map<String, Double> metadata;
    private final long foilCode;
    private final double monitor;
    private final double attenuationFactor;
    private final Frame rawFrame;
    private final Frame normalizedFrame;

    private ScanPoint(int index, Map<String, Double> metadata, long foilCode, double monitor,
                      double attenuationFactor, Frame rawFrame, Frame normalizedFrame) {
        this.index = index;
        this.metadata = metadata;
        this.foilCode = foilCode;
        this.monitor = monitor;
        this.attenuationFactor = attenuationFactor;
        this.rawFrame = rawFrame;
        this.normalizedFrame = normalizedFrame;
    }

    /**
     * 校验一行元数据并算出衰减因子（不读帧）。
     *
     * @throws ScanException 缺列、衰减片编码非法，或 monitor 为 0/空/非有限数
     */
    static Header header(int index, MetadataRow row, ScanLayout layout, FoilAttenuation foils) {
        try {
            Map<String, Double> projected = new LinkedHashMap<>();
            for (String column : layout.columns()) {
                projected.put(column, row.value(column));
            }
            long foilCode = FoilAttenuation.codeOf(row.value(ScanLayout.FOILS));
            double monitor = row.value(ScanLayout.MONITOR);
            if (!Double.isFinite(monitor)) {
                throw new ScanException(ScanException.Kind.DIVIDE_BY_ZERO_MONITOR, "monitor 计数缺失或不是有限数：" + monitor);
            }
            if (monitor == 0) {
                throw new ScanException(ScanException.Kind.DIVIDE_BY_ZERO_MONITOR, "monitor 计数为 0，无法归一化");
            }
            return new Header(index, Collections.unmodifiableMap(projected), foilCode, monitor, foils.attenuation(foilCode));
        } catch (ScanException e) {
            if (e.pointIndex() != null) {
                throw e;
            }
            throw new ScanException(e.kind(), e.getMessage(), index, e);
        }
    }

    /**
     * 由校验过的元数据和对应的原始帧派生扫描点：{@code normalized = raw × attenuation / monitor}。
     */
    static ScanPoint derive(Header header, Frame rawFrame) {
        Frame normalized = rawFrame.normalize(header.attenuationFactor(), header.monitor());
        return new ScanPoint(header.index(), header.metadata(), header.foilCode(), header.monitor(),
                header.attenuationFactor(), rawFrame, normalized);
    }

    record Header(int index, Map<String, Double> metadata, long foilCode, double monitor, double attenuationFactor) {
    }

    public int index() {
        return index;
    }

    /**
     * 按布局选出的元数据列（保持布局列顺序）。
     */
    public Map<String, Double> metadata() {
        return metadata;
    }

    public long foilCode() {
        return foilCode;
    }

    public double monitor() {
        return monitor;
    }

    public double attenuationFactor() {
        return attenuationFactor;
    }

    public Frame rawFrame() {
        return rawFrame;
    }

    public Frame normalizedFrame() {
        return normalizedFrame;
    }
}
