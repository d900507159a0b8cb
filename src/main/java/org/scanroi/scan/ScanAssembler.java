package org.scanroi.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 扫描组装：把元数据行与探测器帧按位置对齐，附加衰减因子与归一化帧。
 * <p>
 * 先校验所有行（长度、布局列、衰减片编码、monitor），全部通过后才开始读帧；输出顺序与输入完全一致。
 */
public final class ScanAssembler {

    private static final Logger log = LoggerFactory.getLogger(ScanAssembler.class);

    private ScanAssembler() {
    }

    /**
     * @param rows        元数据行（扫描顺序）
     * @param frameIds    帧标识（与 rows 按位置一一对应）
     * @param frameSource 帧读取协作方
     * @param foils       衰减片系数
     * @param layout      线站布局
     * @return 新的扫描（长度可以为 0）
     */
    public static Scan assemble(List<MetadataRow> rows, List<String> frameIds, FrameSource frameSource,
                                FoilAttenuation foils, ScanLayout layout) {
        if (layout == null) {
            throw new ScanException(ScanException.Kind.UNSUPPORTED_LAYOUT, "未指定线站布局");
        }
        if (rows.size() != frameIds.size()) {
            throw new ScanException(ScanException.Kind.LENGTH_MISMATCH,
                    "元数据行数 " + rows.size() + " 与帧数 " + frameIds.size() + " 不一致");
        }

        List<ScanPoint.Header> headers = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            headers.add(ScanPoint.header(i, rows.get(i), layout, foils));
        }

        List<ScanPoint> points = new ArrayList<>(rows.size());
        Frame first = null;
        for (int i = 0; i < headers.size(); i++) {
            Frame raw = frameSource.read(frameIds.get(i));
            if (first == null) {
                first = raw;
            } else if (!first.sameShape(raw)) {
                throw new ScanException(ScanException.Kind.FRAME_SHAPE_MISMATCH,
                        "帧 " + frameIds.get(i) + " 尺寸 " + raw.shape() + " 与首帧 " + first.shape() + " 不一致", i, null);
            }
            points.add(ScanPoint.derive(headers.get(i), raw));
        }
        log.debug("组装扫描完成：layout={}, points={}", layout, points.size());
        return new Scan(layout, points);
    }
}
