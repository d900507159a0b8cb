package org.scanroi.scan;

/**
 * 扫描归约（组装/裁剪/ROI 积分）过程中的失败。
 * <p>
 * 所有失败都同步抛给调用方，不做自动重试，也不做内部兜底：
 * <ul>
 *   <li>参数类失败（尺寸、长度、布局）在操作开始时就会被检出，不会留下“标注了一半”的 {@link Scan}。</li>
 *   <li>逐点失败（例如 {@link RoiEngine#trackCenter} 中窗口越界）会带上出错的扫描点下标 {@link #pointIndex()}。</li>
 * </ul>
 */
public class ScanException extends RuntimeException {

    /**
     * 失败类型。
     */
    public enum Kind {
        INVALID_FOIL_CODE,
        INVALID_FOIL_COEFFICIENTS,
        UNSUPPORTED_LAYOUT,
        LENGTH_MISMATCH,
        DIVIDE_BY_ZERO_MONITOR,
        FRAME_SHAPE_MISMATCH,
        INVALID_CROP_WINDOW,
        SCAN_NOT_CROPPED,
        INVALID_ROI_DIMENSIONS,
        ROI_OUT_OF_BOUNDS,
        MASK_SHAPE_MISMATCH,
        UNKNOWN_COLUMN,
        EMPTY_SCAN,
        MALFORMED_FRAME_ID,
        MALFORMED_SIDECAR
    }

    private final Kind kind;
    private final Integer pointIndex;

    public ScanException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public ScanException(Kind kind, String message, Integer pointIndex, Throwable cause) {
        super(pointIndex == null ? message : message + "（扫描点 #" + pointIndex + "）", cause);
        this.kind = kind;
        this.pointIndex = pointIndex;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * 出错的扫描点下标；与具体扫描点无关的失败返回 null。
     */
    public Integer pointIndex() {
        return pointIndex;
    }
}
