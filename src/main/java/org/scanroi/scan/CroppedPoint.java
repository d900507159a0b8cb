package org.scanroi.scan;

/**
 * 一个扫描点的裁剪结果：裁剪帧及其最大值像素位置。
 * <p>
 * peakX/peakY 只能通过 {@link #of(Frame)} 从同一张裁剪帧一起算出，不会与裁剪帧不一致。
 *
 * @param cropFrame 裁剪后的帧
 * @param peakX     最大值像素的列坐标（相对裁剪帧）
 * @param peakY     最大值像素的行坐标
 */
public record CroppedPoint(Frame cropFrame, int peakX, int peakY) {

    public static CroppedPoint of(Frame cropFrame) {
        int flat = cropFrame.argmax();
        return new CroppedPoint(cropFrame, flat % cropFrame.columns(), flat / cropFrame.columns());
    }
}
