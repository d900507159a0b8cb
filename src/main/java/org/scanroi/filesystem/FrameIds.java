package org.scanroi.filesystem;

import org.scanroi.scan.ScanException;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 帧文件名约定：{@code 任意前缀_####.扩展名}，按扩展名前最后一组 4 位数字排序。
 * <p>
 * 例如 {@code scan_0007.raw} 与 {@code scan_0007.raw.pdi} 的序号都是 7。
 */
public final class FrameIds {

    // 4 位数字 + 不含数字开头的扩展名链（.raw / .raw.pdi）
    private static final Pattern SEQUENCE = Pattern.compile("(\\d{4})((?:\\.[A-Za-z][A-Za-z0-9]*)+)$");

    public static final Comparator<String> BY_SEQUENCE =
            Comparator.comparingInt(FrameIds::sequenceNumber).thenComparing(Comparator.naturalOrder());

    private FrameIds() {
    }

    /**
     * @throws ScanException {@code MALFORMED_FRAME_ID}：文件名中扩展名前没有 4 位数字
     */
    public static int sequenceNumber(String frameId) {
        Matcher m = SEQUENCE.matcher(frameId == null ? "" : frameId);
        if (!m.find()) {
            throw new ScanException(ScanException.Kind.MALFORMED_FRAME_ID,
                    "帧文件名缺少扩展名前的 4 位序号：" + frameId);
        }
        return Integer.parseInt(m.group(1));
    }
}
