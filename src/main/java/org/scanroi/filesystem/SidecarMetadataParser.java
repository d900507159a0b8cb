package org.scanroi.filesystem;

import org.scanroi.scan.ScanException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 帧侧车文件（{@code .raw.pdi}）解析器：提取电机位置与探测器标定参数。
 * <p>
 * 侧车文件没有正式格式，这里按固定行号取数：
 * <ul>
 *   <li>第 4 行（下标 3）：电机位置，依次取第 0、2、3、4、5、6 个数 -> th、tth、chi、phi、gamma、mu</li>
 *   <li>第 6 行（下标 5）：标定参数，取前 6 个数 -> PD_X、PD_Y、PD_DIST、PD_ALPHA、PD_DELTA、LAMBDA</li>
 * </ul>
 * 侧车版式一变解析就会出错；能做的校验只有“取到的数的个数够不够”。
 */
public final class SidecarMetadataParser {

    private static final int MOTOR_LINE = 3;
    private static final int CALIBRATION_LINE = 5;

    // 十进制/科学计数法；符号与数字之间允许空格
    private static final Pattern NUMBER = Pattern.compile("[+-]? *(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private SidecarMetadataParser() {
    }

    /**
     * @param th      样品 theta
     * @param tth     探测器 two-theta
     * @param chi     chi
     * @param phi     phi
     * @param gamma   gamma
     * @param mu      mu
     * @param pdX     PD_X
     * @param pdY     PD_Y
     * @param pdDist  PD_DIST（探测器距离）
     * @param pdAlpha PD_ALPHA
     * @param pdDelta PD_DELTA
     * @param lambda  LAMBDA（波长）
     */
    public record SidecarMotors(
            double th,
            double tth,
            double chi,
            double phi,
            double gamma,
            double mu,
            double pdX,
            double pdY,
            double pdDist,
            double pdAlpha,
            double pdDelta,
            double lambda
    ) {
    }

    public static SidecarMotors parse(Path file) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            throw new IllegalStateException("读取侧车文件失败：" + file, e);
        }
        return parse(text);
    }

    /**
     * @throws ScanException {@code MALFORMED_SIDECAR}：行数不足或数值个数不够
     */
    public static SidecarMotors parse(String text) {
        List<String> lines = text == null ? List.of() : text.lines().toList();
        if (lines.size() <= CALIBRATION_LINE) {
            throw new ScanException(ScanException.Kind.MALFORMED_SIDECAR,
                    "侧车文件只有 " + lines.size() + " 行，至少需要 " + (CALIBRATION_LINE + 1) + " 行");
        }
        List<Double> motors = findNumbers(lines.get(MOTOR_LINE));
        List<Double> calibration = findNumbers(lines.get(CALIBRATION_LINE));
        if (motors.size() < 7) {
            throw new ScanException(ScanException.Kind.MALFORMED_SIDECAR,
                    "电机位置行只找到 " + motors.size() + " 个数值，至少需要 7 个");
        }
        if (calibration.size() < 6) {
            throw new ScanException(ScanException.Kind.MALFORMED_SIDECAR,
                    "标定参数行只找到 " + calibration.size() + " 个数值，至少需要 6 个");
        }
        return new SidecarMotors(
                motors.get(0),
                motors.get(2),
                motors.get(3),
                motors.get(4),
                motors.get(5),
                motors.get(6),
                calibration.get(0),
                calibration.get(1),
                calibration.get(2),
                calibration.get(3),
                calibration.get(4),
                calibration.get(5)
        );
    }

    static List<Double> findNumbers(String line) {
        List<Double> numbers = new ArrayList<>();
        Matcher m = NUMBER.matcher(line);
        while (m.find()) {
            numbers.add(Double.parseDouble(m.group().replace(" ", "")));
        }
        return numbers;
    }
}
