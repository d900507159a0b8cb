package org.scanroi.scan;

import java.util.List;

/**
 * 衰减片（foil）透射修正模型。
 * <p>
 * 光路上有 4 片衰减片，数据文件里用十进制数字记录插入状态，例如插入第 3、4 片记为 {@code 11}（即 {@code 0011}）。
 * 修正因子为 {@code exp(Σ digit_i × c_i)}：叠加的衰减片对数衰减相加。
 *
 * @param coefficients 每片衰减片的系数，长度固定为 4，顺序与编码的最高位到最低位一致
 */
public record FoilAttenuation(List<Double> coefficients) {

    public static final int FOIL_COUNT = 4;

    public FoilAttenuation {
        if (coefficients == null || coefficients.size() != FOIL_COUNT) {
            throw new ScanException(ScanException.Kind.INVALID_FOIL_COEFFICIENTS,
                    "衰减片系数必须正好 " + FOIL_COUNT + " 个：" + coefficients);
        }
        for (Double c : coefficients) {
            if (c == null || !Double.isFinite(c)) {
                throw new ScanException(ScanException.Kind.INVALID_FOIL_COEFFICIENTS, "衰减片系数必须是有限实数：" + coefficients);
            }
        }
        coefficients = List.copyOf(coefficients);
    }

    public static FoilAttenuation of(double c0, double c1, double c2, double c3) {
        return new FoilAttenuation(List.of(c0, c1, c2, c3));
    }

    /**
     * 计算某个插入编码对应的修正因子（恒为正）。
     */
    public double attenuation(long foilCode) {
        int[] digits = decode(foilCode);
        double exponent = 0;
        for (int i = 0; i < FOIL_COUNT; i++) {
            exponent += digits[i] * coefficients.get(i);
        }
        return Math.exp(exponent);
    }

    /**
     * 把十进制插入编码展开为 4 位（高位在前，左侧补零），例如 {@code 11 -> [0,0,1,1]}。
     *
     * @throws ScanException {@code INVALID_FOIL_CODE}：负数、超过 4 位，或含有 0/1 以外的数字
     */
    public static int[] decode(long foilCode) {
        if (foilCode < 0) {
            throw new ScanException(ScanException.Kind.INVALID_FOIL_CODE, "衰减片编码不能为负：" + foilCode);
        }
        String text = Long.toString(foilCode);
        if (text.length() > FOIL_COUNT) {
            throw new ScanException(ScanException.Kind.INVALID_FOIL_CODE, "衰减片编码超过 " + FOIL_COUNT + " 位：" + foilCode);
        }
        int[] digits = new int[FOIL_COUNT];
        int pad = FOIL_COUNT - text.length();
        for (int i = 0; i < text.length(); i++) {
            int digit = text.charAt(i) - '0';
            if (digit != 0 && digit != 1) {
                throw new ScanException(ScanException.Kind.INVALID_FOIL_CODE, "衰减片编码只能由 0/1 组成：" + foilCode);
            }
            digits[pad + i] = digit;
        }
        return digits;
    }

    /**
     * 把表格里读到的数值转成插入编码；必须是整数值。
     */
    public static long codeOf(double value) {
        if (!Double.isFinite(value) || value != Math.rint(value)) {
            throw new ScanException(ScanException.Kind.INVALID_FOIL_CODE, "衰减片编码必须是整数：" + value);
        }
        return (long) value;
    }
}
