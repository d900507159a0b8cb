package org.scanroi.filesystem;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

public final class FrameFixtures {

    private FrameFixtures() {
    }

    /**
     * 按 Pilatus .raw 约定写一帧：行优先、小端无符号 32 位。
     */
    public static Path writeRaw(Path file, long[] counts) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(counts.length * Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (long count : counts) {
            buffer.putInt((int) count);
        }
        return Files.write(file, buffer.array());
    }

    public static Path writeRaw(Path file, int rows, int columns, long background, int hotRow, int hotColumn, long hotValue) throws IOException {
        long[] counts = new long[rows * columns];
        Arrays.fill(counts, background);
        counts[hotRow * columns + hotColumn] = hotValue;
        return writeRaw(file, counts);
    }

    /**
     * 一个最小的 .raw.pdi 侧车文本：第 4 行电机位置，第 6 行标定参数。
     */
    public static String sidecarText(double th, double tth) {
        return String.join("\n",
                "# Diffractometer Parameters",
                "# Scan: 12",
                "# Motors:",
                "All Motors; th=" + th + "; skip=0.5; tth=" + tth + "; chi=90.0; phi=-1.25; gamma=0.0; mu=2.5e-1;",
                "# Calibration:",
                "PD_X=240.5 PD_Y=98.0 PD_DIST=1000.25 PD_ALPHA=0.0 PD_DELTA=-12.5 LAMBDA=1.0332",
                "");
    }
}
