package org.scanroi.filesystem;

import org.scanroi.scan.Frame;
import org.scanroi.scan.FrameSource;
import org.scanroi.scan.ScanException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 目录里的 Pilatus 原始帧（{@code .raw}）：无文件头，按行优先存放的小端无符号 32 位计数。
 * <p>
 * 帧标识就是目录内的文件名；{@link #listOrdered()} 按文件名中的 4 位序号排序（而不是按字典序）。
 */
public class RawFrameStore implements FrameSource {

    private final Path folder;
    private final int rows;
    private final int columns;
    private final String frameExtension;
    private final String sidecarExtension;

    public RawFrameStore(Path folder, int rows, int columns, String frameExtension, String sidecarExtension) {
        this.folder = folder.toAbsolutePath().normalize();
        this.rows = rows;
        this.columns = columns;
        this.frameExtension = frameExtension.toLowerCase(Locale.ROOT);
        this.sidecarExtension = sidecarExtension.toLowerCase(Locale.ROOT);
    }

    public static RawFrameStore of(Path folder, ScanServerProperties properties) {
        return new RawFrameStore(folder, properties.getDetectorRows(), properties.getDetectorColumns(),
                properties.getFrameExtension(), properties.getSidecarExtension());
    }

    public Path folder() {
        return folder;
    }

    /**
     * 目录内的原始帧文件名，按序号排序。
     */
    public List<String> listOrdered() {
        return listBySuffix(frameExtension);
    }

    /**
     * 目录内的侧车文件名，按序号排序。
     */
    public List<String> listSidecars() {
        return listBySuffix(sidecarExtension);
    }

    @Override
    public Frame read(String frameId) {
        Path file = locate(frameId);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new IllegalStateException("读取帧文件失败：" + frameId, e);
        }
        long expected = (long) rows * columns * Integer.BYTES;
        if (bytes.length != expected) {
            throw new ScanException(ScanException.Kind.FRAME_SHAPE_MISMATCH,
                    "帧文件 " + frameId + " 大小 " + bytes.length + " 字节，与探测器 " + rows + "x" + columns
                            + " 期望的 " + expected + " 字节不一致");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        double[] counts = new double[rows * columns];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = Integer.toUnsignedLong(buffer.getInt());
        }
        return Frame.of(rows, columns, counts);
    }

    /**
     * 帧标识只能是目录内的文件名，不允许带目录层级。
     */
    public Path locate(String frameId) {
        if (frameId == null || frameId.isBlank()) {
            throw new IllegalArgumentException("帧标识不能为空");
        }
        Path file = folder.resolve(frameId).normalize();
        if (!folder.equals(file.getParent())) {
            throw new IllegalArgumentException("帧标识必须是目录内的文件名：" + frameId);
        }
        if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("帧文件不存在：" + frameId);
        }
        return file;
    }

    private List<String> listBySuffix(String suffix) {
        List<String> names;
        try (Stream<Path> stream = Files.list(folder)) {
            names = stream
                    .filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS))
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.toLowerCase(Locale.ROOT).endsWith(suffix))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new IllegalStateException("列出帧目录失败：" + folder, e);
        }
        // 每个文件名都必须带序号，单个文件时排序不会触发比较，这里逐个校验
        for (String name : names) {
            FrameIds.sequenceNumber(name);
        }
        names.sort(FrameIds.BY_SEQUENCE);
        return names;
    }
}
