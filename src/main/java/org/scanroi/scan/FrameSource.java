package org.scanroi.scan;

/**
 * 帧读取协作方：按帧标识读取一张固定尺寸的探测器帧。
 * <p>
 * 读取是唯一的 I/O 边界，由调用方提供的实现负责；{@link ScanAssembler} 只按顺序调用它。
 */
@FunctionalInterface
public interface FrameSource {

    Frame read(String frameId);
}
