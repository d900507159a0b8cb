package org.scanroi.filesystem.dto;

import java.util.List;

/**
 * {@code scan_list_frames} 的返回结果。
 *
 * @param rootId     根目录标识
 * @param folder     帧目录（相对 root，统一使用 / 分隔）
 * @param frameIds   原始帧文件名，按 4 位序号排序
 * @param sidecarIds 侧车文件名，按 4 位序号排序
 */
public record FrameListResult(
        String rootId,
        String folder,
        List<String> frameIds,
        List<String> sidecarIds
) {
}
