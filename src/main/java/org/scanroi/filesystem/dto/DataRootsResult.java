package org.scanroi.filesystem.dto;

import java.util.List;

/**
 * {@code scan_list_roots} 的返回结果。
 *
 * @param roots 允许读取的根目录
 */
public record DataRootsResult(List<DataRoot> roots) {
}
