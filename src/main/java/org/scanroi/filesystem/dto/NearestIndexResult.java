package org.scanroi.filesystem.dto;

/**
 * {@code scan_nearest_index} 的返回结果。
 *
 * @param scanId 会话标识
 * @param column 列名
 * @param target 目标值
 * @param index  最接近的扫描下标
 * @param value  该下标处的列值
 */
public record NearestIndexResult(String scanId, String column, double target, int index, double value) {
}
