package org.scanroi.scan;

import java.util.List;

/**
 * ROI 积分时使用的掩膜：整次扫描共用一个，或每个扫描点各用一个（用于跟随移动的峰）。
 */
public sealed interface RoiSelection permits RoiSelection.Fixed, RoiSelection.PerPoint {

    /**
     * 第 index 个扫描点使用的掩膜。
     */
    RoiMask maskFor(int index);

    static RoiSelection fixed(RoiMask mask) {
        return new Fixed(mask);
    }

    static RoiSelection perPoint(List<RoiMask> masks) {
        return new PerPoint(masks);
    }

    record Fixed(RoiMask mask) implements RoiSelection {

        @Override
        public RoiMask maskFor(int index) {
            return mask;
        }
    }

    record PerPoint(List<RoiMask> masks) implements RoiSelection {

        public PerPoint {
            masks = List.copyOf(masks);
        }

        @Override
        public RoiMask maskFor(int index) {
            return masks.get(index);
        }
    }
}
