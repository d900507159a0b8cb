package org.scanroi.scan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class ScanFixtures {

    private ScanFixtures() {
    }

    static MetadataRow row72(double l, double monitor, double foils) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("h", 0.0);
        values.put("k", 0.0);
        values.put("l", l);
        values.put("monitor", monitor);
        values.put("foils", foils);
        return MetadataRow.of(values);
    }

    /**
     * monitor=1、不插衰减片：归一化帧与原始帧相同，便于直接断言。
     */
    static Scan unitScan(List<Frame> frames) {
        List<MetadataRow> rows = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        Map<String, Frame> byId = new LinkedHashMap<>();
        for (int i = 0; i < frames.size(); i++) {
            rows.add(row72(i, 1, 0));
            String id = String.format("scan_%04d.raw", i);
            ids.add(id);
            byId.put(id, frames.get(i));
        }
        return ScanAssembler.assemble(rows, ids, byId::get, FoilAttenuation.of(0, 0, 0, 0), ScanLayout.BL72);
    }

    static Scan unitScan(Frame... frames) {
        return unitScan(List.of(frames));
    }

    /**
     * 背景为 background，(row, column) 处有一个热点像素。
     */
    static Frame hotPixel(int rows, int columns, double background, int row, int column, double value) {
        double[] data = new double[rows * columns];
        Arrays.fill(data, background);
        data[row * columns + column] = value;
        return Frame.of(rows, columns, data);
    }
}
