package org.scanroi.filesystem;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.scanroi.scan.MetadataRow;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 扫描表读取器：读取线站控制软件导出的 .csv（首行为表头，每行一个扫描点）。
 * <p>
 * 表头去掉首尾空白并统一转为小写；单元格按数值解析，空单元格记为 NaN，非数值单元格直接报错。
 */
public final class MetadataCsvReader {

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    private MetadataCsvReader() {
    }

    /**
     * @param columns 规范化后的列名（按表头顺序）
     * @param rows    数据行（扫描顺序）
     */
    public record MetadataTable(List<String> columns, List<MetadataRow> rows) {
    }

    public static MetadataTable read(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new IllegalStateException("读取扫描表失败：" + file, e);
        }
    }

    public static MetadataTable read(String csvText) {
        try {
            return read(new StringReader(csvText));
        } catch (IOException e) {
            throw new IllegalStateException("解析扫描表失败", e);
        }
    }

    private static MetadataTable read(Reader reader) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<MetadataRow> rows = new ArrayList<>();
        List<String> columns = new ArrayList<>();
        try (MappingIterator<Map<String, String>> it = CSV_MAPPER.readerForMapOf(String.class).with(schema).readValues(reader)) {
            // 表头在首次取值前解析完毕；只有表头没有数据行时同样能拿到列名
            boolean hasRows = it.hasNextValue();
            CsvSchema header = ((CsvParser) it.getParser()).getSchema();
            for (String name : header.getColumnNames()) {
                columns.add(MetadataRow.normalizeColumn(name));
            }
            int line = 1;
            while (hasRows && it.hasNextValue()) {
                Map<String, String> raw = it.nextValue();
                line++;
                Map<String, Double> values = new LinkedHashMap<>();
                for (Map.Entry<String, String> cell : raw.entrySet()) {
                    values.put(MetadataRow.normalizeColumn(cell.getKey()), parseCell(cell.getValue(), cell.getKey(), line));
                }
                rows.add(MetadataRow.of(values));
            }
        }
        return new MetadataTable(List.copyOf(columns), List.copyOf(rows));
    }

    private static double parseCell(String value, String column, int line) {
        if (value == null || value.isBlank()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("扫描表第 " + line + " 行列 " + column.trim() + " 不是数值：" + value, e);
        }
    }
}
