package io.github.samzhu.gamulti.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.github.samzhu.gamulti.client.ReportTable;
import io.github.samzhu.gamulti.model.ReportData;

/**
 * 將 Data API 的字串表格轉為具型別的資料列。
 *
 * <p>dimension 值保留字串；metric 值含小數點時轉為 {@link Double}，
 * 否則轉為 {@link Long}，無法轉換時保留原字串。
 */
public final class RowNormalizer {

    private RowNormalizer() {
        // 工具類不允許實例化
    }

    public static ReportData normalize(ReportTable table) {
        List<Map<String, Object>> rows = new ArrayList<>(table.rows().size());
        for (ReportTable.Row row : table.rows()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 0; i < table.dimensionHeaders().size() && i < row.dimensionValues().size(); i++) {
                values.put(table.dimensionHeaders().get(i), row.dimensionValues().get(i));
            }
            for (int i = 0; i < table.metricHeaders().size() && i < row.metricValues().size(); i++) {
                values.put(table.metricHeaders().get(i), convertMetric(row.metricValues().get(i)));
            }
            rows.add(Collections.unmodifiableMap(values));
        }

        Map<String, Number> totals = new LinkedHashMap<>();
        for (String metric : table.metricHeaders()) {
            if (convertMetric(table.totals().get(metric)) instanceof Number number) {
                totals.put(metric, number);
            }
        }

        return new ReportData(
            table.dimensionHeaders(),
            table.metricHeaders(),
            rows,
            table.totalRowCount(),
            Collections.unmodifiableMap(totals)
        );
    }

    /**
     * 轉換單一 metric 值。
     */
    public static Object convertMetric(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            if (raw.contains(".")) {
                return Double.parseDouble(raw);
            }
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            return raw;
        }
    }
}
