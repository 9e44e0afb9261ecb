package io.github.samzhu.gamulti.client;

import java.util.List;
import java.util.Map;

/**
 * Data API 回傳的原始表格資料，所有值皆為字串，尚未轉型。
 *
 * @param dimensionHeaders dimension 欄位名稱
 * @param metricHeaders metric 欄位名稱
 * @param rows 資料列
 * @param totalRowCount API 回報的總列數（不受 row limit 影響）
 * @param totals API 提供的 TOTAL 彙總值（metric → 值），未提供時為空
 */
public record ReportTable(
    List<String> dimensionHeaders,
    List<String> metricHeaders,
    List<Row> rows,
    int totalRowCount,
    Map<String, String> totals
) {
    public ReportTable {
        dimensionHeaders = List.copyOf(dimensionHeaders);
        metricHeaders = List.copyOf(metricHeaders);
        rows = List.copyOf(rows);
        totals = totals == null ? Map.of() : Map.copyOf(totals);
    }

    /**
     * 單一資料列。
     *
     * @param dimensionValues 依 {@code dimensionHeaders} 順序排列的值
     * @param metricValues 依 {@code metricHeaders} 順序排列的值
     */
    public record Row(
        List<String> dimensionValues,
        List<String> metricValues
    ) {
        public Row {
            dimensionValues = List.copyOf(dimensionValues);
            metricValues = List.copyOf(metricValues);
        }
    }
}
