package io.github.samzhu.gamulti.model;

import java.util.List;
import java.util.Map;

/**
 * 正規化後的報表資料，為查詢快取實際儲存的內容。
 *
 * <p>{@code rows} 中每一列為依欄位順序排列的不可變 Map；
 * metric 值已轉為 {@link Long} 或 {@link Double}，無法轉換者保留字串。
 *
 * @param dimensionHeaders dimension 欄位名稱
 * @param metricHeaders metric 欄位名稱
 * @param rows 資料列
 * @param totalRows API 回報的總列數，可能大於 {@code rows.size()}
 * @param apiTotals API 提供的 TOTAL 彙總值，未提供時為空
 */
public record ReportData(
    List<String> dimensionHeaders,
    List<String> metricHeaders,
    List<Map<String, Object>> rows,
    int totalRows,
    Map<String, Number> apiTotals
) {
    public ReportData {
        dimensionHeaders = List.copyOf(dimensionHeaders);
        metricHeaders = List.copyOf(metricHeaders);
        rows = List.copyOf(rows);
        apiTotals = apiTotals == null ? Map.of() : apiTotals;
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * 回傳的列數是否少於 API 回報的總列數。
     */
    public boolean isTruncated() {
        return totalRows > rows.size();
    }
}
