package io.github.samzhu.gamulti.model;

import java.util.List;
import java.util.Map;

/**
 * 即時報表結果（最近 30 分鐘），不會被快取。
 *
 * @param propertyId Property 數字 ID
 * @param propertyName Property 顯示名稱
 * @param lookbackMinutes 回溯分鐘數，固定為 30
 * @param dimensionHeaders dimension 欄位名稱
 * @param metricHeaders metric 欄位名稱
 * @param rows 資料列
 * @param rowCount 回傳列數
 */
public record RealtimeResult(
    String propertyId,
    String propertyName,
    int lookbackMinutes,
    List<String> dimensionHeaders,
    List<String> metricHeaders,
    List<Map<String, Object>> rows,
    int rowCount
) {
    public static final int LOOKBACK_MINUTES = 30;
}
