package io.github.samzhu.gamulti.client;

import java.util.List;

/**
 * 即時報表請求（最近 30 分鐘）。
 *
 * @param propertyId Property 數字 ID
 * @param metrics metric 名稱
 * @param dimensions dimension 名稱
 * @param rowLimit 最大回傳列數
 */
public record RealtimeRequest(
    String propertyId,
    List<String> metrics,
    List<String> dimensions,
    int rowLimit
) {
    public RealtimeRequest {
        metrics = List.copyOf(metrics);
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    }
}
