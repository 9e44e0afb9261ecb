package io.github.samzhu.gamulti.model;

import java.util.List;

/**
 * 與 Property 無關的查詢規格，可套用到任意數量的 Property。
 *
 * @param metrics metric 名稱，至少一個
 * @param dimensions dimension 名稱，可為空
 * @param dateRange 日期區間
 * @param rowLimit 最大回傳列數
 * @param filters 篩選條件，可為空
 * @param orderBy 排序設定，可為 null
 */
public record QuerySpec(
    List<String> metrics,
    List<String> dimensions,
    DateRange dateRange,
    int rowLimit,
    List<FieldFilter> filters,
    OrderSpec orderBy
) {
    public QuerySpec {
        if (metrics == null || metrics.isEmpty()) {
            throw new IllegalArgumentException("At least one metric is required (e.g. activeUsers, sessions)");
        }
        if (dateRange == null) {
            throw new IllegalArgumentException("A date range is required");
        }
        if (rowLimit <= 0) {
            throw new IllegalArgumentException("Row limit must be positive, got: " + rowLimit);
        }
        metrics = List.copyOf(metrics);
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        filters = filters == null ? List.of() : List.copyOf(filters);
    }

    /**
     * 建立不含篩選與排序的查詢規格。
     */
    public static QuerySpec of(List<String> metrics, List<String> dimensions, DateRange dateRange, int rowLimit) {
        return new QuerySpec(metrics, dimensions, dateRange, rowLimit, List.of(), null);
    }
}
