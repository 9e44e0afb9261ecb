package io.github.samzhu.gamulti.dto.tool;

import io.github.samzhu.gamulti.model.QueryResult;

/**
 * query_analytics 工具回應。
 *
 * @param dateRange 日期區間
 * @param result 查詢結果
 */
public record AnalyticsQueryResponse(
    DateRangeView dateRange,
    QueryResult result
) {}
