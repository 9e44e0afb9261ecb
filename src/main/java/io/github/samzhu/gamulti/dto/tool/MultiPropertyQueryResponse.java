package io.github.samzhu.gamulti.dto.tool;

import java.util.List;

import io.github.samzhu.gamulti.model.MultiPropertyReport;
import io.github.samzhu.gamulti.model.QueryResult;

/**
 * query_multiple_properties 工具回應。
 *
 * @param dateRange 日期區間
 * @param metrics 查詢的 metric
 * @param dimensions 查詢的 dimension
 * @param results 依輸入順序排列的結果
 * @param summary 彙總
 */
public record MultiPropertyQueryResponse(
    DateRangeView dateRange,
    List<String> metrics,
    List<String> dimensions,
    List<QueryResult> results,
    MultiPropertyReport.Summary summary
) {
    public static MultiPropertyQueryResponse from(MultiPropertyReport report, String description) {
        return new MultiPropertyQueryResponse(
            DateRangeView.of(report.dateRange(), description),
            report.metrics(),
            report.dimensions(),
            report.results(),
            report.summary()
        );
    }
}
