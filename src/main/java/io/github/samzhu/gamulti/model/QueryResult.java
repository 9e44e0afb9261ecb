package io.github.samzhu.gamulti.model;

import java.util.List;
import java.util.Map;

import io.github.samzhu.gamulti.exception.ErrorKind;
import io.github.samzhu.gamulti.model.MatchResult.MatchType;

/**
 * 單一 Property 的查詢結果，採用標記式結果 (tagged result)。
 *
 * <p>成功時 {@code error} 為 null 並帶有資料列；失敗時 {@code error} 有值且資料列為空。
 * 每次呼叫都會重新建立，不會持久化。
 *
 * @param propertyRef 呼叫端傳入的原始 Property 字串
 * @param propertyId 解析後的 Property ID，解析失敗時為 null
 * @param propertyName Property 顯示名稱，解析失敗時為 null
 * @param match 解析資訊，解析失敗時為 null
 * @param dateRange 查詢日期區間
 * @param dimensionHeaders dimension 欄位名稱
 * @param metricHeaders metric 欄位名稱
 * @param rows 資料列
 * @param rowCount 回傳列數
 * @param totalRows API 回報的總列數
 * @param totals API 提供的 TOTAL 彙總值
 * @param error 錯誤資訊，成功時為 null
 */
public record QueryResult(
    String propertyRef,
    String propertyId,
    String propertyName,
    MatchInfo match,
    DateRange dateRange,
    List<String> dimensionHeaders,
    List<String> metricHeaders,
    List<Map<String, Object>> rows,
    int rowCount,
    int totalRows,
    Map<String, Number> totals,
    ErrorDetail error
) {

    /**
     * 建立成功結果。
     */
    public static QueryResult success(String propertyRef, MatchInfo match, Property property,
                                      DateRange dateRange, ReportData data) {
        return new QueryResult(
            propertyRef,
            property.numericId(),
            property.displayName(),
            match,
            dateRange,
            data.dimensionHeaders(),
            data.metricHeaders(),
            data.rows(),
            data.rowCount(),
            data.totalRows(),
            data.apiTotals(),
            null
        );
    }

    /**
     * 建立失敗結果。
     *
     * @param property 已解析的 Property，解析階段即失敗時為 null
     */
    public static QueryResult failure(String propertyRef, MatchInfo match, Property property,
                                      DateRange dateRange, ErrorDetail error) {
        return new QueryResult(
            propertyRef,
            property != null ? property.numericId() : null,
            property != null ? property.displayName() : null,
            match,
            dateRange,
            List.of(),
            List.of(),
            List.of(),
            0,
            0,
            Map.of(),
            error
        );
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Property 解析資訊。
     *
     * @param confidence 信心分數
     * @param matchedOn 比對方式
     * @param ambiguousWith 與最佳結果同分的其他 Property 名稱
     * @param notice 同分時的 {@link ErrorKind#AMBIGUOUS_PROPERTY} 提示，否則為 null
     */
    public record MatchInfo(
        double confidence,
        MatchType matchedOn,
        List<String> ambiguousWith,
        ErrorDetail notice
    ) {
        public MatchInfo {
            ambiguousWith = ambiguousWith == null ? List.of() : List.copyOf(ambiguousWith);
        }

        /**
         * 由最佳比對結果與同分候選建立解析資訊。
         */
        public static MatchInfo of(MatchResult best, List<MatchResult> ties) {
            List<String> names = ties.stream()
                .map(m -> m.property().displayName() + " (" + m.property().numericId() + ")")
                .toList();
            ErrorDetail notice = names.isEmpty() ? null : new ErrorDetail(
                ErrorKind.AMBIGUOUS_PROPERTY,
                String.format("'%s' matched %d properties equally well; using %s (%s)",
                    best.property().displayName(), names.size() + 1,
                    best.property().displayName(), best.property().numericId()),
                "Pass the numeric property ID to select a different property");
            return new MatchInfo(Math.round(best.confidence() * 1000) / 1000.0, best.matchedOn(), names, notice);
        }
    }
}
