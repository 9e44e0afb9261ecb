package io.github.samzhu.gamulti.model;

import java.util.List;
import java.util.Map;

/**
 * 多 Property 查詢結果。
 *
 * <p>{@code results} 的順序與輸入的 Property 字串順序一致。
 *
 * @param dateRange 查詢日期區間
 * @param metrics 查詢的 metric
 * @param dimensions 查詢的 dimension
 * @param results 每個 Property 的結果（含失敗者）
 * @param summary 彙總
 */
public record MultiPropertyReport(
    DateRange dateRange,
    List<String> metrics,
    List<String> dimensions,
    List<QueryResult> results,
    Summary summary
) {

    /**
     * 彙總資訊。
     *
     * @param propertiesQueried 查詢的 Property 數
     * @param propertiesSuccessful 成功數
     * @param propertiesFailed 失敗數
     * @param totals 各 metric 在成功結果中的加總（僅限全為數值的 metric）
     * @param totalsSource 加總來源
     * @param caveat 加總可能偏低時的說明，否則為 null
     */
    public record Summary(
        int propertiesQueried,
        int propertiesSuccessful,
        int propertiesFailed,
        Map<String, Number> totals,
        TotalsSource totalsSource,
        String caveat
    ) {}

    /**
     * 加總的資料來源。
     */
    public enum TotalsSource {
        /** 全部來自 API 的 TOTAL 彙總列 */
        API_TOTALS,
        /** 全部由回傳的資料列加總 */
        ROW_SUM,
        /** 兩者混合 */
        MIXED,
        /** 沒有成功結果可加總 */
        NONE
    }
}
