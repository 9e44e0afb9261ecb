package io.github.samzhu.gamulti.exception;

/**
 * 對外回報的錯誤分類。
 *
 * <p>工具回應中的 {@code error_kind} 欄位即為此列舉的名稱。
 */
public enum ErrorKind {

    /** Admin API 無法連線或未授權，無法取得 Property 清單 */
    DISCOVERY_FAILED,

    /** 模糊比對找不到超過門檻的 Property */
    PROPERTY_NOT_FOUND,

    /** 多個 Property 分數相同，僅作為提示，不是硬性錯誤 */
    AMBIGUOUS_PROPERTY,

    /** 單一 Property 的 Data API 查詢失敗 */
    QUERY_FAILED,

    /** 日期表達式無法解析，或起訖日期順序錯誤 */
    UNPARSEABLE_DATE,

    /** 啟動時組態錯誤（例如缺少憑證路徑） */
    CONFIGURATION_ERROR,

    /** 工具參數缺漏或格式錯誤 */
    INVALID_ARGUMENT,

    /** 未預期的內部錯誤 */
    INTERNAL_ERROR
}
