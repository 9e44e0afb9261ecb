package io.github.samzhu.gamulti.model;

import io.github.samzhu.gamulti.exception.AnalyticsException;
import io.github.samzhu.gamulti.exception.ErrorKind;

/**
 * 結構化錯誤物件，對應工具回應中的 {@code {error_kind, message, hint}}。
 *
 * @param errorKind 錯誤分類
 * @param message 錯誤說明，包含失敗的 Property 或步驟
 * @param hint 可操作的建議
 */
public record ErrorDetail(
    ErrorKind errorKind,
    String message,
    String hint
) {
    public static ErrorDetail from(AnalyticsException e) {
        return new ErrorDetail(e.getKind(), e.getMessage(), e.getHint());
    }
}
