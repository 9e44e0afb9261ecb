package io.github.samzhu.gamulti.exception;

/**
 * 所有領域錯誤的基底例外。
 *
 * <p>每個例外都帶有 {@link ErrorKind} 與一段可操作的提示（hint），
 * 工具層會將其轉換為 {@code {error_kind, message, hint}} 結構回傳給 Agent，
 * 不會把堆疊追蹤暴露在回應中。
 */
public class AnalyticsException extends RuntimeException {

    private final ErrorKind kind;
    private final String hint;

    public AnalyticsException(ErrorKind kind, String message, String hint) {
        super(message);
        this.kind = kind;
        this.hint = hint;
    }

    public AnalyticsException(ErrorKind kind, String message, String hint, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.hint = hint;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getHint() {
        return hint;
    }
}
