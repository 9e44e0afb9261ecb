package io.github.samzhu.gamulti.client;

/**
 * GA4 Admin / Data API 呼叫失敗例外。
 *
 * <p>由傳輸層轉接器拋出，上層服務再依情境轉換為
 * {@link io.github.samzhu.gamulti.exception.DiscoveryFailedException} 或
 * {@link io.github.samzhu.gamulti.exception.QueryFailedException}。
 */
public class ApiClientException extends RuntimeException {

    private final ApiFailure failure;
    private final String operation;

    public ApiClientException(ApiFailure failure, String operation, String message) {
        super(String.format("%s failed (%s): %s", operation, failure, message));
        this.failure = failure;
        this.operation = operation;
    }

    public ApiClientException(ApiFailure failure, String operation, String message, Throwable cause) {
        super(String.format("%s failed (%s): %s", operation, failure, message), cause);
        this.failure = failure;
        this.operation = operation;
    }

    public ApiFailure getFailure() {
        return failure;
    }

    public String getOperation() {
        return operation;
    }
}
