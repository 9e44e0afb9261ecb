package io.github.samzhu.gamulti.exception;

import io.github.samzhu.gamulti.client.ApiFailure;

/**
 * Property 探索失敗例外。
 *
 * <p>Admin API 呼叫失敗（授權錯誤、網路錯誤、逾時）時拋出。
 * 失敗結果不會寫入快取，下次呼叫會重新嘗試探索。
 */
public class DiscoveryFailedException extends AnalyticsException {

    private final ApiFailure failure;

    public DiscoveryFailedException(ApiFailure failure, String detail, Throwable cause) {
        super(ErrorKind.DISCOVERY_FAILED,
            String.format("Failed to discover GA4 properties (%s): %s", failure, detail),
            hintFor(failure),
            cause);
        this.failure = failure;
    }

    public ApiFailure getFailure() {
        return failure;
    }

    private static String hintFor(ApiFailure failure) {
        return switch (failure) {
            case AUTH -> "Check that the service account credentials are valid and have been granted "
                + "Viewer access to the GA4 accounts";
            case TIMEOUT, NETWORK -> "The Google Analytics Admin API could not be reached; retry list_properties shortly";
            default -> "Retry list_properties; if the problem persists verify the service account setup";
        };
    }
}
