package io.github.samzhu.gamulti.exception;

import io.github.samzhu.gamulti.client.ApiFailure;

/**
 * 單一 Property 的 Data API 查詢失敗例外。
 *
 * <p>在多 Property 查詢中，此錯誤只會記錄在該 Property 的結果上，不會中止整批查詢。
 */
public class QueryFailedException extends AnalyticsException {

    private final String propertyId;
    private final ApiFailure failure;

    public QueryFailedException(String propertyId, ApiFailure failure, String detail, Throwable cause) {
        super(ErrorKind.QUERY_FAILED,
            String.format("Query failed for property %s (%s): %s", propertyId, failure, detail),
            hintFor(failure),
            cause);
        this.propertyId = propertyId;
        this.failure = failure;
    }

    public String getPropertyId() {
        return propertyId;
    }

    public ApiFailure getFailure() {
        return failure;
    }

    /**
     * 依失敗類型產生提示文字。
     */
    public static String hintFor(ApiFailure failure) {
        return switch (failure) {
            case INVALID_REQUEST -> "Check metric and dimension names with get_property_metadata";
            case QUOTA_EXCEEDED -> "GA4 quota exhausted for this property; retry later or narrow the date range";
            case AUTH -> "The service account lacks access to this property";
            case TIMEOUT -> "The request timed out; retry or reduce the date range and row limit";
            case NETWORK -> "The Google Analytics Data API could not be reached; retry shortly";
            default -> "Retry the query; if it keeps failing verify the property with list_properties";
        };
    }
}
