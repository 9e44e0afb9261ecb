package io.github.samzhu.gamulti.client.google;

import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;

import io.github.samzhu.gamulti.client.ApiClientException;
import io.github.samzhu.gamulti.client.ApiFailure;

/**
 * 將 Google API 的 gRPC 狀態碼轉換為 {@link ApiFailure}。
 */
final class GoogleApiErrors {

    private GoogleApiErrors() {
        // 工具類不允許實例化
    }

    static ApiFailure classify(StatusCode.Code code) {
        if (code == null) {
            return ApiFailure.UNKNOWN;
        }
        return switch (code) {
            case UNAUTHENTICATED, PERMISSION_DENIED -> ApiFailure.AUTH;
            case RESOURCE_EXHAUSTED -> ApiFailure.QUOTA_EXCEEDED;
            case INVALID_ARGUMENT, NOT_FOUND, FAILED_PRECONDITION, OUT_OF_RANGE -> ApiFailure.INVALID_REQUEST;
            case UNAVAILABLE, ABORTED -> ApiFailure.NETWORK;
            case DEADLINE_EXCEEDED, CANCELLED -> ApiFailure.TIMEOUT;
            default -> ApiFailure.UNKNOWN;
        };
    }

    static ApiClientException translate(String operation, ApiException e) {
        StatusCode.Code code = e.getStatusCode() != null ? e.getStatusCode().getCode() : null;
        return new ApiClientException(classify(code), operation, e.getMessage(), e);
    }
}
