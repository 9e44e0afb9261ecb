package io.github.samzhu.gamulti.client;

/**
 * 外部 GA4 API 呼叫的失敗類型。
 */
public enum ApiFailure {
    AUTH,
    NETWORK,
    QUOTA_EXCEEDED,
    INVALID_REQUEST,
    TIMEOUT,
    UNKNOWN
}
