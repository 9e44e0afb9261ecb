package io.github.samzhu.gamulti.service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.gamulti.client.ApiClientException;
import io.github.samzhu.gamulti.client.ApiFailure;

/**
 * 外部 GA4 API 呼叫的逾時保護。
 *
 * <p>每次呼叫都在專用的執行緒池上執行，超過 {@code ga.query.timeout} 即回報
 * {@link ApiFailure#TIMEOUT}。逾時只影響發出呼叫的那一個 Property，
 * 同一批次的其他 Property 不會被取消。
 *
 * <p>所有失敗都統一轉為 {@link ApiClientException}，呼叫端只需處理一種例外。
 */
public class ApiCallGuard {

    private static final Logger log = LoggerFactory.getLogger(ApiCallGuard.class);

    static final String MASKED_DETAIL = "The Google Analytics API returned an error (details hidden by configuration)";

    private final Executor executor;
    private final Duration timeout;
    private final boolean maskDetails;

    public ApiCallGuard(Executor executor, Duration timeout, boolean maskDetails) {
        this.executor = executor;
        this.timeout = timeout;
        this.maskDetails = maskDetails;
    }

    /**
     * 在逾時限制內執行外部呼叫。
     *
     * @param operation 操作名稱，用於日誌與錯誤訊息，例如 {@code runReport(123)}
     * @param call 實際呼叫
     * @return 呼叫結果
     * @throws ApiClientException 呼叫失敗或逾時
     */
    public <T> T call(String operation, Supplier<T> call) {
        long startTime = System.currentTimeMillis();
        try {
            T result = CompletableFuture.supplyAsync(call, executor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .join();
            log.debug("{} completed in {}ms", operation, System.currentTimeMillis() - startTime);
            return result;
        } catch (CompletionException e) {
            throw translate(operation, e.getCause() != null ? e.getCause() : e);
        } catch (RejectedExecutionException e) {
            log.warn("{} rejected: API call pool saturated", operation);
            throw new ApiClientException(ApiFailure.UNKNOWN, operation, "API call pool is saturated", e);
        }
    }

    /**
     * 取得對外回報的錯誤細節；啟用 {@code ga.error.mask-details} 時回傳通用訊息。
     */
    public String detail(ApiClientException e) {
        return maskDetails ? MASKED_DETAIL : e.getMessage();
    }

    public Duration getTimeout() {
        return timeout;
    }

    private ApiClientException translate(String operation, Throwable cause) {
        if (cause instanceof TimeoutException) {
            log.warn("{} timed out after {}", operation, timeout);
            return new ApiClientException(ApiFailure.TIMEOUT, operation,
                "no response within " + timeout.toMillis() + "ms", cause);
        }
        if (cause instanceof ApiClientException apiError) {
            log.warn("{} failed: {}", operation, apiError.getMessage());
            return apiError;
        }
        log.error("{} failed unexpectedly: {}", operation, cause.getMessage(), cause);
        return new ApiClientException(ApiFailure.UNKNOWN, operation,
            cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
    }
}
