package io.github.samzhu.gamulti.client;

import io.github.samzhu.gamulti.model.PropertyMetadata;

/**
 * GA4 Data API 的最小介面。
 *
 * <p>實作只負責傳輸與回應轉換，不做快取與逾時控制；
 * 兩者由 {@link io.github.samzhu.gamulti.service.QueryOrchestrator} 與
 * {@link io.github.samzhu.gamulti.service.ApiCallGuard} 負責。
 */
public interface DataApiClient {

    /**
     * 執行報表查詢。
     *
     * @throws ApiClientException AUTH、NETWORK、QUOTA_EXCEEDED 或 INVALID_REQUEST
     */
    ReportTable runReport(ReportRequest request);

    /**
     * 執行即時報表查詢（最近 30 分鐘）。
     *
     * @throws ApiClientException 同 {@link #runReport(ReportRequest)}
     */
    ReportTable runRealtimeReport(RealtimeRequest request);

    /**
     * 取得 Property 可用的 dimension 與 metric。
     *
     * @throws ApiClientException 同 {@link #runReport(ReportRequest)}
     */
    PropertyMetadata getMetadata(String propertyId);
}
