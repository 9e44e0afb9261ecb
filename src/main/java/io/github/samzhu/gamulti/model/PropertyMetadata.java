package io.github.samzhu.gamulti.model;

import java.util.List;

/**
 * Property 可用的 dimension 與 metric 定義。
 *
 * @param propertyId Property 數字 ID
 * @param dimensions 標準 dimension
 * @param metrics 標準 metric
 * @param customDimensions 自訂 dimension
 * @param customMetrics 自訂 metric
 */
public record PropertyMetadata(
    String propertyId,
    List<Field> dimensions,
    List<Field> metrics,
    List<Field> customDimensions,
    List<Field> customMetrics
) {
    public PropertyMetadata {
        dimensions = List.copyOf(dimensions);
        metrics = List.copyOf(metrics);
        customDimensions = List.copyOf(customDimensions);
        customMetrics = List.copyOf(customMetrics);
    }

    public int totalDimensions() {
        return dimensions.size() + customDimensions.size();
    }

    public int totalMetrics() {
        return metrics.size() + customMetrics.size();
    }

    /**
     * 單一欄位定義。
     *
     * @param apiName API 名稱（查詢時使用）
     * @param uiName GA4 介面顯示名稱
     * @param description 說明
     * @param custom 是否為自訂定義
     */
    public record Field(
        String apiName,
        String uiName,
        String description,
        boolean custom
    ) {}
}
