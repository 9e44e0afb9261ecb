package io.github.samzhu.gamulti.client;

import io.github.samzhu.gamulti.model.QuerySpec;

/**
 * 單一 Property 的報表請求。
 *
 * @param propertyId Property 數字 ID
 * @param spec 查詢規格
 */
public record ReportRequest(
    String propertyId,
    QuerySpec spec
) {}
