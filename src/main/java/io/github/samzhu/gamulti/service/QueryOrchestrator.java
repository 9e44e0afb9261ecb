package io.github.samzhu.gamulti.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import io.github.samzhu.gamulti.cache.TtlCache;
import io.github.samzhu.gamulti.client.ApiClientException;
import io.github.samzhu.gamulti.client.DataApiClient;
import io.github.samzhu.gamulti.client.RealtimeRequest;
import io.github.samzhu.gamulti.client.ReportRequest;
import io.github.samzhu.gamulti.config.GaMultiProperties;
import io.github.samzhu.gamulti.exception.AnalyticsException;
import io.github.samzhu.gamulti.exception.ErrorKind;
import io.github.samzhu.gamulti.exception.QueryFailedException;
import io.github.samzhu.gamulti.model.ErrorDetail;
import io.github.samzhu.gamulti.model.MatchResult;
import io.github.samzhu.gamulti.model.MultiPropertyReport;
import io.github.samzhu.gamulti.model.MultiPropertyReport.Summary;
import io.github.samzhu.gamulti.model.MultiPropertyReport.TotalsSource;
import io.github.samzhu.gamulti.model.Property;
import io.github.samzhu.gamulti.model.QueryResult;
import io.github.samzhu.gamulti.model.QueryResult.MatchInfo;
import io.github.samzhu.gamulti.model.QuerySpec;
import io.github.samzhu.gamulti.model.RealtimeResult;
import io.github.samzhu.gamulti.model.ReportData;
import io.github.samzhu.gamulti.util.CacheKeys;
import io.github.samzhu.gamulti.util.RowNormalizer;

/**
 * 查詢協調服務，將一個邏輯查詢分派到一或多個 Property。
 *
 * <p>單一 Property 的處理流程：
 * <ol>
 *   <li>以 {@link FuzzyPropertyResolver} 解析 Property，失敗時不呼叫 Data API</li>
 *   <li>以 {@code (propertyId, QuerySpec)} 產生快取鍵，命中時直接重建結果</li>
 *   <li>未命中時經 {@link ApiCallGuard} 呼叫 Data API，正規化後以查詢 TTL 寫入快取</li>
 * </ol>
 *
 * <p>多 Property 查詢在 {@code fanOutExecutor} 上並行，結果順序與輸入一致；
 * 任一 Property 失敗只記錄在該筆結果上，加總只計算成功的結果。
 */
@Service
public class QueryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(QueryOrchestrator.class);

    static final String ROW_SUM_CAVEAT = "Some totals were summed from the returned rows; "
        + "row limits and non-additive metrics (e.g. activeUsers across dimensions) may make them inaccurate";

    private static final List<String> DEFAULT_REALTIME_METRICS = List.of("activeUsers");
    private static final int DEFAULT_REALTIME_LIMIT = 100;

    private final FuzzyPropertyResolver resolver;
    private final DataApiClient dataApiClient;
    private final TtlCache cache;
    private final ApiCallGuard apiCallGuard;
    private final Executor fanOutExecutor;
    private final GaMultiProperties.QueryConfig queryConfig;
    private final Duration queryTtl;

    public QueryOrchestrator(
            FuzzyPropertyResolver resolver,
            DataApiClient dataApiClient,
            TtlCache cache,
            ApiCallGuard apiCallGuard,
            @Qualifier("fanOutExecutor") Executor fanOutExecutor,
            GaMultiProperties properties) {
        this.resolver = resolver;
        this.dataApiClient = dataApiClient;
        this.cache = cache;
        this.apiCallGuard = apiCallGuard;
        this.fanOutExecutor = fanOutExecutor;
        this.queryConfig = properties.query();
        this.queryTtl = properties.cache().ttl();
    }

    /**
     * 查詢單一 Property。
     *
     * <p>不會拋出例外：解析或查詢失敗時回傳帶有 {@code error} 的結果。
     *
     * @param propertyRef Property 名稱、別名或 ID
     * @param spec 查詢規格
     * @return 查詢結果
     */
    public QueryResult querySingle(String propertyRef, QuerySpec spec) {
        MatchInfo matchInfo = null;
        Property property = null;
        try {
            List<MatchResult> matches = resolver.resolve(propertyRef);
            if (matches.isEmpty()) {
                throw resolver.notFound(propertyRef);
            }
            MatchResult best = matches.get(0);
            property = best.property();
            matchInfo = MatchInfo.of(best, resolver.ambiguousWith(matches));

            ReportData data = fetchReport(property.numericId(), spec);
            return QueryResult.success(propertyRef, matchInfo, property, spec.dateRange(), data);
        } catch (AnalyticsException e) {
            log.warn("Query for '{}' failed: {}", propertyRef, e.getMessage());
            return QueryResult.failure(propertyRef, matchInfo, property, spec.dateRange(), ErrorDetail.from(e));
        } catch (RuntimeException e) {
            log.error("Unexpected error querying '{}': {}", propertyRef, e.getMessage(), e);
            return QueryResult.failure(propertyRef, matchInfo, property, spec.dateRange(), internalError(propertyRef));
        }
    }

    /**
     * 並行查詢多個 Property。
     *
     * @param propertyRefs Property 參照，至少一個
     * @param spec 查詢規格
     * @return 依輸入順序排列的結果與彙總
     */
    public MultiPropertyReport queryMultiple(List<String> propertyRefs, QuerySpec spec) {
        if (propertyRefs == null || propertyRefs.isEmpty()) {
            throw new IllegalArgumentException("At least one property is required");
        }
        log.info("Querying {} properties: metrics={}, dimensions={}, range={}",
            propertyRefs.size(), spec.metrics(), spec.dimensions(), spec.dateRange());
        long startTime = System.currentTimeMillis();

        List<CompletableFuture<QueryResult>> futures = new ArrayList<>(propertyRefs.size());
        for (String ref : propertyRefs) {
            futures.add(CompletableFuture
                .supplyAsync(() -> querySingle(ref, spec), fanOutExecutor)
                .exceptionally(ex -> {
                    log.error("Fan-out task for '{}' failed: {}", ref, ex.getMessage(), ex);
                    return QueryResult.failure(ref, null, null, spec.dateRange(), internalError(ref));
                }));
        }

        List<QueryResult> results = futures.stream().map(CompletableFuture::join).toList();
        Summary summary = summarize(spec.metrics(), results);

        log.info("Multi-property query completed in {}ms: {} succeeded, {} failed",
            System.currentTimeMillis() - startTime, summary.propertiesSuccessful(), summary.propertiesFailed());
        return new MultiPropertyReport(spec.dateRange(), spec.metrics(), spec.dimensions(), results, summary);
    }

    /**
     * 查詢最近 30 分鐘的即時資料，不使用快取。
     *
     * @param metrics 未指定時為 activeUsers
     * @param limit 未指定時為 100
     * @throws AnalyticsException Property 無法解析或查詢失敗
     */
    public RealtimeResult queryRealtime(String propertyRef, List<String> metrics, List<String> dimensions,
                                        Integer limit) {
        Property property = resolver.resolveRequired(propertyRef).property();
        List<String> effectiveMetrics = metrics == null || metrics.isEmpty() ? DEFAULT_REALTIME_METRICS : metrics;
        int rowLimit = limit == null || limit <= 0
            ? DEFAULT_REALTIME_LIMIT
            : Math.min(limit, queryConfig.maxRowLimit());

        RealtimeRequest request = new RealtimeRequest(property.numericId(), effectiveMetrics, dimensions, rowLimit);
        String operation = "runRealtimeReport(" + property.numericId() + ")";
        try {
            ReportData data = RowNormalizer.normalize(
                apiCallGuard.call(operation, () -> dataApiClient.runRealtimeReport(request)));
            return new RealtimeResult(
                property.numericId(),
                property.displayName(),
                RealtimeResult.LOOKBACK_MINUTES,
                data.dimensionHeaders(),
                data.metricHeaders(),
                data.rows(),
                data.rowCount()
            );
        } catch (ApiClientException e) {
            throw new QueryFailedException(property.numericId(), e.getFailure(), apiCallGuard.detail(e), e);
        }
    }

    private ReportData fetchReport(String propertyId, QuerySpec spec) {
        String key = CacheKeys.query(propertyId, spec);
        Optional<ReportData> cached = cache.get(key, ReportData.class);
        if (cached.isPresent()) {
            log.debug("Serving property {} from cache", propertyId);
            return cached.get();
        }

        String operation = "runReport(" + propertyId + ")";
        try {
            ReportData data = RowNormalizer.normalize(
                apiCallGuard.call(operation, () -> dataApiClient.runReport(new ReportRequest(propertyId, spec))));
            cache.set(key, data, queryTtl);
            log.debug("Fetched {} rows for property {} (total={})", data.rowCount(), propertyId, data.totalRows());
            return data;
        } catch (ApiClientException e) {
            throw new QueryFailedException(propertyId, e.getFailure(), apiCallGuard.detail(e), e);
        }
    }

    static Summary summarize(List<String> metrics, List<QueryResult> results) {
        List<QueryResult> successful = results.stream().filter(QueryResult::isSuccess).toList();
        Map<String, Number> totals = new LinkedHashMap<>();
        boolean usedApiTotals = false;
        boolean usedRowSum = false;

        for (String metric : metrics) {
            Number total = 0L;
            boolean numeric = true;
            boolean metricUsedApi = false;
            boolean metricUsedRows = false;
            for (QueryResult result : successful) {
                Number apiTotal = result.totals().get(metric);
                if (apiTotal != null) {
                    total = add(total, apiTotal);
                    metricUsedApi = true;
                    continue;
                }
                for (Map<String, Object> row : result.rows()) {
                    Object value = row.get(metric);
                    if (value instanceof Number number) {
                        total = add(total, number);
                    } else if (value != null) {
                        numeric = false;
                    }
                }
                metricUsedRows = true;
            }
            if (numeric && !successful.isEmpty()) {
                totals.put(metric, total);
                usedApiTotals |= metricUsedApi;
                usedRowSum |= metricUsedRows;
            }
        }

        TotalsSource source;
        if (totals.isEmpty()) {
            source = TotalsSource.NONE;
        } else if (usedApiTotals && usedRowSum) {
            source = TotalsSource.MIXED;
        } else if (usedApiTotals) {
            source = TotalsSource.API_TOTALS;
        } else {
            source = TotalsSource.ROW_SUM;
        }

        return new Summary(
            results.size(),
            successful.size(),
            results.size() - successful.size(),
            totals,
            source,
            usedRowSum ? ROW_SUM_CAVEAT : null
        );
    }

    private static Number add(Number a, Number b) {
        if (a instanceof Long && b instanceof Long) {
            return a.longValue() + b.longValue();
        }
        return a.doubleValue() + b.doubleValue();
    }

    private static ErrorDetail internalError(String propertyRef) {
        return new ErrorDetail(ErrorKind.INTERNAL_ERROR,
            "Unexpected error while querying '" + propertyRef + "'",
            "Retry the query; the server log has the details");
    }
}
