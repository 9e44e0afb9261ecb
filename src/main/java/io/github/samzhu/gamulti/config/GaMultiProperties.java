package io.github.samzhu.gamulti.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.github.samzhu.gamulti.exception.ConfigurationException;

/**
 * GA Multi MCP 的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link CacheConfig} - TTL 快取設定，Property 清單與查詢結果各有獨立的 TTL</li>
 *   <li>{@link ResolverConfig} - 模糊比對門檻與 Property 別名</li>
 *   <li>{@link QueryConfig} - 查詢列數上限、逾時與並行度</li>
 *   <li>{@link ErrorConfig} - 錯誤訊息遮罩</li>
 *   <li>{@link McpConfig} - MCP 伺服器名稱與版本</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * ga:
 *   credentials-path: /secrets/service-account.json
 *   cache:
 *     ttl-seconds: 300
 *     property-ttl-seconds: 3600
 *   resolver:
 *     fuzzy-threshold: 0.6
 *     aliases:
 *       "My Blog": [blog, main site]
 *   query:
 *     default-row-limit: 1000
 *     timeout: 30s
 * </pre>
 *
 * <p>未設定的值套用預設值；設定了但不合法的值會在啟動時拋出 {@link ConfigurationException}。
 *
 * @param credentialsPath Google 服務帳號 JSON 金鑰路徑
 * @param cache 快取設定
 * @param resolver Property 解析設定
 * @param query 查詢設定
 * @param error 錯誤回報設定
 * @param mcp MCP 伺服器設定
 */
@ConfigurationProperties(prefix = "ga")
public record GaMultiProperties(
    String credentialsPath,
    CacheConfig cache,
    ResolverConfig resolver,
    QueryConfig query,
    ErrorConfig error,
    McpConfig mcp
) {
    public GaMultiProperties {
        if (cache == null) {
            cache = CacheConfig.defaults();
        }
        if (resolver == null) {
            resolver = ResolverConfig.defaults();
        }
        if (query == null) {
            query = QueryConfig.defaults();
        }
        if (error == null) {
            error = ErrorConfig.defaults();
        }
        if (mcp == null) {
            mcp = McpConfig.defaults();
        }
    }

    /**
     * TTL 快取設定。
     *
     * @param ttlSeconds 查詢結果 TTL（秒），預設 300
     * @param propertyTtlSeconds Property 清單與 metadata TTL（秒），預設 3600
     * @param maxEntries 最大項目數，預設 10000
     * @param sweepCron 過期項目清理 Cron 表達式，預設每 10 分鐘
     */
    public record CacheConfig(
        Long ttlSeconds,
        Long propertyTtlSeconds,
        Integer maxEntries,
        String sweepCron
    ) {
        public CacheConfig {
            ttlSeconds = positive("ga.cache.ttl-seconds", ttlSeconds, 300L);
            propertyTtlSeconds = positive("ga.cache.property-ttl-seconds", propertyTtlSeconds, 3600L);
            maxEntries = positive("ga.cache.max-entries", maxEntries, 10_000);
            if (sweepCron == null || sweepCron.isBlank()) {
                sweepCron = "0 */10 * * * *";
            }
        }

        public static CacheConfig defaults() {
            return new CacheConfig(null, null, null, null);
        }

        public Duration ttl() {
            return Duration.ofSeconds(ttlSeconds);
        }

        public Duration propertyTtl() {
            return Duration.ofSeconds(propertyTtlSeconds);
        }
    }

    /**
     * Property 解析設定。
     *
     * <p>別名方向為「標準名稱（顯示名稱或數字 ID）→ 別名清單」。
     * {@code aliasesJson} 通常由 {@code GA_PROPERTY_ALIASES} 環境變數提供，
     * 會與 {@code aliases} 合併，由 {@link AppConfig} 解析。
     *
     * @param fuzzyThreshold 模糊比對門檻，範圍 [0, 1]，預設 0.6
     * @param searchThreshold search_properties 使用的寬鬆門檻，範圍 [0, 1]，預設 0.3
     * @param aliases 別名設定
     * @param aliasesJson JSON 格式的別名設定
     */
    public record ResolverConfig(
        Double fuzzyThreshold,
        Double searchThreshold,
        Map<String, List<String>> aliases,
        String aliasesJson
    ) {
        public ResolverConfig {
            fuzzyThreshold = unitInterval("ga.resolver.fuzzy-threshold", fuzzyThreshold, 0.6);
            searchThreshold = unitInterval("ga.resolver.search-threshold", searchThreshold, 0.3);
            aliases = aliases == null ? Map.of() : Map.copyOf(aliases);
        }

        public static ResolverConfig defaults() {
            return new ResolverConfig(null, null, null, null);
        }
    }

    /**
     * 查詢設定。
     *
     * @param defaultRowLimit 未指定 limit 時的列數，預設 1000
     * @param maxRowLimit 允許的最大列數，預設 10000
     * @param timeout 單次 API 呼叫逾時，預設 30 秒
     * @param maxConcurrency 多 Property 查詢的並行數，預設 8
     */
    public record QueryConfig(
        Integer defaultRowLimit,
        Integer maxRowLimit,
        Duration timeout,
        Integer maxConcurrency
    ) {
        public QueryConfig {
            defaultRowLimit = positive("ga.query.default-row-limit", defaultRowLimit, 1000);
            maxRowLimit = positive("ga.query.max-row-limit", maxRowLimit, 10_000);
            maxConcurrency = positive("ga.query.max-concurrency", maxConcurrency, 8);
            if (timeout == null) {
                timeout = Duration.ofSeconds(30);
            } else if (timeout.isZero() || timeout.isNegative()) {
                throw new ConfigurationException("ga.query.timeout must be positive, got: " + timeout);
            }
            if (defaultRowLimit > maxRowLimit) {
                throw new ConfigurationException(String.format(
                    "ga.query.default-row-limit (%d) must not exceed ga.query.max-row-limit (%d)",
                    defaultRowLimit, maxRowLimit));
            }
        }

        public static QueryConfig defaults() {
            return new QueryConfig(null, null, null, null);
        }

        /**
         * 將呼叫端指定的列數限制在合法範圍內，未指定時使用預設值。
         */
        public int effectiveLimit(Integer requested) {
            if (requested == null || requested <= 0) {
                return defaultRowLimit;
            }
            return Math.min(requested, maxRowLimit);
        }
    }

    /**
     * 錯誤回報設定。
     *
     * @param maskDetails 是否以通用訊息取代 API 的錯誤細節
     */
    public record ErrorConfig(
        Boolean maskDetails
    ) {
        public ErrorConfig {
            if (maskDetails == null) {
                maskDetails = false;
            }
        }

        public static ErrorConfig defaults() {
            return new ErrorConfig(false);
        }
    }

    /**
     * MCP 伺服器設定。
     *
     * @param serverName 伺服器名稱，預設 ga-multi-mcp
     * @param serverVersion 伺服器版本，預設 0.1.0
     */
    public record McpConfig(
        String serverName,
        String serverVersion
    ) {
        public McpConfig {
            if (serverName == null || serverName.isBlank()) {
                serverName = "ga-multi-mcp";
            }
            if (serverVersion == null || serverVersion.isBlank()) {
                serverVersion = "0.1.0";
            }
        }

        public static McpConfig defaults() {
            return new McpConfig(null, null);
        }
    }

    private static Long positive(String name, Long value, long defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0) {
            throw new ConfigurationException(name + " must be positive, got: " + value);
        }
        return value;
    }

    private static Integer positive(String name, Integer value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0) {
            throw new ConfigurationException(name + " must be positive, got: " + value);
        }
        return value;
    }

    private static Double unitInterval(String name, Double value, double defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value.isNaN() || value < 0.0 || value > 1.0) {
            throw new ConfigurationException(name + " must be within [0, 1], got: " + value);
        }
        return value;
    }
}
