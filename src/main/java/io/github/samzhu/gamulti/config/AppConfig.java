package io.github.samzhu.gamulti.config;

import java.time.Clock;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.gamulti.cache.TtlCache;
import io.github.samzhu.gamulti.service.ApiCallGuard;
import io.github.samzhu.gamulti.service.PropertyAliases;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link GaMultiProperties} 的型別安全配置綁定，並建立核心元件：
 * <ul>
 *   <li>{@link TtlCache} - 所有快取共用的單一實例</li>
 *   <li>{@code fanOutExecutor} - 多 Property 查詢的並行執行緒池</li>
 *   <li>{@code apiCallExecutor} - 外部 API 呼叫的執行緒池，搭配 {@link ApiCallGuard} 控制逾時</li>
 *   <li>{@link PropertyAliases} - 合併設定檔與 JSON 環境變數的別名</li>
 * </ul>
 *
 * @see GaMultiProperties
 */
@Configuration
@EnableConfigurationProperties(GaMultiProperties.class)
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public TtlCache ttlCache(Clock clock, GaMultiProperties properties) {
        log.info("TTL cache: queryTtl={}s, propertyTtl={}s, maxEntries={}",
            properties.cache().ttlSeconds(), properties.cache().propertyTtlSeconds(), properties.cache().maxEntries());
        return new TtlCache(clock, properties.cache().maxEntries());
    }

    @Bean
    public PropertyAliases propertyAliases(GaMultiProperties properties, ObjectMapper objectMapper) {
        PropertyAliases aliases = PropertyAliases.from(properties.resolver(), objectMapper);
        log.info("Loaded {} property aliases", aliases.size());
        return aliases;
    }

    /**
     * 多 Property 查詢的執行緒池，大小由 {@code ga.query.max-concurrency} 決定。
     */
    @Bean(name = "fanOutExecutor")
    public ThreadPoolTaskExecutor fanOutExecutor(GaMultiProperties properties) {
        int concurrency = properties.query().maxConcurrency();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("ga-fanout-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /**
     * 外部 API 呼叫的執行緒池。
     *
     * <p>逾時的呼叫在底層請求結束前仍佔用執行緒。
     */
    @Bean(name = "apiCallExecutor")
    public ThreadPoolTaskExecutor apiCallExecutor(GaMultiProperties properties) {
        int concurrency = properties.query().maxConcurrency();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency * 4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("ga-api-");
        executor.setAllowCoreThreadTimeOut(true);
        executor.setKeepAliveSeconds(120);
        return executor;
    }

    @Bean
    public ApiCallGuard apiCallGuard(
            @Qualifier("apiCallExecutor") Executor apiCallExecutor,
            GaMultiProperties properties) {
        return new ApiCallGuard(apiCallExecutor,
            properties.query().timeout(), properties.error().maskDetails());
    }
}
