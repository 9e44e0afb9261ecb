package io.github.samzhu.gamulti.service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.gamulti.cache.TtlCache;
import io.github.samzhu.gamulti.client.AdminApiClient;
import io.github.samzhu.gamulti.client.ApiClientException;
import io.github.samzhu.gamulti.client.DiscoveredAccount;
import io.github.samzhu.gamulti.config.GaMultiProperties;
import io.github.samzhu.gamulti.exception.DiscoveryFailedException;
import io.github.samzhu.gamulti.exception.PropertyNotFoundException;
import io.github.samzhu.gamulti.model.Property;
import io.github.samzhu.gamulti.util.CacheKeys;

/**
 * Property 註冊表，Property 身分的唯一來源。
 *
 * <p>從 Admin API 探索服務帳號可存取的所有 Property，攤平成清單後快取於
 * {@code properties:list}（TTL 由 {@code ga.cache.property-ttl-seconds} 設定）。
 *
 * <p>快取規則：
 * <ul>
 *   <li>探索失敗不會寫入快取，下次呼叫會重新探索</li>
 *   <li>探索結果為空清單時回傳但不快取，避免暫時性的空結果持續生效</li>
 *   <li>同一時間只有一次探索；並行的呼叫者共用同一個結果，失敗時也一併收到同一個例外</li>
 * </ul>
 */
@Service
public class PropertyRegistry {

    private static final Logger log = LoggerFactory.getLogger(PropertyRegistry.class);

    private final AdminApiClient adminApiClient;
    private final TtlCache cache;
    private final ApiCallGuard apiCallGuard;
    private final Duration propertyTtl;
    private final AtomicReference<CompletableFuture<List<Property>>> inFlight = new AtomicReference<>();

    public PropertyRegistry(
            AdminApiClient adminApiClient,
            TtlCache cache,
            ApiCallGuard apiCallGuard,
            GaMultiProperties properties) {
        this.adminApiClient = adminApiClient;
        this.cache = cache;
        this.apiCallGuard = apiCallGuard;
        this.propertyTtl = properties.cache().propertyTtl();
    }

    public List<Property> listProperties() {
        return listProperties(false);
    }

    /**
     * 取得所有可存取的 Property。
     *
     * @param forceRefresh 是否略過快取重新探索
     * @return Property 清單，依探索順序排列
     * @throws DiscoveryFailedException Admin API 呼叫失敗或逾時
     */
    public List<Property> listProperties(boolean forceRefresh) {
        if (!forceRefresh) {
            Optional<List<Property>> cached = cachedList();
            if (cached.isPresent()) {
                return cached.get();
            }
        }
        return discover(forceRefresh);
    }

    /**
     * 以數字 ID 查詢 Property。
     */
    public Optional<Property> findProperty(String propertyId) {
        if (propertyId == null) {
            return Optional.empty();
        }
        return listProperties().stream()
            .filter(p -> p.numericId().equals(propertyId))
            .findFirst();
    }

    /**
     * 以數字 ID 取得 Property。
     *
     * @throws PropertyNotFoundException 清單中不存在此 ID
     */
    public Property getProperty(String propertyId) {
        return findProperty(propertyId)
            .orElseThrow(() -> new PropertyNotFoundException(propertyId, List.of()));
    }

    private List<Property> discover(boolean forceRefresh) {
        CompletableFuture<List<Property>> mine = new CompletableFuture<>();
        CompletableFuture<List<Property>> existing = inFlight.compareAndExchange(null, mine);
        if (existing != null) {
            log.debug("Joining in-flight property discovery");
            return await(existing);
        }
        try {
            List<Property> properties = forceRefresh ? fetch() : cachedList().orElseGet(this::fetch);
            mine.complete(properties);
            return properties;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.compareAndSet(mine, null);
        }
    }

    private List<Property> fetch() {
        log.info("Discovering GA4 properties");
        long startTime = System.currentTimeMillis();

        List<DiscoveredAccount> accounts;
        try {
            accounts = apiCallGuard.call("listAccountSummaries", adminApiClient::listAccountSummaries);
        } catch (ApiClientException e) {
            log.error("Property discovery failed: {}", e.getMessage());
            throw new DiscoveryFailedException(e.getFailure(), apiCallGuard.detail(e), e);
        }

        List<Property> properties = flatten(accounts);
        long duration = System.currentTimeMillis() - startTime;

        if (properties.isEmpty()) {
            log.warn("Discovery returned no properties in {}ms; result not cached", duration);
            return properties;
        }

        cache.set(CacheKeys.PROPERTY_LIST, properties, propertyTtl);
        log.info("Discovered {} properties across {} accounts in {}ms",
            properties.size(), accounts.size(), duration);
        return properties;
    }

    private static List<Property> await(CompletableFuture<List<Property>> discovery) {
        try {
            return discovery.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    static List<Property> flatten(List<DiscoveredAccount> accounts) {
        Map<String, Property> byId = new LinkedHashMap<>();
        for (DiscoveredAccount account : accounts) {
            for (DiscoveredAccount.DiscoveredProperty p : account.properties()) {
                byId.putIfAbsent(p.id(), new Property(
                    p.id(), p.resourceName(), p.displayName(), account.accountId(), account.displayName()));
            }
        }
        return List.copyOf(byId.values());
    }

    @SuppressWarnings("unchecked")
    private Optional<List<Property>> cachedList() {
        return cache.get(CacheKeys.PROPERTY_LIST, List.class).map(list -> (List<Property>) list);
    }
}
