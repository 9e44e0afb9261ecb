package io.github.samzhu.gamulti.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 以字串為鍵、每個項目各自帶有 TTL 的記憶體快取。
 *
 * <p>同一個實例存放不同型別的值，鍵的命名慣例見 {@link io.github.samzhu.gamulti.util.CacheKeys}：
 * <ul>
 *   <li>{@code properties:list} - Property 清單</li>
 *   <li>{@code metadata:<id>} - Property metadata</li>
 *   <li>{@code query:<id>:<hash>} - 報表查詢結果</li>
 * </ul>
 *
 * <p>過期採延遲清除：{@link #get} 發現過期時只移除該筆項目本身，
 * 若其他執行緒已寫入新值則不受影響；另由 {@link CacheMaintenanceService} 定時清除。
 *
 * <p>此快取不會拋出例外，內部錯誤一律視為未命中並記錄 WARN 日誌。
 */
public class TtlCache {

    private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    private final Clock clock;
    private final int maxEntries;

    public TtlCache(Clock clock, int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got: " + maxEntries);
        }
        this.clock = clock;
        this.maxEntries = maxEntries;
    }

    /**
     * 取得未過期的快取值。
     *
     * @param key 快取鍵
     * @param type 預期型別，型別不符時視為未命中
     * @return 快取值，未命中或已過期時為 empty
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                misses.increment();
                log.debug("Cache miss: key={}", key);
                return Optional.empty();
            }
            if (entry.isExpired(clock.instant())) {
                entries.remove(key, entry);
                misses.increment();
                log.debug("Cache expired: key={}", key);
                return Optional.empty();
            }
            if (!type.isInstance(entry.value())) {
                log.warn("Cache type mismatch: key={}, expected={}, actual={}",
                    key, type.getSimpleName(), entry.value().getClass().getSimpleName());
                misses.increment();
                return Optional.empty();
            }
            hits.increment();
            log.debug("Cache hit: key={}", key);
            return Optional.of(type.cast(entry.value()));
        } catch (RuntimeException e) {
            log.warn("Cache read failed, treating as miss: key={}, error={}", key, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * 寫入或覆寫快取值。
     *
     * <p>null 值或非正數 TTL 不會寫入。已達上限時先清除過期項目，仍滿則放棄寫入。
     *
     * @param key 快取鍵
     * @param value 快取值
     * @param ttl 存活時間
     */
    public void set(String key, Object value, Duration ttl) {
        if (key == null || value == null || ttl == null || ttl.isZero() || ttl.isNegative()) {
            log.debug("Cache set ignored: key={}, ttl={}", key, ttl);
            return;
        }
        try {
            if (entries.size() >= maxEntries && !entries.containsKey(key)) {
                sweepExpired();
                if (entries.size() >= maxEntries) {
                    log.warn("Cache full ({} entries), not storing key={}", maxEntries, key);
                    return;
                }
            }
            entries.put(key, new CacheEntry(value, clock.instant(), ttl));
            log.debug("Cache set: key={}, ttl={}s", key, ttl.getSeconds());
        } catch (RuntimeException e) {
            log.warn("Cache write failed, value not stored: key={}, error={}", key, e.getMessage(), e);
        }
    }

    /**
     * 移除指定鍵。
     *
     * @return 是否有項目被移除
     */
    public boolean invalidate(String key) {
        return entries.remove(key) != null;
    }

    /**
     * 移除鍵中包含指定字串的所有項目。
     *
     * @param pattern 子字串，空值等同 {@link #clear()}
     * @return 移除的項目數
     */
    public int invalidateMatching(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return clear();
        }
        int removed = 0;
        for (String key : List.copyOf(entries.keySet())) {
            if (key.contains(pattern) && entries.remove(key) != null) {
                removed++;
            }
        }
        log.info("Cache invalidated {} entries matching '{}'", removed, pattern);
        return removed;
    }

    /**
     * 清除所有項目，命中統計保留。
     *
     * @return 移除的項目數
     */
    public int clear() {
        int removed = 0;
        for (String key : List.copyOf(entries.keySet())) {
            if (entries.remove(key) != null) {
                removed++;
            }
        }
        log.info("Cache cleared: {} entries removed", removed);
        return removed;
    }

    /**
     * 移除所有已過期的項目。
     *
     * @return 移除的項目數
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            if (e.getValue().isExpired(now) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Cache sweep removed {} expired entries", removed);
        }
        return removed;
    }

    /**
     * 取得快取狀態快照，不會清除任何項目。
     */
    public CacheStatus status() {
        Instant now = clock.instant();
        List<CacheStatus.KeyStatus> keys = new ArrayList<>();
        int expired = 0;
        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            CacheEntry entry = e.getValue();
            boolean isExpired = entry.isExpired(now);
            if (isExpired) {
                expired++;
            }
            keys.add(new CacheStatus.KeyStatus(
                e.getKey(), entry.ageSeconds(now), entry.ttl().getSeconds(), isExpired));
        }
        keys.sort(Comparator.comparing(CacheStatus.KeyStatus::key));
        return new CacheStatus(
            keys.size(),
            keys.size() - expired,
            expired,
            hits.sum(),
            misses.sum(),
            maxEntries,
            List.copyOf(keys)
        );
    }

    public int size() {
        return entries.size();
    }
}
