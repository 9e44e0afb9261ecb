package io.github.samzhu.gamulti.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * 快取項目。
 *
 * @param value 快取值，不可為 null
 * @param insertedAt 寫入時間
 * @param ttl 存活時間
 */
record CacheEntry(
    Object value,
    Instant insertedAt,
    Duration ttl
) {

    /**
     * 當 {@code now - insertedAt > ttl} 時視為過期。
     */
    boolean isExpired(Instant now) {
        return Duration.between(insertedAt, now).compareTo(ttl) > 0;
    }

    long ageSeconds(Instant now) {
        return Math.max(0, Duration.between(insertedAt, now).getSeconds());
    }
}
