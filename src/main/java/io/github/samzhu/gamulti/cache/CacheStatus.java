package io.github.samzhu.gamulti.cache;

import java.util.List;

/**
 * 快取狀態快照，對應 get_cache_status 工具的回應。
 *
 * @param entryCount 目前項目數（含已過期但尚未清除者）
 * @param validEntries 未過期項目數
 * @param expiredEntries 已過期項目數
 * @param hits 命中次數
 * @param misses 未命中次數
 * @param maxEntries 最大項目數
 * @param keys 各項目狀態，依 key 排序
 */
public record CacheStatus(
    int entryCount,
    int validEntries,
    int expiredEntries,
    long hits,
    long misses,
    int maxEntries,
    List<KeyStatus> keys
) {

    /**
     * 單一項目狀態。
     *
     * @param key 快取鍵
     * @param ageSeconds 已存在秒數
     * @param ttlSeconds TTL 秒數
     * @param expired 是否已過期
     */
    public record KeyStatus(
        String key,
        long ageSeconds,
        long ttlSeconds,
        boolean expired
    ) {}
}
