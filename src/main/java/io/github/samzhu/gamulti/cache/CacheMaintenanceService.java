package io.github.samzhu.gamulti.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * 定時清除過期快取項目。
 *
 * <p>{@link TtlCache} 只在讀取時清除單一過期項目，長時間未被讀取的鍵
 * 由此服務依 {@code ga.cache.sweep-cron}（預設每 10 分鐘）清除。
 */
@Service
public class CacheMaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(CacheMaintenanceService.class);

    private final TtlCache cache;

    public CacheMaintenanceService(TtlCache cache) {
        this.cache = cache;
    }

    @Scheduled(cron = "${ga.cache.sweep-cron:0 */10 * * * *}")
    public void sweep() {
        int removed = cache.sweepExpired();
        log.debug("Scheduled cache sweep: removed={}, remaining={}", removed, cache.size());
    }
}
