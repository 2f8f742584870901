package com.accessibility.checker.scheduler;

import com.accessibility.checker.service.cache.ResultCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled task removing expired analysis results from the cache store.
 * Runs every 10 minutes by default.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ResultCacheCleanupScheduler {

    private final ResultCache resultCache;

    @Scheduled(fixedDelayString = "${accessibility.cache.sweep-interval-ms:600000}")
    public void cleanupExpiredEntries() {
        log.debug("Running result cache cleanup...");
        long removed = resultCache.evictExpired();
        if (removed > 0) {
            log.info("Result cache cleanup completed: {} expired entries removed", removed);
        }
    }
}
