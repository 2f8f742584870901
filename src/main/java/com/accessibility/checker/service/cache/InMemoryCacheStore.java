package com.accessibility.checker.service.cache;

import com.accessibility.checker.config.AccessibilityProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Process-local cache store backed by Caffeine. Default when no persistent store is configured.
 *
 * <p>Each entry lives until its own {@code expiresAt}, measured on the injected {@link Clock},
 * and the store holds at most {@code accessibility.cache.maximum-size} entries.</p>
 */
@Component
@ConditionalOnProperty(prefix = "accessibility.cache", name = "store", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryCacheStore implements CacheStore {

    private static final Duration MAX_EXPIRY = Duration.ofNanos(Long.MAX_VALUE);

    private final Clock clock;
    private final Cache<String, CacheEntry> entries;

    @Autowired
    public InMemoryCacheStore(AccessibilityProperties properties, Clock clock) {
        this(properties.getCache().getMaximumSize(), clock);
    }

    public InMemoryCacheStore(long maximumSize, Clock clock) {
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .recordStats()
                .maximumSize(maximumSize)
                .expireAfter(new EntryExpiry())
                .ticker(this::clockNanos)
                // maintenance on the calling thread keeps size() and sweeps exact
                .executor(Runnable::run)
                .build();
        log.info("In-memory cache store initialized (maximum size {})", maximumSize);
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        return Optional.ofNullable(entries.getIfPresent(key));
    }

    @Override
    public void put(CacheEntry entry) {
        entries.put(entry.getKey(), entry);
    }

    @Override
    public void delete(String key) {
        entries.invalidate(key);
    }

    @Override
    public long deleteExpired(Instant now) {
        long before = entries.estimatedSize();
        entries.cleanUp();
        entries.asMap().values().removeIf(entry -> entry.isExpired(now));
        long removed = Math.max(0, before - entries.estimatedSize());
        log.debug("Swept {} expired entries, {} evicted since start", removed, entries.stats().evictionCount());
        return removed;
    }

    @Override
    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    @Override
    public long evictionCount() {
        return entries.stats().evictionCount();
    }

    @Override
    public String type() {
        return "memory";
    }

    private long clockNanos() {
        Instant now = clock.instant();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }

    private long nanosUntilExpiry(CacheEntry entry) {
        Duration remaining = Duration.between(clock.instant(), entry.getExpiresAt());
        if (remaining.isNegative()) {
            return 0;
        }
        return remaining.compareTo(MAX_EXPIRY) >= 0 ? Long.MAX_VALUE : remaining.toNanos();
    }

    /**
     * Expires each entry at its own {@code expiresAt}; reads never extend it.
     */
    private final class EntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return nanosUntilExpiry(entry);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return nanosUntilExpiry(entry);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
