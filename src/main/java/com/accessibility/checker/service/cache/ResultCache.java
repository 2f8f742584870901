package com.accessibility.checker.service.cache;

import com.accessibility.checker.config.AccessibilityProperties;
import com.accessibility.checker.dto.CacheStats;
import com.accessibility.checker.model.AnalysisResult;
import com.accessibility.checker.model.ImageRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Content-addressed cache of per-image analysis results.
 *
 * <p>Entries expire lazily: a read at or after {@code expiresAt} behaves as a miss and nothing
 * is refreshed. The cache is best-effort. Store errors on read count as misses, and store
 * errors on write, invalidate or sweep are logged and dropped, so a broken store only costs
 * extra live calls.</p>
 */
@Service
@Slf4j
public class ResultCache {

    private final CacheStore store;
    private final Clock clock;
    private final Duration defaultTtl;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ResultCache(CacheStore store, Clock clock, AccessibilityProperties properties) {
        this.store = store;
        this.clock = clock;
        this.defaultTtl = properties.getCache().getTtl();
        log.info("Result cache initialized with {} store, ttl {}", store.type(), defaultTtl);
    }

    /**
     * Deterministic fingerprint of one logical analysis: SHA-256 over {@code key:analysisKind}.
     */
    public static String fingerprint(ImageRef imageRef, String analysisKind) {
        String content = imageRef.getKey() + ":" + analysisKind;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public Optional<AnalysisResult> get(String fingerprint) {
        Optional<CacheEntry> entry;
        try {
            entry = store.get(fingerprint);
        } catch (Exception e) {
            log.warn("Cache read failed for key {}, treating as miss: {}", fingerprint, e.getMessage());
            misses.incrementAndGet();
            return Optional.empty();
        }

        if (entry.isEmpty()) {
            log.debug("Cache miss for key: {}", fingerprint);
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (entry.get().isExpired(clock.instant())) {
            log.debug("Cache entry expired for key: {}", fingerprint);
            misses.incrementAndGet();
            return Optional.empty();
        }

        log.debug("Cache hit for key: {}", fingerprint);
        hits.incrementAndGet();
        return Optional.of(entry.get().getValue());
    }

    public void put(String fingerprint, AnalysisResult result) {
        put(fingerprint, result, defaultTtl);
    }

    public void put(String fingerprint, AnalysisResult result, Duration ttl) {
        try {
            Instant expiresAt = clock.instant().plus(ttl);
            store.put(new CacheEntry(fingerprint, result, expiresAt));
            log.debug("Cached analysis for key: {} until {}", fingerprint, expiresAt);
        } catch (Exception e) {
            log.warn("Cache write failed for key {}: {}", fingerprint, e.getMessage());
        }
    }

    public void invalidate(String fingerprint) {
        try {
            store.delete(fingerprint);
            log.info("Invalidated cache for key: {}", fingerprint);
        } catch (Exception e) {
            log.warn("Cache invalidation failed for key {}: {}", fingerprint, e.getMessage());
        }
    }

    /**
     * Optional sweep reclaiming space held by expired entries. Reads never depend on it.
     */
    public long evictExpired() {
        try {
            return store.deleteExpired(clock.instant());
        } catch (Exception e) {
            log.warn("Cache sweep failed: {}", e.getMessage());
            return 0;
        }
    }

    public CacheStats stats() {
        long entryCount;
        long evictions;
        try {
            entryCount = store.size();
            evictions = store.evictionCount();
        } catch (Exception e) {
            log.warn("Could not count cache entries: {}", e.getMessage());
            entryCount = -1;
            evictions = -1;
        }
        return CacheStats.builder()
                .storeType(store.type())
                .entryCount(entryCount)
                .ttl(defaultTtl)
                .hits(hits.get())
                .misses(misses.get())
                .evictions(evictions)
                .build();
    }
}
