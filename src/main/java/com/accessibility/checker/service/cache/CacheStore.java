package com.accessibility.checker.service.cache;

import java.time.Instant;
import java.util.Optional;

/**
 * Key-value backing store for {@link ResultCache}. Implementations must be safe for
 * concurrent use and may throw on I/O problems; the cache absorbs those errors.
 */
public interface CacheStore {

    Optional<CacheEntry> get(String key);

    void put(CacheEntry entry);

    void delete(String key);

    /**
     * Removes entries whose expiry is at or before {@code now}.
     *
     * @return number of removed entries
     */
    long deleteExpired(Instant now);

    long size();

    /** Entries dropped by the store itself (size bound or expiry); 0 for stores that cannot tell. */
    default long evictionCount() {
        return 0;
    }

    String type();
}
