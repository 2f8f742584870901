package com.accessibility.checker.service.cache;

import com.accessibility.checker.model.AnalysisResult;
import lombok.Value;

import java.time.Instant;

@Value
public class CacheEntry {
    String key;
    AnalysisResult value;
    Instant expiresAt;

    /** An entry is expired from the instant {@code expiresAt} is reached. */
    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
