package com.accessibility.checker.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {
    private String storeType;
    private long entryCount;
    private Duration ttl;
    private long hits;
    private long misses;
    private long evictions;
}
