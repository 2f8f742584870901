package com.accessibility.checker.service.cache;

import com.accessibility.checker.model.AnalysisResult;
import com.accessibility.checker.model.CachedAnalysis;
import com.accessibility.checker.repository.CachedAnalysisRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * MongoDB-backed cache store. Results are kept as JSON so the document schema does not
 * follow every change to {@link AnalysisResult}; a TTL index on {@code expiresAt} (created by
 * {@link com.accessibility.checker.config.MongoConfig}) lets MongoDB drop expired entries in the background.
 */
@Component
@ConditionalOnProperty(prefix = "accessibility.cache", name = "store", havingValue = "mongo")
@RequiredArgsConstructor
@Slf4j
public class MongoCacheStore implements CacheStore {

    private final CachedAnalysisRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Optional<CacheEntry> get(String key) {
        return repository.findById(key).map(this::toEntry);
    }

    @Override
    public void put(CacheEntry entry) {
        CachedAnalysis document = CachedAnalysis.builder()
                .cacheKey(entry.getKey())
                .imageKey(entry.getValue().getImageRef() != null ? entry.getValue().getImageRef().getKey() : null)
                .analysisResult(serialize(entry.getValue()))
                .createdAt(clock.instant())
                .expiresAt(entry.getExpiresAt())
                .build();
        repository.save(document);
    }

    @Override
    public void delete(String key) {
        repository.deleteById(key);
    }

    @Override
    public long deleteExpired(Instant now) {
        return repository.deleteByExpiresAtLessThanEqual(now);
    }

    @Override
    public long size() {
        return repository.count();
    }

    @Override
    public String type() {
        return "mongo";
    }

    private CacheEntry toEntry(CachedAnalysis document) {
        try {
            AnalysisResult result = objectMapper.readValue(document.getAnalysisResult(), AnalysisResult.class);
            return new CacheEntry(document.getCacheKey(), result, document.getExpiresAt());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt cache document " + document.getCacheKey(), e);
        }
    }

    private String serialize(AnalysisResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize analysis result for " + result.getImageRef(), e);
        }
    }
}
