package com.accessibility.checker.config;

import com.accessibility.checker.model.CachedAnalysis;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

import java.time.Duration;

/**
 * Persistent result cache wiring. Only loaded with {@code accessibility.cache.store=mongo};
 * the client itself comes from Spring Boot's {@code spring.data.mongodb.*} auto-configuration.
 */
@Configuration
@ConditionalOnProperty(prefix = "accessibility.cache", name = "store", havingValue = "mongo")
@EnableMongoRepositories(basePackages = "com.accessibility.checker.repository")
@RequiredArgsConstructor
@Slf4j
public class MongoConfig {

    static final String EXPIRES_AT_FIELD = "expiresAt";

    private final MongoTemplate mongoTemplate;

    /**
     * TTL index letting MongoDB drop cache documents once {@code expiresAt} has passed.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void ensureCacheIndexes() {
        String name = mongoTemplate.indexOps(CachedAnalysis.class)
                .ensureIndex(new Index().on(EXPIRES_AT_FIELD, Sort.Direction.ASC).expire(Duration.ZERO));
        log.info("Ensured TTL index {} on analysis cache", name);
    }
}
