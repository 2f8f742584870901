package com.accessibility.checker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * MongoDB document holding one cached image analysis.
 * The id is the analysis fingerprint; the result is stored as serialized JSON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "analysis_cache")
public class CachedAnalysis {

    @Id
    private String cacheKey;

    private String imageKey;
    private String analysisResult;
    private Instant createdAt;

    // TTL-indexed, see MongoConfig
    private Instant expiresAt;
}
