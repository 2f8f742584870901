package com.accessibility.checker.config;

import com.accessibility.checker.model.KeywordCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables for the analysis pipeline, bound from the {@code accessibility.*} keys in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "accessibility")
public class AccessibilityProperties {

    private final Analysis analysis = new Analysis();
    private final Cache cache = new Cache();
    private final Scoring scoring = new Scoring();
    private final Map<String, ServiceEndpoint> services = new LinkedHashMap<>();

    public enum DeadlinePolicy {
        /** Cancel in-flight calls once the deadline passes. */
        ABANDON,
        /** Let in-flight calls finish, but dispatch nothing new. */
        COMPLETE_IN_FLIGHT
    }

    @Data
    public static class Analysis {
        /** System-wide cap on simultaneous live label calls (worker pool size). */
        private int maxConcurrency = 10;

        /** Images per wave. */
        private int chunkSize = 5;

        private int maxLabels = 50;

        /** Confidence floor sent to the label service; labels below it never come back. */
        private double minConfidence = 70.0;

        /** Part of the cache fingerprint; bump it when the analysis itself changes. */
        private String analysisKind = "accessibility";

        private Duration deadline = Duration.ofSeconds(60);
        private DeadlinePolicy deadlinePolicy = DeadlinePolicy.ABANDON;

        private final Retry retry = new Retry();

        private List<String> relevantKeywords = new ArrayList<>(List.of(
                "stairs", "ramp", "door", "doorway", "bathroom", "bedroom",
                "kitchen", "hallway", "entrance", "elevator", "lift",
                "wheelchair", "grab bar", "handrail", "step", "threshold"));
    }

    @Data
    public static class Retry {
        /** Total attempts per image, including the first one. */
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(2);
    }

    @Data
    public static class Cache {
        /** "memory" or "mongo". */
        private String store = "memory";
        private Duration ttl = Duration.ofHours(24);
        /** Upper bound on entries held by the in-memory store. */
        private long maximumSize = 10_000;
        /** Period of the background sweep of expired entries. */
        private long sweepIntervalMs = 600_000;
    }

    @Data
    public static class Scoring {
        private Map<String, KeywordCategory> keywords = defaultKeywords();

        private static Map<String, KeywordCategory> defaultKeywords() {
            Map<String, KeywordCategory> keywords = new LinkedHashMap<>();
            for (String keyword : List.of("ramp", "elevator", "lift", "handrail", "grab bar", "accessible", "wide")) {
                keywords.put(keyword, KeywordCategory.POSITIVE);
            }
            for (String keyword : List.of("stairs", "step", "threshold", "narrow", "obstacle", "clutter")) {
                keywords.put(keyword, KeywordCategory.BARRIER);
            }
            return keywords;
        }
    }

    @Data
    public static class ServiceEndpoint {
        private String baseUrl;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }
}
