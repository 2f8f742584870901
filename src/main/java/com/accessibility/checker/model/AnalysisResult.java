package com.accessibility.checker.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of analyzing a single image. This is the unit stored in the result cache;
 * only successful results are ever cached.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AnalysisResult {

    ImageRef imageRef;

    /** Accessibility-relevant labels, in the order the service returned them. */
    @Singular
    List<Label> labels;

    /** Raw label count reported by the service before relevance filtering. */
    int totalLabels;

    boolean succeeded;
    String error;
    FailureKind failureKind;
    int attempts;
    Instant analyzedAt;

    public static AnalysisResult success(ImageRef imageRef, List<Label> labels, int totalLabels,
                                         int attempts, Instant analyzedAt) {
        return AnalysisResult.builder()
                .imageRef(imageRef)
                .labels(labels)
                .totalLabels(totalLabels)
                .succeeded(true)
                .attempts(attempts)
                .analyzedAt(analyzedAt)
                .build();
    }

    public static AnalysisResult failure(ImageRef imageRef, FailureKind kind, String error,
                                         int attempts, Instant analyzedAt) {
        return AnalysisResult.builder()
                .imageRef(imageRef)
                .succeeded(false)
                .failureKind(kind)
                .error(error)
                .attempts(attempts)
                .analyzedAt(analyzedAt)
                .build();
    }
}
