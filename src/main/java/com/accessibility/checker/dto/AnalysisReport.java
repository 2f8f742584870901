package com.accessibility.checker.dto;

import com.accessibility.checker.model.AnalysisResult;
import com.accessibility.checker.model.Label;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the orchestrator learned about one request's images.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisReport {

    /** One result per input image, cached or live. */
    @Builder.Default
    private List<AnalysisResult> results = new ArrayList<>();

    @Builder.Default
    private List<Label> aggregatedLabels = new ArrayList<>();

    @Builder.Default
    private List<ImageFailure> failures = new ArrayList<>();

    private int cacheHits;
    private int cacheMisses;

    public int getSuccessfulImages() {
        return (int) results.stream().filter(AnalysisResult::isSucceeded).count();
    }
}
