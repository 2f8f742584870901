package com.accessibility.checker.dto;

import com.accessibility.checker.model.Assessment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Assessment together with the batch statistics and per-image failures that produced it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssessmentReport {
    private Assessment assessment;
    private BatchStatistics statistics;

    @Builder.Default
    private List<ImageFailure> failedImages = new ArrayList<>();
}
