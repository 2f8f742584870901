package com.accessibility.checker.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchStatistics {
    private int totalImages;
    private int successfulAnalyses;
    private int failedAnalyses;
    private double successRate;              // percent, 0-100
    private int totalLabelsDetected;
    private int accessibilityLabelsDetected;
    private double averageLabelsPerImage;
}
