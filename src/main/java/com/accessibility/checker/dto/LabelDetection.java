package com.accessibility.checker.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Body returned by the image-analysis service for one detect-labels call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LabelDetection {

    @Builder.Default
    private List<DetectedLabel> labels = new ArrayList<>();

    private String error;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DetectedLabel {
        private String name;
        private double confidence;
    }
}
