package com.accessibility.checker.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One detected concept for an image. Confidence is a percentage in [0, 100].
 */
@Value
@Builder
@Jacksonized
public class Label {

    public static final String ACCESSIBILITY_CATEGORY = "accessibility";

    String name;
    double confidence;
    String category;

    public static Label of(String name, double confidence) {
        return new Label(name, confidence, ACCESSIBILITY_CATEGORY);
    }
}
