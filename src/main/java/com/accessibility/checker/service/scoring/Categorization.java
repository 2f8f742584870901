package com.accessibility.checker.service.scoring;

import com.accessibility.checker.model.Label;

import java.util.List;

/**
 * Labels split into accessibility features and barriers. Labels matching neither keyword set
 * appear in neither list.
 */
public record Categorization(List<Label> positiveFeatures, List<Label> barriers) {

    public Categorization {
        positiveFeatures = List.copyOf(positiveFeatures);
        barriers = List.copyOf(barriers);
    }
}
