package com.accessibility.checker.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Final accessibility assessment for one request.
 */
@Value
@Builder
@Jacksonized
public class Assessment {

    /** Accessibility score (0-100), 50 when there is no keyword signal. */
    int score;

    int analyzedImages;

    @Singular
    List<Label> positiveFeatures;

    @Singular
    List<Label> barriers;

    @Singular
    List<Recommendation> recommendations;

    int totalLabels;
}
