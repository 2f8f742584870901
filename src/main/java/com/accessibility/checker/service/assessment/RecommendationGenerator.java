package com.accessibility.checker.service.assessment;

import com.accessibility.checker.model.Label;
import com.accessibility.checker.model.Recommendation;

import java.util.List;

/**
 * Optional enrichment producing recommendation text for aggregated labels.
 * An empty list means "nothing to offer" and triggers the deterministic fallback.
 */
public interface RecommendationGenerator {

    List<Recommendation> generateRecommendations(List<Label> aggregatedLabels, int imageCount);
}
