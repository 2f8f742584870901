package com.accessibility.checker.service.assessment;

import com.accessibility.checker.exception.InvalidAssessmentRequestException;
import com.accessibility.checker.model.Assessment;
import com.accessibility.checker.model.Label;
import com.accessibility.checker.model.Recommendation;
import com.accessibility.checker.service.scoring.Categorization;
import com.accessibility.checker.service.scoring.ScoringEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the final {@link Assessment} from aggregated labels and recommendations.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AssessmentAssembler {

    private final ScoringEngine scoringEngine;

    public Assessment assemble(List<Label> aggregatedLabels, List<Recommendation> recommendations,
                               int analyzedImageCount) {
        if (analyzedImageCount < 0) {
            throw new InvalidAssessmentRequestException("Analyzed image count cannot be negative: " + analyzedImageCount);
        }
        List<Label> labels = aggregatedLabels != null ? aggregatedLabels : List.of();

        int score = scoringEngine.score(labels);
        Categorization categorization = scoringEngine.categorize(labels);

        List<Recommendation> finalRecommendations = recommendations != null && !recommendations.isEmpty()
                ? recommendations
                : fallbackRecommendations(categorization);

        log.info("Generated final assessment with score: {} ({} features, {} barriers)",
                score, categorization.positiveFeatures().size(), categorization.barriers().size());

        return Assessment.builder()
                .score(score)
                .analyzedImages(analyzedImageCount)
                .positiveFeatures(categorization.positiveFeatures())
                .barriers(categorization.barriers())
                .recommendations(finalRecommendations)
                .totalLabels(labels.size())
                .build();
    }

    /**
     * Deterministic recommendations used when the text-generation collaborator has nothing.
     */
    List<Recommendation> fallbackRecommendations(Categorization categorization) {
        List<Recommendation> recommendations = new ArrayList<>();

        if (!categorization.barriers().isEmpty()) {
            recommendations.add(Recommendation.builder()
                    .title("Address Identified Barriers")
                    .description(String.format("Consider modifications to address %d identified barriers",
                            categorization.barriers().size()))
                    .priority("high")
                    .category("safety")
                    .build());
        }

        if (categorization.positiveFeatures().isEmpty()) {
            recommendations.add(Recommendation.builder()
                    .title("Add Accessibility Features")
                    .description("Consider adding ramps, handrails, and other accessibility features")
                    .priority("medium")
                    .category("improvement")
                    .build());
        }
        return recommendations;
    }
}
