package com.accessibility.checker.service.assessment;

import com.accessibility.checker.config.AccessibilityProperties;
import com.accessibility.checker.dto.AnalysisReport;
import com.accessibility.checker.dto.AssessmentReport;
import com.accessibility.checker.dto.BatchStatistics;
import com.accessibility.checker.dto.CacheStats;
import com.accessibility.checker.exception.InvalidAssessmentRequestException;
import com.accessibility.checker.model.AnalysisResult;
import com.accessibility.checker.model.Assessment;
import com.accessibility.checker.model.ImageRef;
import com.accessibility.checker.model.Label;
import com.accessibility.checker.model.Recommendation;
import com.accessibility.checker.service.analysis.AnalysisOrchestrator;
import com.accessibility.checker.service.cache.ResultCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point of the assessment pipeline: analyze images, ask for recommendations,
 * assemble the assessment.
 *
 * <p>Only precondition violations are thrown. Failed images, cache trouble and a silent
 * recommendation generator all still produce an assessment.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessibilityAssessmentService {

    private final AnalysisOrchestrator analysisOrchestrator;
    private final RecommendationGenerator recommendationGenerator;
    private final AssessmentAssembler assessmentAssembler;
    private final ResultCache resultCache;
    private final AccessibilityProperties properties;

    public Assessment runAssessment(List<ImageRef> images) {
        return assess(images).getAssessment();
    }

    public AssessmentReport assess(List<ImageRef> images) {
        validate(images);
        log.info("Starting assessment of {} images", images.size());

        AnalysisReport report = analysisOrchestrator.analyze(images);
        List<Label> labels = report.getAggregatedLabels();
        List<Recommendation> recommendations = fetchRecommendations(labels, images.size());

        Assessment assessment = assessmentAssembler.assemble(labels, recommendations, images.size());
        BatchStatistics statistics = analysisOrchestrator.getBatchStatistics(report.getResults());

        log.info("Assessment completed: score {}, {}/{} images analyzed successfully",
                assessment.getScore(), statistics.getSuccessfulAnalyses(), statistics.getTotalImages());

        return AssessmentReport.builder()
                .assessment(assessment)
                .statistics(statistics)
                .failedImages(report.getFailures())
                .build();
    }

    public BatchStatistics getBatchStatistics(List<AnalysisResult> results) {
        return analysisOrchestrator.getBatchStatistics(results);
    }

    public void invalidateCachedAnalysis(ImageRef image) {
        validateImage(image, 0);
        resultCache.invalidate(ResultCache.fingerprint(image, properties.getAnalysis().getAnalysisKind()));
    }

    public CacheStats getCacheStats() {
        return resultCache.stats();
    }

    private List<Recommendation> fetchRecommendations(List<Label> labels, int imageCount) {
        if (labels.isEmpty()) {
            log.info("No labels detected, skipping recommendation generation");
            return List.of();
        }
        try {
            List<Recommendation> recommendations = recommendationGenerator.generateRecommendations(labels, imageCount);
            return recommendations != null ? recommendations : List.of();
        } catch (Exception e) {
            log.warn("Recommendation generator failed, using fallback: {}", e.getMessage());
            return List.of();
        }
    }

    private void validate(List<ImageRef> images) {
        if (images == null || images.isEmpty()) {
            throw new InvalidAssessmentRequestException("No images provided");
        }
        for (int i = 0; i < images.size(); i++) {
            validateImage(images.get(i), i);
        }
    }

    private void validateImage(ImageRef image, int index) {
        if (image == null) {
            throw new InvalidAssessmentRequestException("Image at index " + index + " is null");
        }
        if (image.getContainer() == null || image.getContainer().isBlank()) {
            throw new InvalidAssessmentRequestException("Missing container for image at index " + index);
        }
        if (image.getKey() == null || image.getKey().isBlank()) {
            throw new InvalidAssessmentRequestException("Missing key for image at index " + index);
        }
    }
}
