package com.accessibility.checker.service.assessment;

import com.accessibility.checker.config.AccessibilityProperties;
import com.accessibility.checker.dto.AssessmentReport;
import com.accessibility.checker.dto.LabelDetection;
import com.accessibility.checker.dto.LabelDetection.DetectedLabel;
import com.accessibility.checker.exception.ImageAnalysisException;
import com.accessibility.checker.exception.InvalidAssessmentRequestException;
import com.accessibility.checker.model.Assessment;
import com.accessibility.checker.model.ImageRef;
import com.accessibility.checker.model.Label;
import com.accessibility.checker.model.Recommendation;
import com.accessibility.checker.service.analysis.AccessibilityLabelFilter;
import com.accessibility.checker.service.analysis.AnalysisOrchestrator;
import com.accessibility.checker.service.analysis.BatchChunker;
import com.accessibility.checker.service.analysis.ImageLabelDetector;
import com.accessibility.checker.service.cache.InMemoryCacheStore;
import com.accessibility.checker.service.cache.ResultCache;
import com.accessibility.checker.service.scoring.ScoringEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AccessibilityAssessmentServiceTest {

    private static final Map<String, List<DetectedLabel>> LABELS = Map.of(
            "ramp.jpg", List.of(new DetectedLabel("Ramp", 95.0), new DetectedLabel("Handrail", 90.0)),
            "stairs.jpg", List.of(new DetectedLabel("Stairs", 85.0)));

    @Mock
    private RecommendationGenerator recommendationGenerator;

    private AnalysisOrchestrator orchestrator;
    private AccessibilityAssessmentService service;

    @BeforeEach
    void setUp() {
        AccessibilityProperties properties = new AccessibilityProperties();
        properties.getAnalysis().getRetry().setInitialBackoff(Duration.ZERO);
        Clock clock = Clock.systemUTC();

        ImageLabelDetector detector = image -> {
            List<DetectedLabel> detected = LABELS.get(image.getKey());
            if (detected == null) {
                throw ImageAnalysisException.permanentFailure("Unknown image " + image.getKey());
            }
            return LabelDetection.builder().labels(new ArrayList<>(detected)).build();
        };

        ResultCache resultCache = new ResultCache(new InMemoryCacheStore(properties, clock), clock, properties);
        orchestrator = new AnalysisOrchestrator(detector, resultCache, new BatchChunker(),
                new AccessibilityLabelFilter(properties), properties, clock);
        service = new AccessibilityAssessmentService(orchestrator, recommendationGenerator,
                new AssessmentAssembler(new ScoringEngine(properties)), resultCache, properties);
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    @Test
    void assessesRampAndStairsImages() {
        when(recommendationGenerator.generateRecommendations(anyList(), anyInt())).thenReturn(List.of());

        Assessment assessment = service.runAssessment(images("ramp.jpg", "stairs.jpg"));

        assertThat(assessment.getTotalLabels()).isEqualTo(3);
        assertThat(assessment.getPositiveFeatures()).extracting(Label::getName).containsExactly("Ramp", "Handrail");
        assertThat(assessment.getBarriers()).extracting(Label::getName).containsExactly("Stairs");
        assertThat(assessment.getScore()).isEqualTo(69);
        assertThat(assessment.getAnalyzedImages()).isEqualTo(2);
        assertThat(assessment.getRecommendations()).extracting(Recommendation::getTitle)
                .containsExactly("Address Identified Barriers");
    }

    @Test
    void usesGeneratedRecommendations_whenAvailable() {
        Recommendation stairLift = Recommendation.builder()
                .title("Install Stair Lift").description("Add a stair lift").priority("high").category("safety")
                .build();
        when(recommendationGenerator.generateRecommendations(anyList(), anyInt())).thenReturn(List.of(stairLift));

        Assessment assessment = service.runAssessment(images("ramp.jpg", "stairs.jpg"));

        assertThat(assessment.getRecommendations()).containsExactly(stairLift);
    }

    @Test
    void fallsBack_whenGeneratorThrows() {
        when(recommendationGenerator.generateRecommendations(anyList(), anyInt()))
                .thenThrow(new IllegalStateException("model unavailable"));

        Assessment assessment = service.runAssessment(images("stairs.jpg"));

        assertThat(assessment.getRecommendations()).isNotEmpty();
        assertThat(assessment.getScore()).isZero();
    }

    @Test
    void producesNeutralAssessment_whenEveryImageFails() {
        AssessmentReport report = service.assess(images("missing-1.jpg", "missing-2.jpg", "missing-3.jpg"));

        Assessment assessment = report.getAssessment();
        assertThat(assessment.getAnalyzedImages()).isEqualTo(3);
        assertThat(assessment.getScore()).isEqualTo(50);
        assertThat(assessment.getTotalLabels()).isZero();
        assertThat(assessment.getRecommendations()).extracting(Recommendation::getTitle)
                .containsExactly("Add Accessibility Features");
        assertThat(report.getFailedImages()).hasSize(3);
        assertThat(report.getStatistics().getFailedAnalyses()).isEqualTo(3);
        assertThat(report.getStatistics().getSuccessRate()).isZero();
        verifyNoInteractions(recommendationGenerator);
    }

    @Test
    void reportsStatisticsAndFailures_forPartialSuccess() {
        lenient().when(recommendationGenerator.generateRecommendations(anyList(), anyInt())).thenReturn(List.of());

        AssessmentReport report = service.assess(images("ramp.jpg", "missing.jpg"));

        assertThat(report.getStatistics().getTotalImages()).isEqualTo(2);
        assertThat(report.getStatistics().getSuccessfulAnalyses()).isEqualTo(1);
        assertThat(report.getStatistics().getSuccessRate()).isEqualTo(50.0);
        assertThat(report.getFailedImages()).singleElement()
                .satisfies(failure -> assertThat(failure.getImageRef().getKey()).isEqualTo("missing.jpg"));
        assertThat(report.getAssessment().getScore()).isEqualTo(100);
    }

    @Test
    void rejectsEmptyImageList() {
        assertThatThrownBy(() -> service.runAssessment(List.of()))
                .isInstanceOf(InvalidAssessmentRequestException.class)
                .hasMessage("No images provided");
        verifyNoInteractions(recommendationGenerator);
    }

    @Test
    void rejectsImageWithoutKey() {
        assertThatThrownBy(() -> service.runAssessment(List.of(ImageRef.of("home-photos", " "))))
                .isInstanceOf(InvalidAssessmentRequestException.class)
                .hasMessageContaining("key");
    }

    @Test
    void invalidatedImageIsAnalyzedAgain() {
        lenient().when(recommendationGenerator.generateRecommendations(anyList(), anyInt())).thenReturn(List.of());
        service.assess(images("ramp.jpg"));
        assertThat(service.getCacheStats().getEntryCount()).isEqualTo(1);

        service.invalidateCachedAnalysis(ImageRef.of("home-photos", "ramp.jpg"));

        assertThat(service.getCacheStats().getEntryCount()).isZero();
    }

    private static List<ImageRef> images(String... keys) {
        return Arrays.stream(keys).map(key -> ImageRef.of("home-photos", key)).toList();
    }
}
