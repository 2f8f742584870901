package com.accessibility.checker.controller;

import com.accessibility.checker.dto.AssessmentReport;
import com.accessibility.checker.dto.BatchStatistics;
import com.accessibility.checker.dto.CacheStats;
import com.accessibility.checker.exception.GlobalExceptionHandler;
import com.accessibility.checker.exception.InvalidAssessmentRequestException;
import com.accessibility.checker.model.Assessment;
import com.accessibility.checker.model.ImageRef;
import com.accessibility.checker.model.Label;
import com.accessibility.checker.service.assessment.AccessibilityAssessmentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AssessmentControllerTest {

    @Mock
    private AccessibilityAssessmentService assessmentService;

    @InjectMocks
    private AssessmentController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void returnsAssessmentReport() throws Exception {
        AssessmentReport report = AssessmentReport.builder()
                .assessment(Assessment.builder()
                        .score(69)
                        .analyzedImages(2)
                        .positiveFeature(Label.of("Ramp", 95.0))
                        .barrier(Label.of("Stairs", 85.0))
                        .totalLabels(2)
                        .build())
                .statistics(BatchStatistics.builder().totalImages(2).successfulAnalyses(2).successRate(100.0).build())
                .build();
        when(assessmentService.assess(anyList())).thenReturn(report);

        mockMvc.perform(post("/api/assessments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"images": [{"container": "home-photos", "key": "ramp.jpg"},
                                            {"container": "home-photos", "key": "stairs.jpg"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assessment.score").value(69))
                .andExpect(jsonPath("$.assessment.positiveFeatures[0].name").value("Ramp"))
                .andExpect(jsonPath("$.assessment.barriers[0].category").value("accessibility"))
                .andExpect(jsonPath("$.statistics.successRate").value(100.0));

        verify(assessmentService).assess(List.of(
                ImageRef.of("home-photos", "ramp.jpg"), ImageRef.of("home-photos", "stairs.jpg")));
    }

    @Test
    void returnsBadRequest_whenServiceRejectsInput() throws Exception {
        when(assessmentService.assess(anyList()))
                .thenThrow(new InvalidAssessmentRequestException("No images provided"));

        mockMvc.perform(post("/api/assessments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"images\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.message").value("No images provided"))
                .andExpect(jsonPath("$.path").value("/api/assessments"));
    }

    @Test
    void returnsBadRequest_whenImagesMissing() throws Exception {
        mockMvc.perform(post("/api/assessments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.message").value("images is required"));

        verifyNoInteractions(assessmentService);
    }

    @Test
    void returnsCacheStats() throws Exception {
        when(assessmentService.getCacheStats()).thenReturn(CacheStats.builder()
                .storeType("memory").entryCount(4).ttl(Duration.ofHours(24)).hits(10).misses(3).build());

        mockMvc.perform(get("/api/assessments/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.storeType").value("memory"))
                .andExpect(jsonPath("$.entryCount").value(4))
                .andExpect(jsonPath("$.hits").value(10));
    }

    @Test
    void invalidatesCachedAnalysis() throws Exception {
        mockMvc.perform(delete("/api/assessments/cache")
                        .param("container", "home-photos")
                        .param("key", "ramp.jpg"))
                .andExpect(status().isNoContent());

        verify(assessmentService).invalidateCachedAnalysis(ImageRef.of("home-photos", "ramp.jpg"));
    }
}
