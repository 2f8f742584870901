package com.accessibility.checker.controller;

import com.accessibility.checker.dto.AssessmentReport;
import com.accessibility.checker.dto.AssessmentRequest;
import com.accessibility.checker.dto.CacheStats;
import com.accessibility.checker.model.ImageRef;
import com.accessibility.checker.service.assessment.AccessibilityAssessmentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for running accessibility assessments over stored images.
 */
@RestController
@RequestMapping("/api/assessments")
@Slf4j
@RequiredArgsConstructor
public class AssessmentController {

    private final AccessibilityAssessmentService assessmentService;

    /**
     * Analyze the given images and return the assessment with batch statistics
     */
    @PostMapping
    public ResponseEntity<AssessmentReport> assess(@Valid @RequestBody AssessmentRequest request) {
        log.info("Received assessment request for {} images", request.getImages().size());
        return ResponseEntity.ok(assessmentService.assess(request.getImages()));
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStats> getCacheStats() {
        return ResponseEntity.ok(assessmentService.getCacheStats());
    }

    /**
     * Drop the cached analysis of one image so the next assessment re-analyzes it
     */
    @DeleteMapping("/cache")
    public ResponseEntity<Void> invalidateCachedAnalysis(@RequestParam String container, @RequestParam String key) {
        assessmentService.invalidateCachedAnalysis(ImageRef.of(container, key));
        return ResponseEntity.noContent().build();
    }
}
