package com.accessibility.checker.service.analysis;

import com.accessibility.checker.config.AccessibilityProperties;
import com.accessibility.checker.dto.LabelDetection.DetectedLabel;
import com.accessibility.checker.model.Label;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keeps the detected labels that matter for accessibility and tags them with the
 * {@code accessibility} category. Confidence is rounded to two decimals.
 */
@Component
public class AccessibilityLabelFilter {

    private final List<String> keywords;

    @Autowired
    public AccessibilityLabelFilter(AccessibilityProperties properties) {
        this(properties.getAnalysis().getRelevantKeywords());
    }

    public AccessibilityLabelFilter(List<String> keywords) {
        this.keywords = keywords.stream()
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .toList();
    }

    public List<Label> filter(List<DetectedLabel> detected) {
        List<Label> relevant = new ArrayList<>();
        for (DetectedLabel label : detected) {
            if (label.getName() == null) {
                continue;
            }
            String name = label.getName().toLowerCase(Locale.ROOT);
            if (keywords.stream().anyMatch(name::contains)) {
                relevant.add(Label.of(label.getName(), Math.round(label.getConfidence() * 100.0) / 100.0));
            }
        }
        return relevant;
    }
}
