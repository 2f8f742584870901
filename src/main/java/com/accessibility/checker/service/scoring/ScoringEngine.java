package com.accessibility.checker.service.scoring;

import com.accessibility.checker.config.AccessibilityProperties;
import com.accessibility.checker.model.KeywordCategory;
import com.accessibility.checker.model.Label;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns aggregated labels into an accessibility score and a feature/barrier split.
 *
 * <p>A label counts as positive when its lower-cased name contains a POSITIVE keyword,
 * otherwise as a barrier when it contains a BARRIER keyword. The positive test always runs
 * first, so a name matching both sets is a feature. Pure and order-independent.</p>
 */
@Service
@Slf4j
public class ScoringEngine {

    public static final int NEUTRAL_SCORE = 50;

    private final Set<String> positiveKeywords;
    private final Set<String> barrierKeywords;

    @Autowired
    public ScoringEngine(AccessibilityProperties properties) {
        this(properties.getScoring().getKeywords());
    }

    public ScoringEngine(Map<String, KeywordCategory> keywords) {
        this.positiveKeywords = keywordsOf(keywords, KeywordCategory.POSITIVE);
        this.barrierKeywords = keywordsOf(keywords, KeywordCategory.BARRIER);
        log.debug("Scoring with {} positive and {} barrier keywords", positiveKeywords.size(), barrierKeywords.size());
    }

    public Categorization categorize(List<Label> labels) {
        List<Label> positiveFeatures = new ArrayList<>();
        List<Label> barriers = new ArrayList<>();

        for (Label label : labels) {
            KeywordCategory category = classify(label);
            if (category == KeywordCategory.POSITIVE) {
                positiveFeatures.add(label);
            } else if (category == KeywordCategory.BARRIER) {
                barriers.add(label);
            }
        }
        return new Categorization(positiveFeatures, barriers);
    }

    /**
     * Score in [0, 100]: confidence-weighted share of positive signal, or
     * {@value #NEUTRAL_SCORE} when no label matches any keyword.
     */
    public int score(List<Label> labels) {
        double positive = 0.0;
        double negative = 0.0;

        for (Label label : labels) {
            double weight = label.getConfidence() / 100.0;
            KeywordCategory category = classify(label);
            if (category == KeywordCategory.POSITIVE) {
                positive += weight;
            } else if (category == KeywordCategory.BARRIER) {
                negative += weight;
            }
        }

        if (positive + negative == 0) {
            return NEUTRAL_SCORE;
        }
        long score = Math.round(100.0 * positive / (positive + negative));
        return (int) Math.max(0, Math.min(100, score));
    }

    private KeywordCategory classify(Label label) {
        if (label.getName() == null) {
            return null;
        }
        String name = label.getName().toLowerCase(Locale.ROOT);
        if (positiveKeywords.stream().anyMatch(name::contains)) {
            return KeywordCategory.POSITIVE;
        }
        if (barrierKeywords.stream().anyMatch(name::contains)) {
            return KeywordCategory.BARRIER;
        }
        return null;
    }

    private static Set<String> keywordsOf(Map<String, KeywordCategory> keywords, KeywordCategory category) {
        return keywords.entrySet().stream()
                .filter(entry -> entry.getValue() == category)
                .map(entry -> entry.getKey().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
