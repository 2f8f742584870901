package com.accessibility.checker.service.assessment;

import com.accessibility.checker.model.Label;
import com.accessibility.checker.model.Recommendation;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Asks the configured chat model for home-modification recommendations.
 * Returns an empty list when no model is configured or anything goes wrong.
 */
@Component
@Slf4j
public class LlmRecommendationGenerator implements RecommendationGenerator {

    private static final String SYSTEM_PROMPT = """
You are a home accessibility consultant. You receive labels detected in photos of a home,
each with a confidence percentage. Recommend practical modifications that improve
accessibility for people with limited mobility.

Respond with ONLY a JSON array, no prose, where each element has:
  "title": short title,
  "description": one or two sentences,
  "priority": "high" | "medium" | "low",
  "category": "safety" | "improvement" | "maintenance"
Return at most 5 recommendations, most important first.
""";

    private final Optional<ChatLanguageModel> chatLanguageModel;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public LlmRecommendationGenerator(Optional<ChatLanguageModel> chatLanguageModel) {
        this.chatLanguageModel = chatLanguageModel;
        if (chatLanguageModel.isEmpty()) {
            log.info("No chat model configured, fallback recommendations will be used");
        }
    }

    @Override
    public List<Recommendation> generateRecommendations(List<Label> aggregatedLabels, int imageCount) {
        if (chatLanguageModel.isEmpty()) {
            return List.of();
        }

        try {
            List<ChatMessage> messages = List.of(
                    SystemMessage.from(SYSTEM_PROMPT),
                    UserMessage.from(buildUserPrompt(aggregatedLabels, imageCount)));
            Response<AiMessage> response = chatLanguageModel.get().generate(messages);
            List<Recommendation> recommendations = parse(response.content().text());
            log.info("Generated {} recommendations from {} labels", recommendations.size(), aggregatedLabels.size());
            return recommendations;
        } catch (Exception e) {
            log.warn("Recommendation generation failed, using fallback: {}", e.getMessage());
            return List.of();
        }
    }

    private String buildUserPrompt(List<Label> labels, int imageCount) {
        String labelLines = labels.stream()
                .map(label -> String.format("- %s (%.1f%%)", label.getName(), label.getConfidence()))
                .collect(Collectors.joining("\n"));
        return "Images analyzed: " + imageCount + "\nDetected labels:\n" + labelLines;
    }

    List<Recommendation> parse(String text) throws Exception {
        if (text == null) {
            return List.of();
        }
        // models sometimes wrap the array in markdown fences or a sentence
        int start = text.indexOf('[');
        int end = text.lastIndexOf(']');
        if (start < 0 || end <= start) {
            log.warn("Chat model response contained no JSON array");
            return List.of();
        }
        List<Recommendation> parsed = objectMapper.readValue(
                text.substring(start, end + 1), new TypeReference<List<Recommendation>>() {});
        return parsed.stream()
                .filter(recommendation -> recommendation.getTitle() != null && !recommendation.getTitle().isBlank())
                .toList();
    }
}
