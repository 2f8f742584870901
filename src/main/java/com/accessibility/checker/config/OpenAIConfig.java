package com.accessibility.checker.config;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the OpenAI chat model used to write recommendations.
 * Only active when {@code openai.api-key} is set; otherwise the fallback recommendations apply.
 */
@Configuration
@ConditionalOnProperty(prefix = "openai", name = "api-key")
@Slf4j
public class OpenAIConfig {

    @Value("${openai.api-key}")
    private String apiKey;

    @Value("${openai.model.chat:gpt-4o-mini}")
    private String chatModel;

    @Value("${openai.timeout:60}")
    private int timeoutSeconds;

    @Value("${openai.max-retries:3}")
    private int maxRetries;

    @Bean
    public ChatLanguageModel chatLanguageModel() {
        log.info("[OpenAI Config] Initializing ChatLanguageModel with model: {}", chatModel);

        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(chatModel)
                .temperature(0.3)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(maxRetries)
                .maxTokens(1500)
                .logRequests(false)
                .logResponses(false)
                .build();
    }
}
