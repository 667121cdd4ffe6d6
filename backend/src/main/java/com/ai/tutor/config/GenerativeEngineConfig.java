package com.ai.tutor.config;

import com.ai.tutor.engine.ClaudeEngine;
import com.ai.tutor.engine.GenerativeEngine;
import com.ai.tutor.engine.OllamaEngine;
import com.ai.tutor.engine.OpenAiCompatibleEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Selects the generative engine once at startup from {@code tutor.engine.provider}.
 * An unknown provider name fails the context.
 */
@Slf4j
@Configuration
public class GenerativeEngineConfig {

    static final List<String> AVAILABLE_PROVIDERS = List.of("openai", "deepseek", "claude", "ollama");

    @Value("${tutor.engine.provider:openai}")
    private String provider;

    @Value("${tutor.engine.timeout:60s}")
    private Duration timeout;

    // OpenAI
    @Value("${tutor.engine.openai.api-key:}")
    private String openAiApiKey;
    @Value("${tutor.engine.openai.api-url:https://api.openai.com/v1/chat/completions}")
    private String openAiApiUrl;
    @Value("${tutor.engine.openai.model:gpt-4o-mini}")
    private String openAiModel;

    // DeepSeek
    @Value("${tutor.engine.deepseek.api-key:}")
    private String deepSeekApiKey;
    @Value("${tutor.engine.deepseek.api-url:https://api.deepseek.com/v1/chat/completions}")
    private String deepSeekApiUrl;
    @Value("${tutor.engine.deepseek.model:deepseek-chat}")
    private String deepSeekModel;

    // Claude
    @Value("${tutor.engine.claude.api-key:}")
    private String claudeApiKey;
    @Value("${tutor.engine.claude.api-url:https://api.anthropic.com/v1/messages}")
    private String claudeApiUrl;
    @Value("${tutor.engine.claude.model:claude-sonnet-4-6}")
    private String claudeModel;

    // Ollama (local, no API key)
    @Value("${tutor.engine.ollama.api-url:http://localhost:11434/api/generate}")
    private String ollamaApiUrl;
    @Value("${tutor.engine.ollama.model:llama3.2}")
    private String ollamaModel;

    @Bean
    public GenerativeEngine generativeEngine(ObjectMapper objectMapper) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .build();

        GenerativeEngine engine = switch (provider.trim().toLowerCase(Locale.ROOT)) {
            case "openai" -> new OpenAiCompatibleEngine("openai", openAiApiUrl, openAiApiKey, openAiModel,
                    objectMapper, httpClient, timeout);
            case "deepseek" -> new OpenAiCompatibleEngine("deepseek", deepSeekApiUrl, deepSeekApiKey, deepSeekModel,
                    objectMapper, httpClient, timeout);
            case "claude" -> new ClaudeEngine(claudeApiUrl, claudeApiKey, claudeModel,
                    objectMapper, httpClient, timeout);
            case "ollama" -> new OllamaEngine(ollamaApiUrl, ollamaModel, objectMapper, httpClient, timeout);
            default -> throw new IllegalStateException("Generative engine '" + provider
                    + "' not supported. Available engines: " + String.join(", ", AVAILABLE_PROVIDERS));
        };
        log.info("Generative engine: {} (timeout {})", engine.name(), timeout);
        return engine;
    }
}
