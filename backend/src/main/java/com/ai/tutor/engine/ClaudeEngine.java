package com.ai.tutor.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

/**
 * Anthropic Messages API.
 */
@Slf4j
public class ClaudeEngine extends AbstractPromptEngine {

    private static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final int MAX_TOKENS = 2000;

    private final String apiUrl;
    private final String apiKey;
    private final String model;

    public ClaudeEngine(String apiUrl, String apiKey, String model,
                        ObjectMapper objectMapper, HttpClient httpClient, Duration timeout) {
        super(objectMapper, httpClient, timeout);
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public String name() {
        return "claude";
    }

    @Override
    protected String complete(String systemPrompt, String userPrompt, double temperature) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", MAX_TOKENS);
        body.put("temperature", temperature);
        body.put("system", systemPrompt);
        body.putArray("messages").addObject().put("role", "user").put("content", userPrompt);

        log.info("Sending prompt to claude ({})", model);
        JsonNode root = postJson(apiUrl, body, Map.of(
                "x-api-key", apiKey,
                "anthropic-version", ANTHROPIC_VERSION));
        return root.at("/content/0/text").asText();
    }
}
