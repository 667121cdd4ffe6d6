package com.ai.tutor.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

/**
 * Chat-completions providers: OpenAI itself and DeepSeek, which speaks the same
 * protocol under a different base URL.
 */
@Slf4j
public class OpenAiCompatibleEngine extends AbstractPromptEngine {

    private final String name;
    private final String apiUrl;
    private final String apiKey;
    private final String model;

    public OpenAiCompatibleEngine(String name, String apiUrl, String apiKey, String model,
                                  ObjectMapper objectMapper, HttpClient httpClient, Duration timeout) {
        super(objectMapper, httpClient, timeout);
        this.name = name;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    protected String complete(String systemPrompt, String userPrompt, double temperature) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("temperature", temperature);

        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userPrompt);

        log.info("Sending prompt to {} ({})", name, model);
        JsonNode root = postJson(apiUrl, body, Map.of("Authorization", "Bearer " + apiKey));
        return root.at("/choices/0/message/content").asText();
    }
}
