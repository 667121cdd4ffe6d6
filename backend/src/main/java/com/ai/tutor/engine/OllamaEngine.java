package com.ai.tutor.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

/**
 * Local models served by Ollama ({@code /api/generate}, no API key).
 */
@Slf4j
public class OllamaEngine extends AbstractPromptEngine {

    private final String apiUrl;
    private final String model;

    public OllamaEngine(String apiUrl, String model,
                        ObjectMapper objectMapper, HttpClient httpClient, Duration timeout) {
        super(objectMapper, httpClient, timeout);
        this.apiUrl = apiUrl;
        this.model = model;
    }

    @Override
    public String name() {
        return "ollama";
    }

    @Override
    protected String complete(String systemPrompt, String userPrompt, double temperature) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("system", systemPrompt);
        body.put("prompt", userPrompt);
        body.put("stream", false);
        body.putObject("options").put("temperature", temperature);

        log.info("Sending prompt to ollama ({})", model);
        JsonNode root = postJson(apiUrl, body, Map.of());
        return root.at("/response").asText();
    }
}
