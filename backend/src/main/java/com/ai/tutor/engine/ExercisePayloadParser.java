package com.ai.tutor.engine;

import com.ai.tutor.dto.ExercisePayload;
import com.ai.tutor.dto.ProcedureDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the text a model returns for an exercise request into an
 * {@link ExercisePayload}. Never throws: unreadable answers become
 * {@link ExercisePayload#fallback(String)}.
 */
@Slf4j
public class ExercisePayloadParser {

    private static final String JSON_FENCE = "```json";
    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    public ExercisePayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExercisePayload parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ExercisePayload.fallback(raw == null ? "" : raw);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFences(raw));
        } catch (JsonProcessingException e) {
            log.warn("Exercise answer is not valid JSON, using raw text: {}", e.getOriginalMessage());
            return ExercisePayload.fallback(raw);
        }
        if (root == null || !root.isObject() || !root.hasNonNull("content")) {
            log.warn("Exercise answer has no content field, using raw text");
            return ExercisePayload.fallback(raw);
        }

        return ExercisePayload.builder()
                .content(asText(root.get("content")))
                .solution(asText(root.get("solution")))
                .methodology(asText(root.get("methodology")))
                .availableProcedures(procedures(root.get("available_procedures")))
                .expectedProcedures(procedureIds(root.get("expected_procedures")))
                .build();
    }

    /**
     * Returns the body of the first fenced block ({@code ```json} preferred,
     * then a bare {@code ```}), or the trimmed input when there is none.
     */
    public static String stripCodeFences(String raw) {
        String text = raw.trim();
        int start = text.indexOf(JSON_FENCE);
        int bodyStart;
        if (start >= 0) {
            bodyStart = start + JSON_FENCE.length();
        } else {
            start = text.indexOf(FENCE);
            if (start < 0) {
                return text;
            }
            bodyStart = start + FENCE.length();
            // skip a language tag such as ```mermaid
            int lineEnd = text.indexOf('\n', bodyStart);
            if (lineEnd > bodyStart && text.substring(bodyStart, lineEnd).trim().matches("[A-Za-z]+")) {
                bodyStart = lineEnd + 1;
            }
        }
        int end = text.indexOf(FENCE, bodyStart);
        return (end < 0 ? text.substring(bodyStart) : text.substring(bodyStart, end)).trim();
    }

    // Models sometimes answer solution or methodology as an object or list; keep its JSON text.
    private String asText(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        return node.isTextual() ? node.asText() : node.toString();
    }

    private List<ProcedureDescriptor> procedures(JsonNode node) {
        List<ProcedureDescriptor> result = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return result;
        }
        for (JsonNode item : node) {
            if (!item.isObject()) {
                continue;
            }
            try {
                result.add(objectMapper.treeToValue(item, ProcedureDescriptor.class));
            } catch (JsonProcessingException e) {
                log.debug("Skipping unreadable procedure {}: {}", item, e.getOriginalMessage());
            }
        }
        return result;
    }

    private List<Integer> procedureIds(JsonNode node) {
        List<Integer> result = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return result;
        }
        for (JsonNode item : node) {
            if (item.canConvertToInt()) {
                result.add(item.asInt());
            } else if (item.isTextual() && item.asText().trim().matches("\\d+")) {
                result.add(Integer.parseInt(item.asText().trim()));
            }
        }
        return result;
    }
}
