package com.ai.tutor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * An exercise as produced by the generative engine. Immutable; the pool stores
 * it as JSON and {@link #content} is its deduplication key.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExercisePayload {

    String content;
    String solution;
    String methodology;

    @JsonProperty("available_procedures")
    @Builder.Default
    List<ProcedureDescriptor> availableProcedures = List.of();

    @JsonProperty("expected_procedures")
    @Builder.Default
    List<Integer> expectedProcedures = List.of();

    /**
     * Payload used when the engine answer cannot be parsed: the raw text becomes
     * the exercise statement and everything else is empty.
     */
    public static ExercisePayload fallback(String rawText) {
        return ExercisePayload.builder()
                .content(rawText)
                .solution("")
                .methodology("")
                .build();
    }
}
