package com.ai.tutor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The generative engine's verdict on a student's answer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EvaluationResult {

    @JsonProperty("is_correct_result")
    private boolean correctResult;

    @JsonProperty("is_correct_methodology")
    private boolean correctMethodology;

    @JsonProperty("errors_found")
    @Builder.Default
    private List<String> errorsFound = new ArrayList<>();

    private String feedback;
}
