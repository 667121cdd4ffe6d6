package com.ai.tutor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A technique or property the student can pick while solving an exercise.
 * Some are needed for the solution, others are distractors.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProcedureDescriptor {

    private Integer id;
    private String name;
    private String description;
}
