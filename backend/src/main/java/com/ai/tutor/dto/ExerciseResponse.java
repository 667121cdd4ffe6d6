package com.ai.tutor.dto;

import com.ai.tutor.model.Difficulty;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response body for POST /api/practice/{studentId}/exercise.
 * The solution and expected procedures stay on the server.
 */
@Data
@Builder
public class ExerciseResponse {

    private Long id;
    private Long topicId;
    private String topic;
    private Difficulty difficulty;
    private String content;
    private List<ProcedureDescriptor> availableProcedures;

    /** True when served from the pre-generated pool without a generative call. */
    private boolean fromPool;
}
