package com.ai.tutor.dto;

import com.ai.tutor.model.Difficulty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for POST /api/practice/{studentId}/exercise
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExerciseRequest {

    @NotNull
    private Long topicId;

    /** Defaults to medium. */
    private Difficulty difficulty;

    /** Student's course (e.g. "3º ESO"); falls back to the topic's course. */
    private String course;
}
