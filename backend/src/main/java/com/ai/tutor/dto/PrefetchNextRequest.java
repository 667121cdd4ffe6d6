package com.ai.tutor.dto;

import com.ai.tutor.model.Difficulty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for POST /api/practice/{studentId}/prefetch-next
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrefetchNextRequest {

    @NotNull
    private Long topicId;

    private Difficulty difficulty;

    private String course;
}
