package com.ai.tutor.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body for POST /api/practice/{studentId}/session.
 * Topic ids are in the order the student's profile assigns them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PracticeSessionRequest {

    private String course;

    @NotEmpty
    private List<Long> topicIds;
}
