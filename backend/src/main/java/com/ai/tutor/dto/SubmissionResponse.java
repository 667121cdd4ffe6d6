package com.ai.tutor.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response body for POST /api/practice/{studentId}/exercises/{exerciseId}/submit
 */
@Data
@Builder
public class SubmissionResponse {

    private String submissionId;
    private Long exerciseId;
    private boolean correctResult;
    private boolean correctMethodology;
    private List<String> errorsFound;
    private String feedback;

    /** Longer didactic explanation, only when the answer was wrong. */
    private String detailedFeedback;

    /** Only set on a retry. */
    private String solution;
}
