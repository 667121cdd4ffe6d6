package com.ai.tutor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body for POST /api/practice/{studentId}/exercises/{exerciseId}/submit
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionRequest {

    private String answer;

    private String methodology;

    /** Ids of the procedures the student ticked. */
    @Builder.Default
    private List<Integer> selectedProcedures = new ArrayList<>();

    /** Second attempt: the response includes the expected solution. */
    private boolean retry;
}
