package com.ai.tutor.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Response body for POST /api/practice/{studentId}/exercises/{exerciseId}/hint
 */
@Data
@Builder
public class HintResponse {

    private Long exerciseId;
    private int level;

    /** "text" for level 1, "visual" (Mermaid diagram) for level 2. */
    private String type;

    private String hint;
}
