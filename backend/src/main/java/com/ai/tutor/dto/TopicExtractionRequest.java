package com.ai.tutor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for POST /api/sources/{sourceId}/topics
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopicExtractionRequest {

    private String title;
    private String course;
    private String subject;
    private String sourceType;
}
