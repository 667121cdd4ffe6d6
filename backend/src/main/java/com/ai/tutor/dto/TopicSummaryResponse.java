package com.ai.tutor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response body for GET /api/topics/{topicId}/summary
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopicSummaryResponse {

    private Long topicId;
    private String topic;
    private String course;
    private String summary;
}
