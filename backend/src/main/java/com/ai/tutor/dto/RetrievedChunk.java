package com.ai.tutor.dto;

import lombok.Value;

/**
 * A chunk returned by similarity search with its score ({@code 1 - cosine distance}).
 */
@Value
public class RetrievedChunk {

    String text;
    double score;
}
