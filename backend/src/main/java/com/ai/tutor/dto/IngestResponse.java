package com.ai.tutor.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Response body for POST /api/sources/{sourceId}/ingest
 */
@Data
@Builder
public class IngestResponse {

    private Long sourceId;

    /** Chunks written by this ingestion. */
    private int chunksStored;

    /** Chunks removed first when the request asked to replace. */
    private int chunksReplaced;

    private long elapsedMs;
}
