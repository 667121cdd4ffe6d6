package com.ai.tutor.dto;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body for POST /api/sources/{sourceId}/ingest.
 * Either {@code pages} (preferred, keeps locators) or plain {@code text}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {

    private String text;

    @Valid
    @Builder.Default
    private List<SourcePage> pages = new ArrayList<>();

    /** Drop the source's existing chunks before storing the new ones. */
    private boolean replace;
}
