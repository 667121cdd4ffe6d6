package com.ai.tutor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Descriptive data about a book or video, passed to topic extraction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceMetadata {

    private String title;
    private String course;
    private String subject;

    /** "pdf_book" or "youtube_video". */
    private String sourceType;
}
