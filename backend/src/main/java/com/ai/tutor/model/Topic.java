package com.ai.tutor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A topic extracted from a source (a textbook or a video transcript).
 * Retrieval uses {@link #name} as the query, scoped to {@link #sourceId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "topics", indexes = @Index(name = "idx_topics_source", columnList = "source_id"))
public class Topic {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Book or video whose chunks this topic is answered from. */
    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    /** "pdf_book" or "youtube_video". */
    @Column(name = "source_type", length = 20)
    @Builder.Default
    private String sourceType = "pdf_book";

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(length = 50)
    private String course;

    @Column(length = 100)
    private String subject;

    /** Position within the source's table of contents. */
    @Column(name = "order_index")
    private int orderIndex;
}
