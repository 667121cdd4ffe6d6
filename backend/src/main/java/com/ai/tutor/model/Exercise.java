package com.ai.tutor.model;

import com.ai.tutor.dto.ProcedureDescriptor;
import com.ai.tutor.model.converter.IntegerListConverter;
import com.ai.tutor.model.converter.ProcedureListConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * An exercise that has been served to a student. Written once per request,
 * whether the payload came from the pool or from a fresh generation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "exercises", indexes = @Index(name = "idx_exercises_topic", columnList = "topic_id"))
public class Exercise {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "topic_id", nullable = false)
    private Long topicId;

    /** The problem statement; also the deduplication key for the pool. */
    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(columnDefinition = "TEXT")
    private String solution;

    @Column(columnDefinition = "TEXT")
    private String methodology;

    @Convert(converter = ProcedureListConverter.class)
    @Column(name = "available_procedures", columnDefinition = "TEXT")
    @Builder.Default
    private List<ProcedureDescriptor> availableProcedures = new ArrayList<>();

    @Convert(converter = IntegerListConverter.class)
    @Column(name = "expected_procedures", columnDefinition = "TEXT")
    @Builder.Default
    private List<Integer> expectedProcedures = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(length = 10, nullable = false)
    private Difficulty difficulty;

    @Column(length = 50)
    private String course;

    /** True when the payload was taken from the pre-generated pool. */
    @Column(name = "from_pool")
    private boolean fromPool;

    @CreationTimestamp
    @Column(name = "generated_at", nullable = false, updatable = false)
    private LocalDateTime generatedAt;
}
