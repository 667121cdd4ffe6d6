package com.ai.tutor.model;

import com.ai.tutor.model.converter.IntegerListConverter;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Persists a single answer to an exercise so we can:
 * - Build the student's history of completed exercise contents
 * - Show the evaluation that was returned to the student
 */
@Entity
@Table(name = "submissions", indexes = {
        @Index(name = "idx_submissions_student", columnList = "student_id"),
        @Index(name = "idx_submissions_exercise", columnList = "exercise_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Submission {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "exercise_id", nullable = false)
    private Long exerciseId;

    @Column(name = "student_id", nullable = false, length = 64)
    private String studentId;

    @Column(columnDefinition = "TEXT")
    private String answer;

    @Column(columnDefinition = "TEXT")
    private String methodology;

    @Convert(converter = IntegerListConverter.class)
    @Column(name = "selected_procedures", columnDefinition = "TEXT")
    @Builder.Default
    private List<Integer> selectedProcedures = new ArrayList<>();

    /** Second attempt at the same exercise; the solution is revealed. */
    @Column(nullable = false)
    private boolean retry;

    @Column(name = "correct_result", nullable = false)
    private boolean correctResult;

    @Column(name = "correct_methodology", nullable = false)
    private boolean correctMethodology;

    @Column(columnDefinition = "TEXT")
    private String feedback;

    @CreationTimestamp
    @Column(name = "submitted_at", nullable = false, updatable = false)
    private LocalDateTime submittedAt;

    @PrePersist
    public void prePersist() {
        if (id == null)
            id = UUID.randomUUID().toString();
    }
}
