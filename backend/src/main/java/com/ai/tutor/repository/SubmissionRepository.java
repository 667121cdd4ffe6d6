package com.ai.tutor.repository;

import com.ai.tutor.model.Submission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for Submission entities.
 */
@Repository
public interface SubmissionRepository extends JpaRepository<Submission, String> {

    /**
     * Distinct contents of every exercise the student has submitted an answer to.
     */
    @Query("select distinct e.content from Exercise e, Submission s "
            + "where s.exerciseId = e.id and s.studentId = :studentId")
    List<String> findCompletedExerciseContents(@Param("studentId") String studentId);
}
