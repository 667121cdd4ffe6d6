package com.ai.tutor.service;

import com.ai.tutor.repository.SubmissionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.Set;

/**
 * Exercise contents a student has already answered; used to avoid serving the
 * same statement twice.
 */
@Service
@RequiredArgsConstructor
public class StudentHistoryService {

    private final SubmissionRepository submissionRepository;

    @Transactional(readOnly = true)
    public Set<String> completedContents(String studentId) {
        return new HashSet<>(submissionRepository.findCompletedExerciseContents(studentId));
    }
}
