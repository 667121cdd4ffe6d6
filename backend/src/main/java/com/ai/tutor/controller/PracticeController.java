package com.ai.tutor.controller;

import com.ai.tutor.dto.ExerciseRequest;
import com.ai.tutor.dto.ExerciseResponse;
import com.ai.tutor.dto.HintResponse;
import com.ai.tutor.dto.PracticeSessionRequest;
import com.ai.tutor.dto.PrefetchNextRequest;
import com.ai.tutor.dto.SubmissionRequest;
import com.ai.tutor.dto.SubmissionResponse;
import com.ai.tutor.model.Difficulty;
import com.ai.tutor.prefetch.PrefetchService;
import com.ai.tutor.service.ExerciseService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Practice endpoints for one student: opening a session, getting exercises,
 * answering them and asking for hints.
 */
@Slf4j
@RestController
@RequestMapping("/api/practice/{studentId}")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class PracticeController {

    private final ExerciseService exerciseService;
    private final PrefetchService prefetchService;

    // ── POST /api/practice/{studentId}/session ────────────────────────────

    /** Starts background warming and answers immediately. */
    @PostMapping("/session")
    public ResponseEntity<Map<String, Object>> startSession(@PathVariable String studentId,
                                                            @Valid @RequestBody PracticeSessionRequest request) {
        prefetchService.onSessionStart(studentId, request.getCourse(), request.getTopicIds());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("studentId", studentId, "prefetching", true));
    }

    // ── POST /api/practice/{studentId}/exercise ───────────────────────────

    @PostMapping("/exercise")
    public ResponseEntity<ExerciseResponse> requestExercise(@PathVariable String studentId,
                                                            @Valid @RequestBody ExerciseRequest request) {
        log.info("Exercise request: student={}, topicId={}, difficulty={}",
                studentId, request.getTopicId(), request.getDifficulty());
        return ResponseEntity.ok(exerciseService.requestExercise(studentId, request));
    }

    // ── POST /api/practice/{studentId}/prefetch-next ──────────────────────

    @PostMapping("/prefetch-next")
    public ResponseEntity<Map<String, Object>> prefetchNext(@PathVariable String studentId,
                                                            @Valid @RequestBody PrefetchNextRequest request) {
        Difficulty difficulty = request.getDifficulty() != null ? request.getDifficulty() : Difficulty.MEDIUM;
        prefetchService.prefetchNext(studentId, request.getCourse(), request.getTopicId(), difficulty);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("topicId", request.getTopicId(), "difficulty", difficulty.wireName()));
    }

    // ── POST /api/practice/{studentId}/exercises/{exerciseId}/submit ──────

    @PostMapping("/exercises/{exerciseId}/submit")
    public ResponseEntity<SubmissionResponse> submit(@PathVariable String studentId,
                                                     @PathVariable long exerciseId,
                                                     @RequestBody SubmissionRequest request) {
        return ResponseEntity.ok(exerciseService.submit(exerciseId, studentId, request));
    }

    // ── POST /api/practice/{studentId}/exercises/{exerciseId}/hint?level= ─

    @PostMapping("/exercises/{exerciseId}/hint")
    public ResponseEntity<HintResponse> hint(@PathVariable String studentId,
                                             @PathVariable long exerciseId,
                                             @RequestParam(defaultValue = "1") int level) {
        log.debug("Hint level {} for exercise {} requested by student {}", level, exerciseId, studentId);
        return ResponseEntity.ok(exerciseService.hint(exerciseId, level));
    }
}
