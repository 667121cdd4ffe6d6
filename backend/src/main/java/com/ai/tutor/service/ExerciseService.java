package com.ai.tutor.service;

import com.ai.tutor.config.TutorProperties;
import com.ai.tutor.dto.EvaluationResult;
import com.ai.tutor.dto.ExercisePayload;
import com.ai.tutor.dto.ExerciseRequest;
import com.ai.tutor.dto.ExerciseResponse;
import com.ai.tutor.dto.HintResponse;
import com.ai.tutor.dto.SubmissionRequest;
import com.ai.tutor.dto.SubmissionResponse;
import com.ai.tutor.engine.GenerativeEngine;
import com.ai.tutor.exception.ExerciseNotFoundException;
import com.ai.tutor.exception.TopicNotFoundException;
import com.ai.tutor.model.Difficulty;
import com.ai.tutor.model.Exercise;
import com.ai.tutor.model.Submission;
import com.ai.tutor.model.Topic;
import com.ai.tutor.pool.ExercisePoolCache;
import com.ai.tutor.pool.PoolKey;
import com.ai.tutor.prefetch.PrefetchService;
import com.ai.tutor.repository.ExerciseRepository;
import com.ai.tutor.repository.SubmissionRepository;
import com.ai.tutor.repository.TopicRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * ExerciseService serves practice exercises and handles the answers to them.
 *
 * <h2>Serving an exercise</h2>
 * <ol>
 * <li>Take the oldest pooled exercise for (topic, difficulty, course) that the
 * student has not done yet. A hit costs no generative call.</li>
 * <li>On a miss, fetch the topic context and generate one synchronously.</li>
 * <li>Persist what was served, then queue a background refill of the same
 * pool whatever the outcome of the first two steps.</li>
 * </ol>
 */
@Slf4j
@Service
public class ExerciseService {

    private final TopicRepository topicRepository;
    private final ExerciseRepository exerciseRepository;
    private final SubmissionRepository submissionRepository;
    private final ExercisePoolCache poolCache;
    private final ContextCacheService contextCacheService;
    private final ExerciseGenerationService generationService;
    private final StudentHistoryService studentHistoryService;
    private final PrefetchService prefetchService;
    private final GenerativeEngine generativeEngine;
    private final int contextTopK;

    public ExerciseService(TopicRepository topicRepository,
                           ExerciseRepository exerciseRepository,
                           SubmissionRepository submissionRepository,
                           ExercisePoolCache poolCache,
                           ContextCacheService contextCacheService,
                           ExerciseGenerationService generationService,
                           StudentHistoryService studentHistoryService,
                           PrefetchService prefetchService,
                           GenerativeEngine generativeEngine,
                           TutorProperties properties) {
        this.topicRepository = topicRepository;
        this.exerciseRepository = exerciseRepository;
        this.submissionRepository = submissionRepository;
        this.poolCache = poolCache;
        this.contextCacheService = contextCacheService;
        this.generationService = generationService;
        this.studentHistoryService = studentHistoryService;
        this.prefetchService = prefetchService;
        this.generativeEngine = generativeEngine;
        this.contextTopK = properties.getContext().getGenerationTopK();
    }

    // ── Public API ──────────────────────────────────────────────────────────

    /**
     * Returns an exercise the student has not completed yet.
     *
     * @throws TopicNotFoundException if the topic does not exist
     * @throws com.ai.tutor.exception.GenerativeEngineException if the pool had
     *         nothing to offer and generation failed
     */
    public ExerciseResponse requestExercise(String studentId, ExerciseRequest request) {
        long startTime = System.currentTimeMillis();
        Topic topic = topicRepository.findById(request.getTopicId())
                .orElseThrow(() -> new TopicNotFoundException(request.getTopicId()));
        Difficulty difficulty = request.getDifficulty() != null ? request.getDifficulty() : Difficulty.MEDIUM;
        PoolKey key = PoolKey.of(topic, difficulty, request.getCourse());

        Set<String> completed = studentHistoryService.completedContents(studentId);
        Optional<ExercisePayload> pooled = poolCache.take(key, completed);

        ExercisePayload payload;
        boolean fromPool = pooled.isPresent();
        if (fromPool) {
            payload = pooled.get();
        } else {
            String context = contextCacheService.getContext(topic.getId(), contextTopK);
            payload = generationService.generate(topic.getName(), context, difficulty, key.course());
        }

        Exercise exercise = exerciseRepository.save(Exercise.builder()
                .topicId(topic.getId())
                .content(payload.getContent())
                .solution(payload.getSolution())
                .methodology(payload.getMethodology())
                .availableProcedures(payload.getAvailableProcedures())
                .expectedProcedures(payload.getExpectedProcedures())
                .difficulty(difficulty)
                .course(key.course())
                .fromPool(fromPool)
                .build());

        prefetchService.scheduleRefill(studentId, key.course(), topic.getId(), difficulty);

        log.info("[TIMING] Exercise {} for student {} served in {}ms (fromPool={})",
                exercise.getId(), studentId, System.currentTimeMillis() - startTime, fromPool);
        return ExerciseResponse.builder()
                .id(exercise.getId())
                .topicId(topic.getId())
                .topic(topic.getName())
                .difficulty(difficulty)
                .content(exercise.getContent())
                .availableProcedures(exercise.getAvailableProcedures())
                .fromPool(fromPool)
                .build();
    }

    /**
     * Evaluates an answer and records it in the student's history.
     *
     * <p>
     * When the exercise lists expected procedures and the student selected
     * some, the methodology is correct exactly when every expected procedure
     * was selected; otherwise the engine's judgement is kept.
     * </p>
     */
    public SubmissionResponse submit(long exerciseId, String studentId, SubmissionRequest request) {
        Exercise exercise = exerciseRepository.findById(exerciseId)
                .orElseThrow(() -> new ExerciseNotFoundException(exerciseId));

        EvaluationResult evaluation = generativeEngine.evaluateSubmission(exercise.getContent(),
                exercise.getSolution(), exercise.getMethodology(),
                request.getAnswer(), request.getMethodology());

        boolean correctMethodology = evaluation.isCorrectMethodology();
        List<Integer> expected = exercise.getExpectedProcedures();
        List<Integer> selected = request.getSelectedProcedures();
        if (expected != null && !expected.isEmpty() && selected != null && !selected.isEmpty()) {
            correctMethodology = new HashSet<>(selected).containsAll(expected);
        }

        Submission submission = submissionRepository.save(Submission.builder()
                .exerciseId(exerciseId)
                .studentId(studentId)
                .answer(request.getAnswer())
                .methodology(request.getMethodology())
                .selectedProcedures(selected)
                .retry(request.isRetry())
                .correctResult(evaluation.isCorrectResult())
                .correctMethodology(correctMethodology)
                .feedback(evaluation.getFeedback())
                .build());

        String detailedFeedback = null;
        List<String> errors = evaluation.getErrorsFound();
        if (!evaluation.isCorrectResult() && errors != null && !errors.isEmpty()) {
            detailedFeedback = generativeEngine.generateFeedback(exercise.getContent(), request.getAnswer(),
                    request.getMethodology(), errors, null);
        }

        log.info("Submission {} for exercise {} by student {}: result={}, methodology={}",
                submission.getId(), exerciseId, studentId, evaluation.isCorrectResult(), correctMethodology);
        return SubmissionResponse.builder()
                .submissionId(submission.getId())
                .exerciseId(exerciseId)
                .correctResult(evaluation.isCorrectResult())
                .correctMethodology(correctMethodology)
                .errorsFound(errors)
                .feedback(evaluation.getFeedback())
                .detailedFeedback(detailedFeedback)
                .solution(request.isRetry() ? exercise.getSolution() : null)
                .build();
    }

    /**
     * Level 1 is a short text hint, level 2 a Mermaid diagram of the strategy.
     */
    public HintResponse hint(long exerciseId, int level) {
        if (level != 1 && level != 2) {
            throw new IllegalArgumentException("Hint level must be 1 or 2, got " + level);
        }
        Exercise exercise = exerciseRepository.findById(exerciseId)
                .orElseThrow(() -> new ExerciseNotFoundException(exerciseId));
        String context = contextCacheService.getContext(exercise.getTopicId(), contextTopK);

        String hint = level == 1
                ? generativeEngine.generateHint(exercise.getContent(), context)
                : generativeEngine.generateVisualScheme(exercise.getContent(), context);
        return HintResponse.builder()
                .exerciseId(exerciseId)
                .level(level)
                .type(level == 1 ? "text" : "visual")
                .hint(hint)
                .build();
    }
}
