package com.ai.tutor.engine;

import com.ai.tutor.dto.EvaluationResult;
import com.ai.tutor.dto.ExercisePayload;
import com.ai.tutor.dto.SourceMetadata;
import com.ai.tutor.dto.TopicOutline;
import com.ai.tutor.model.Difficulty;

import java.util.List;

/**
 * A pluggable generative-language provider. One implementation is active per
 * process, chosen from {@code tutor.engine.provider} at startup.
 *
 * <p>
 * Every operation may block for up to the configured timeout. Transport
 * failures, timeouts and non-success statuses are raised as
 * {@link com.ai.tutor.exception.GenerativeEngineException}; malformed model
 * output never is.
 * </p>
 */
public interface GenerativeEngine {

    /** Provider name as configured, e.g. {@code openai}. */
    String name();

    /**
     * Generates one exercise for the topic, grounded on the retrieved context.
     * When the answer cannot be parsed the raw text becomes the statement.
     */
    ExercisePayload generateExercise(String topic, String context, Difficulty difficulty, String course);

    EvaluationResult evaluateSubmission(String exercise, String expectedSolution, String expectedMethodology,
                                        String studentAnswer, String studentMethodology);

    /**
     * Longer didactic explanation of what went wrong, used after a failed
     * evaluation.
     */
    String generateFeedback(String exercise, String studentAnswer, String studentMethodology,
                            List<String> errors, String context);

    String generateHint(String exercise, String context);

    /**
     * A diagram of the solving strategy in Mermaid syntax, without code fences.
     */
    String generateVisualScheme(String exercise, String context);

    /**
     * Topics found in the opening chunks of a source. Returns an empty list when
     * the answer holds no readable topic list.
     */
    List<TopicOutline> extractTopics(List<String> textChunks, SourceMetadata metadata);

    /** Markdown study summary of a topic. */
    String generateTopicSummary(String topic, String context, String course);
}
