package com.ai.tutor.service;

import com.ai.tutor.dto.ExercisePayload;
import com.ai.tutor.engine.GenerativeEngine;
import com.ai.tutor.model.Difficulty;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * One call to the active generative engine for an exercise, with timing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExerciseGenerationService {

    private final GenerativeEngine generativeEngine;

    public ExercisePayload generate(String topicName, String context, Difficulty difficulty, String course) {
        long startTime = System.currentTimeMillis();
        ExercisePayload payload = generativeEngine.generateExercise(topicName, context, difficulty, course);
        log.info("[TIMING] {} generated a {} exercise for '{}' in {}ms",
                generativeEngine.name(), difficulty.wireName(), topicName, System.currentTimeMillis() - startTime);
        return payload;
    }
}
