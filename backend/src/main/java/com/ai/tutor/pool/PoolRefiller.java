package com.ai.tutor.pool;

import com.ai.tutor.config.TutorProperties;
import com.ai.tutor.dto.ExercisePayload;
import com.ai.tutor.model.Difficulty;
import com.ai.tutor.model.Topic;
import com.ai.tutor.repository.TopicRepository;
import com.ai.tutor.service.ContextCacheService;
import com.ai.tutor.service.ExerciseGenerationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Generates one new exercise for a queue, retrying a bounded number of times
 * while the engine keeps producing statements that are already queued or that
 * the student has already done.
 */
@Slf4j
@Component
public class PoolRefiller {

    private final ExercisePoolCache poolCache;
    private final TopicRepository topicRepository;
    private final ContextCacheService contextCacheService;
    private final ExerciseGenerationService generationService;
    private final int maxAttempts;
    private final int contextTopK;

    public PoolRefiller(ExercisePoolCache poolCache,
                        TopicRepository topicRepository,
                        ContextCacheService contextCacheService,
                        ExerciseGenerationService generationService,
                        TutorProperties properties) {
        this.poolCache = poolCache;
        this.topicRepository = topicRepository;
        this.contextCacheService = contextCacheService;
        this.generationService = generationService;
        this.maxAttempts = Math.max(1, properties.getPool().getMaxGenerationAttempts());
        this.contextTopK = properties.getContext().getGenerationTopK();
    }

    /**
     * Tries to queue one exercise for the topic. Engine failures propagate to
     * the caller.
     */
    public RefillOutcome refill(long topicId, Difficulty difficulty, String course, Set<String> completedContents) {
        Optional<Topic> found = topicRepository.findById(topicId);
        if (found.isEmpty()) {
            log.warn("Refill skipped: unknown topicId={}", topicId);
            return RefillOutcome.UNKNOWN_TOPIC;
        }
        Topic topic = found.get();
        PoolKey key = PoolKey.of(topic, difficulty, course);

        if (poolCache.isFull(key)) {
            log.debug("Refill skipped: pool {} is full", key);
            return RefillOutcome.POOL_FULL;
        }
        if (!poolCache.tryBeginRefill(key)) {
            log.debug("Refill skipped: pool {} is already being refilled", key);
            return RefillOutcome.BUSY;
        }
        try {
            String context = contextCacheService.getContext(topicId, contextTopK);
            if (context.isEmpty()) {
                log.warn("Refill skipped: no context for topic '{}'", topic.getName());
                return RefillOutcome.NO_CONTEXT;
            }

            Set<String> queued = new HashSet<>(poolCache.contents(key));
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                ExercisePayload payload = generationService.generate(topic.getName(), context,
                        key.difficulty(), key.course());
                String content = payload.getContent();
                if (content == null || content.isBlank()
                        || completedContents.contains(content) || queued.contains(content)) {
                    log.debug("Refill attempt {}/{} for {} produced a duplicate", attempt, maxAttempts, key);
                    continue;
                }
                if (poolCache.add(key, payload)) {
                    return RefillOutcome.ADDED;
                }
                List<String> nowQueued = poolCache.contents(key);
                if (!nowQueued.contains(content)) {
                    log.warn("Refill for {} generated an exercise the cache store did not keep", key);
                    return RefillOutcome.NOT_STORED;
                }
                queued.addAll(nowQueued);
            }
            log.info("Refill for {} gave up after {} duplicate attempts", key, maxAttempts);
            return RefillOutcome.DUPLICATES;
        } finally {
            poolCache.endRefill(key);
        }
    }
}
