package com.ai.tutor.prefetch;

import com.ai.tutor.config.TutorProperties;
import com.ai.tutor.model.Difficulty;
import com.ai.tutor.pool.PoolRefiller;
import com.ai.tutor.pool.RefillOutcome;
import com.ai.tutor.service.ContextCacheService;
import com.ai.tutor.service.StudentHistoryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Fire-and-forget background work that warms the context cache and the
 * exercise pools ahead of the student's requests.
 *
 * <p>
 * Jobs only carry ids and read everything they need when they run. A job
 * that fails, or that the executor rejects because its queue is full, is
 * logged and dropped; callers never see the outcome.
 * </p>
 */
@Slf4j
@Service
public class PrefetchService {

    private final TaskExecutor prefetchExecutor;
    private final ContextCacheService contextCacheService;
    private final PoolRefiller poolRefiller;
    private final StudentHistoryService studentHistoryService;
    private final TutorProperties properties;

    public PrefetchService(@Qualifier("prefetchExecutor") TaskExecutor prefetchExecutor,
                           ContextCacheService contextCacheService,
                           PoolRefiller poolRefiller,
                           StudentHistoryService studentHistoryService,
                           TutorProperties properties) {
        this.prefetchExecutor = prefetchExecutor;
        this.contextCacheService = contextCacheService;
        this.poolRefiller = poolRefiller;
        this.studentHistoryService = studentHistoryService;
        this.properties = properties;
    }

    /**
     * Called when a student opens a practice session with the topics assigned
     * to them, in order. Warms the contexts of the first topics, then fills the
     * pools of the first topics at every difficulty.
     */
    public void onSessionStart(String studentId, String course, List<Long> topicIds) {
        if (topicIds == null || topicIds.isEmpty()) {
            return;
        }
        TutorProperties.Prefetch prefetch = properties.getPrefetch();
        List<Long> contextTopics = topicIds.subList(0, Math.min(prefetch.getContextTopics(), topicIds.size()));
        List<Long> exerciseTopics = topicIds.subList(0, Math.min(prefetch.getExerciseTopics(), topicIds.size()));
        int topK = properties.getContext().getPrefetchTopK();

        log.info("Prefetch started for student {}: contexts for {}, exercises for {}",
                studentId, contextTopics, exerciseTopics);
        submit("warm contexts " + contextTopics,
                () -> contextCacheService.warm(List.copyOf(contextTopics), topK));
        submit("fill pools " + exerciseTopics,
                () -> fillPools(studentId, course, List.copyOf(exerciseTopics)));
    }

    /**
     * Rolling prefetch: one more exercise for the topic the student is
     * practising, requested right after one was consumed.
     */
    public void prefetchNext(String studentId, String course, long topicId, Difficulty difficulty) {
        log.debug("Rolling prefetch for student {} topic {} ({})", studentId, topicId, difficulty);
        scheduleRefill(studentId, course, topicId, difficulty);
    }

    /** Queues one background refill of the topic's pool. */
    public void scheduleRefill(String studentId, String course, long topicId, Difficulty difficulty) {
        submit("refill topic " + topicId + " " + difficulty.wireName(),
                () -> refill(studentId, course, topicId, difficulty));
    }

    private void fillPools(String studentId, String course, List<Long> topicIds) {
        long startTime = System.currentTimeMillis();
        int added = 0;
        for (Long topicId : topicIds) {
            for (Difficulty difficulty : Difficulty.values()) {
                if (refill(studentId, course, topicId, difficulty) == RefillOutcome.ADDED) {
                    added++;
                }
            }
        }
        log.info("Prefetched {} exercises for student {} in {}ms",
                added, studentId, System.currentTimeMillis() - startTime);
    }

    private RefillOutcome refill(String studentId, String course, long topicId, Difficulty difficulty) {
        try {
            Set<String> completed = studentHistoryService.completedContents(studentId);
            RefillOutcome outcome = poolRefiller.refill(topicId, difficulty, course, completed);
            log.debug("Refill topic {} ({}) for student {}: {}", topicId, difficulty, studentId, outcome);
            return outcome;
        } catch (RuntimeException e) {
            log.warn("Refill of topic {} ({}) failed: {}", topicId, difficulty, e.getMessage());
            return null;
        }
    }

    private void submit(String description, Runnable job) {
        try {
            prefetchExecutor.execute(() -> {
                try {
                    job.run();
                } catch (RuntimeException e) {
                    log.warn("Prefetch job '{}' failed: {}", description, e.getMessage(), e);
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("Prefetch job '{}' dropped, executor is saturated", description);
        }
    }
}
