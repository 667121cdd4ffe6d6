package com.ai.tutor.pool;

import com.ai.tutor.cache.CacheKeys;
import com.ai.tutor.model.Difficulty;
import com.ai.tutor.model.Topic;

import java.util.Map;

/**
 * Identifies one exercise queue: a topic at one difficulty for one course.
 *
 * @param topic      topic name
 * @param difficulty difficulty level
 * @param course     student's course, "" when unknown
 */
public record PoolKey(String topic, Difficulty difficulty, String course) {

    public PoolKey {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Pool key needs a topic");
        }
        if (difficulty == null) {
            difficulty = Difficulty.MEDIUM;
        }
        if (course == null) {
            course = "";
        }
    }

    /**
     * Key for a topic as requested by a student. The student's course wins over
     * the topic's own course.
     */
    public static PoolKey of(Topic topic, Difficulty difficulty, String requestedCourse) {
        String course = requestedCourse != null && !requestedCourse.isBlank() ? requestedCourse : topic.getCourse();
        return new PoolKey(topic.getName(), difficulty, course);
    }

    /** Key of the queue in the cache store. */
    public String cacheKey() {
        return CacheKeys.generate(CacheKeys.EXERCISE_POOL, Map.of(
                "topic", topic,
                "difficulty", difficulty.wireName(),
                "course", course));
    }
}
