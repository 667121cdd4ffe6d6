package com.ai.tutor.service;

import com.ai.tutor.cache.CacheAsideClient;
import com.ai.tutor.cache.CacheKeys;
import com.ai.tutor.config.TutorProperties;
import com.ai.tutor.dto.TopicSummaryResponse;
import com.ai.tutor.engine.GenerativeEngine;
import com.ai.tutor.exception.TopicNotFoundException;
import com.ai.tutor.model.Topic;
import com.ai.tutor.repository.TopicRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;

/**
 * Study summaries of a topic, generated from its context and memoized per
 * (topic, course).
 */
@Slf4j
@Service
public class TopicSummaryService {

    private final TopicRepository topicRepository;
    private final ContextCacheService contextCacheService;
    private final GenerativeEngine generativeEngine;
    private final CacheAsideClient cacheAsideClient;
    private final Duration ttl;
    private final int contextTopK;

    public TopicSummaryService(TopicRepository topicRepository,
                               ContextCacheService contextCacheService,
                               GenerativeEngine generativeEngine,
                               CacheAsideClient cacheAsideClient,
                               TutorProperties properties) {
        this.topicRepository = topicRepository;
        this.contextCacheService = contextCacheService;
        this.generativeEngine = generativeEngine;
        this.cacheAsideClient = cacheAsideClient;
        this.ttl = properties.getSummary().getTtl();
        this.contextTopK = properties.getRetrieval().getDefaultTopK();
    }

    public TopicSummaryResponse summarize(long topicId, String course) {
        Topic topic = topicRepository.findById(topicId)
                .orElseThrow(() -> new TopicNotFoundException(topicId));
        String effectiveCourse = course != null && !course.isBlank() ? course
                : topic.getCourse() != null ? topic.getCourse() : "";

        String key = CacheKeys.generate(CacheKeys.SUMMARY, Map.of("topic", topic.getName(), "course", effectiveCourse));
        String summary = cacheAsideClient.getOrCompute(key, ttl, String.class, () -> {
            String context = contextCacheService.getContext(topicId, contextTopK);
            long startTime = System.currentTimeMillis();
            String generated = generativeEngine.generateTopicSummary(topic.getName(), context, effectiveCourse);
            log.info("[TIMING] Summary for '{}' generated in {}ms", topic.getName(),
                    System.currentTimeMillis() - startTime);
            return generated;
        }, generated -> generated != null && !generated.isBlank());

        return TopicSummaryResponse.builder()
                .topicId(topicId)
                .topic(topic.getName())
                .course(effectiveCourse)
                .summary(summary)
                .build();
    }
}
