package com.ai.tutor.service;

import com.ai.tutor.cache.CacheAsideClient;
import com.ai.tutor.cache.CacheKeys;
import com.ai.tutor.config.TutorProperties;
import com.ai.tutor.dto.RetrievedChunk;
import com.ai.tutor.model.Topic;
import com.ai.tutor.repository.TopicRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Memoizes the retrieval context of a topic for
 * {@code tutor.context.ttl}: the texts of its most similar chunks, joined by a
 * blank line.
 *
 * <p>
 * Empty contexts are never stored, so a topic whose source is ingested later
 * does not keep answering "" until the entry expires.
 * </p>
 */
@Slf4j
@Service
public class ContextCacheService {

    static final String SEPARATOR = "\n\n";

    private final CacheAsideClient cacheAsideClient;
    private final TopicRepository topicRepository;
    private final RetrievalService retrievalService;
    private final Duration ttl;

    public ContextCacheService(CacheAsideClient cacheAsideClient,
                               TopicRepository topicRepository,
                               RetrievalService retrievalService,
                               TutorProperties properties) {
        this.cacheAsideClient = cacheAsideClient;
        this.topicRepository = topicRepository;
        this.retrievalService = retrievalService;
        this.ttl = properties.getContext().getTtl();
    }

    /**
     * Returns the context for a topic, or "" when the topic does not exist or
     * nothing relevant is stored.
     */
    public String getContext(long topicId, int topKChunks) {
        String key = contextKey(topicId, topKChunks);
        return cacheAsideClient.getOrCompute(key, ttl, String.class,
                () -> buildContext(topicId, topKChunks),
                context -> context != null && !context.isEmpty());
    }

    /** Precomputes the contexts of several topics; unknown topics are skipped. */
    public void warm(List<Long> topicIds, int topKChunks) {
        long startTime = System.currentTimeMillis();
        for (Long topicId : topicIds) {
            getContext(topicId, topKChunks);
        }
        log.info("Warmed contexts for {} topics in {}ms", topicIds.size(), System.currentTimeMillis() - startTime);
    }

    /** Drops every cached context; called after a source is (re)ingested. */
    public long invalidateAll() {
        return cacheAsideClient.evictPattern(CacheKeys.pattern(CacheKeys.CONTEXT));
    }

    static String contextKey(long topicId, int topKChunks) {
        return CacheKeys.generate(CacheKeys.CONTEXT, Map.of("topic_id", topicId, "top_k", topKChunks));
    }

    private String buildContext(long topicId, int topKChunks) {
        Optional<Topic> topic = topicRepository.findById(topicId);
        if (topic.isEmpty()) {
            log.warn("Context requested for unknown topicId={}", topicId);
            return "";
        }
        List<RetrievedChunk> chunks = retrievalService.retrieve(topic.get().getName(),
                topic.get().getSourceId(), topKChunks);
        return chunks.stream().map(RetrievedChunk::getText).collect(Collectors.joining(SEPARATOR));
    }
}
