package com.ai.tutor.service;

import com.ai.tutor.dto.SourceMetadata;
import com.ai.tutor.dto.TopicOutline;
import com.ai.tutor.engine.GenerativeEngine;
import com.ai.tutor.model.Topic;
import com.ai.tutor.repository.TopicRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the opening chunks of a source (usually its table of contents) and
 * stores the topics the engine finds there.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TopicExtractionService {

    static final int SAMPLE_CHUNKS = 10;

    private final VectorStoreService vectorStoreService;
    private final GenerativeEngine generativeEngine;
    private final TopicRepository topicRepository;

    public List<Topic> extractTopics(long sourceId, SourceMetadata metadata) {
        List<String> sample = vectorStoreService.findTextsBySource(sourceId, SAMPLE_CHUNKS);
        if (sample.isEmpty()) {
            throw new IllegalArgumentException("Source " + sourceId + " has no ingested chunks");
        }

        List<TopicOutline> outlines = generativeEngine.extractTopics(sample, metadata);
        int firstIndex = topicRepository.findBySourceIdOrderByOrderIndexAsc(sourceId).size();

        List<Topic> topics = new ArrayList<>(outlines.size());
        for (int i = 0; i < outlines.size(); i++) {
            TopicOutline outline = outlines.get(i);
            topics.add(Topic.builder()
                    .sourceId(sourceId)
                    .sourceType(metadata.getSourceType() != null ? metadata.getSourceType() : "pdf_book")
                    .name(outline.getName().trim())
                    .description(outline.getDescription())
                    .course(metadata.getCourse())
                    .subject(metadata.getSubject())
                    .orderIndex(firstIndex + i)
                    .build());
        }
        List<Topic> saved = topicRepository.saveAll(topics);
        log.info("Extracted {} topics from sourceId={}", saved.size(), sourceId);
        return saved;
    }
}
