package com.ai.tutor.service;

import com.ai.tutor.dto.RetrievedChunk;
import com.ai.tutor.embedding.EmbeddingGenerator;
import com.ai.tutor.repository.TextChunkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Similarity search over stored chunks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalService {

    private final EmbeddingGenerator embeddingGenerator;
    private final TextChunkRepository chunkRepository;

    /**
     * Returns up to {@code topK} chunks most similar to {@code query}, best
     * first, optionally restricted to one source.
     *
     * @param sourceId source to search in, or {@code null} for every source
     * @return an empty list when {@code topK <= 0} or nothing is stored in scope
     */
    public List<RetrievedChunk> retrieve(String query, Long sourceId, int topK) {
        if (topK <= 0 || query == null || query.isBlank()) {
            return List.of();
        }
        long startTime = System.currentTimeMillis();
        float[] queryVector = embeddingGenerator.generateEmbedding(query);
        List<RetrievedChunk> chunks = chunkRepository.findNearest(queryVector, sourceId, topK);
        log.debug("Retrieved {} chunks for '{}' (sourceId={}, topK={}) in {}ms",
                chunks.size(), query, sourceId, topK, System.currentTimeMillis() - startTime);
        return chunks;
    }
}
