package com.ai.tutor.service;

import com.ai.tutor.config.TutorProperties;
import com.ai.tutor.dto.SourceChunk;
import com.ai.tutor.embedding.EmbeddingGenerator;
import com.ai.tutor.exception.EmbeddingDimensionException;
import com.ai.tutor.repository.TextChunkRepository;
import com.ai.tutor.repository.TextChunkRepository.ChunkRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes embedded chunks to pgvector and removes them per source.
 *
 * <p>
 * Ingestion commits in bounded batches: each batch of
 * {@code tutor.retrieval.store-batch-size} chunks is embedded, checked and
 * inserted in its own transaction, so a failure loses at most the batch in
 * progress and never leaves a partially written batch behind.
 * </p>
 */
@Slf4j
@Service
public class VectorStoreService {

    private final TextChunkRepository chunkRepository;
    private final EmbeddingGenerator embeddingGenerator;
    private final TransactionTemplate transactionTemplate;
    private final int storeBatchSize;

    public VectorStoreService(TextChunkRepository chunkRepository,
                              EmbeddingGenerator embeddingGenerator,
                              TransactionTemplate transactionTemplate,
                              TutorProperties properties) {
        this.chunkRepository = chunkRepository;
        this.embeddingGenerator = embeddingGenerator;
        this.transactionTemplate = transactionTemplate;
        this.storeBatchSize = Math.max(1, properties.getRetrieval().getStoreBatchSize());
    }

    /**
     * Embeds and stores the chunks of a source.
     *
     * @return number of chunks written
     * @throws EmbeddingDimensionException if the model produced a vector of the
     *                                     wrong size; the offending batch is not written
     */
    public int storeChunks(long sourceId, List<SourceChunk> chunks) {
        if (chunks.isEmpty()) {
            return 0;
        }
        long startTime = System.currentTimeMillis();
        int stored = 0;

        for (int from = 0; from < chunks.size(); from += storeBatchSize) {
            List<SourceChunk> batch = chunks.subList(from, Math.min(from + storeBatchSize, chunks.size()));
            List<float[]> vectors = embeddingGenerator.batchEncode(batch.stream().map(SourceChunk::getText).toList());

            List<ChunkRow> rows = new ArrayList<>(batch.size());
            for (int i = 0; i < batch.size(); i++) {
                float[] vector = vectors.get(i);
                if (vector.length != embeddingGenerator.dimensions()) {
                    throw new EmbeddingDimensionException(embeddingGenerator.dimensions(), vector.length);
                }
                SourceChunk chunk = batch.get(i);
                rows.add(new ChunkRow(sourceId, chunk.getText(), chunk.getChunkIndex(), chunk.getLocator(), vector));
            }

            Integer written = transactionTemplate.execute(status -> chunkRepository.insertBatch(rows));
            stored += written != null ? written : 0;
            log.debug("Stored batch of {} chunks for sourceId={} ({}/{})",
                    rows.size(), sourceId, stored, chunks.size());
        }

        log.info("Stored {} chunks for sourceId={} in {}ms", stored, sourceId, System.currentTimeMillis() - startTime);
        return stored;
    }

    public int deleteBySource(long sourceId) {
        int deleted = chunkRepository.deleteBySource(sourceId);
        log.info("Deleted {} chunks for sourceId={}", deleted, sourceId);
        return deleted;
    }

    public long countBySource(long sourceId) {
        return chunkRepository.countBySource(sourceId);
    }

    /** Chunk texts of a source in reading order. */
    public List<String> findTextsBySource(long sourceId, int limit) {
        return chunkRepository.findTextsBySource(sourceId, limit);
    }
}
