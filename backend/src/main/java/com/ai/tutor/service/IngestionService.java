package com.ai.tutor.service;

import com.ai.tutor.dto.IngestRequest;
import com.ai.tutor.dto.IngestResponse;
import com.ai.tutor.dto.SourceChunk;
import com.ai.tutor.pool.ExercisePoolCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns already extracted source text into stored chunks and drops the
 * contexts that were built from the previous contents. Pooled exercises are
 * dropped too when chunks were removed, since they were generated from text
 * that no longer exists.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    private final ChunkingService chunkingService;
    private final VectorStoreService vectorStoreService;
    private final ContextCacheService contextCacheService;
    private final ExercisePoolCache exercisePoolCache;

    public IngestResponse ingest(long sourceId, IngestRequest request) {
        long startTime = System.currentTimeMillis();

        List<SourceChunk> chunks;
        if (request.getPages() != null && !request.getPages().isEmpty()) {
            chunks = chunkingService.chunkPages(request.getPages());
        } else if (request.getText() != null && !request.getText().isBlank()) {
            chunks = chunkingService.chunk(request.getText());
        } else {
            throw new IllegalArgumentException("Nothing to ingest: provide 'pages' or 'text'");
        }

        int replaced = request.isReplace() ? vectorStoreService.deleteBySource(sourceId) : 0;
        int stored = vectorStoreService.storeChunks(sourceId, chunks);
        contextCacheService.invalidateAll();
        if (replaced > 0) {
            exercisePoolCache.clearAll();
        }

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("Ingested sourceId={}: {} chunks stored, {} replaced, {}ms", sourceId, stored, replaced, elapsed);
        return IngestResponse.builder()
                .sourceId(sourceId)
                .chunksStored(stored)
                .chunksReplaced(replaced)
                .elapsedMs(elapsed)
                .build();
    }

    /** Removes every chunk of a source and everything generated from them. */
    public int deleteSource(long sourceId) {
        int deleted = vectorStoreService.deleteBySource(sourceId);
        contextCacheService.invalidateAll();
        if (deleted > 0) {
            exercisePoolCache.clearAll();
        }
        return deleted;
    }

    public long chunkCount(long sourceId) {
        return vectorStoreService.countBySource(sourceId);
    }
}
