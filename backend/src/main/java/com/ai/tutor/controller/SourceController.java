package com.ai.tutor.controller;

import com.ai.tutor.dto.IngestRequest;
import com.ai.tutor.dto.IngestResponse;
import com.ai.tutor.dto.RetrievedChunk;
import com.ai.tutor.dto.SourceMetadata;
import com.ai.tutor.dto.TopicExtractionRequest;
import com.ai.tutor.model.Topic;
import com.ai.tutor.service.IngestionService;
import com.ai.tutor.service.RetrievalService;
import com.ai.tutor.service.TopicExtractionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Ingestion and search over the text of a source (textbook or video
 * transcript). Text extraction happens upstream; these endpoints receive
 * plain text.
 */
@Slf4j
@RestController
@RequestMapping("/api/sources/{sourceId}")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class SourceController {

    private final IngestionService ingestionService;
    private final RetrievalService retrievalService;
    private final TopicExtractionService topicExtractionService;

    // ── POST /api/sources/{sourceId}/ingest ───────────────────────────────

    @PostMapping("/ingest")
    public ResponseEntity<IngestResponse> ingest(@PathVariable long sourceId,
                                                 @Valid @RequestBody IngestRequest request) {
        log.info("Ingest request for sourceId={} ({} pages, replace={})",
                sourceId, request.getPages() != null ? request.getPages().size() : 0, request.isReplace());
        return ResponseEntity.ok(ingestionService.ingest(sourceId, request));
    }

    // ── GET /api/sources/{sourceId}/chunks ────────────────────────────────

    @GetMapping("/chunks")
    public ResponseEntity<Map<String, Object>> countChunks(@PathVariable long sourceId) {
        return ResponseEntity.ok(Map.of("sourceId", sourceId, "chunks", ingestionService.chunkCount(sourceId)));
    }

    // ── DELETE /api/sources/{sourceId}/chunks ─────────────────────────────

    @DeleteMapping("/chunks")
    public ResponseEntity<Map<String, Object>> deleteChunks(@PathVariable long sourceId) {
        int deleted = ingestionService.deleteSource(sourceId);
        return ResponseEntity.ok(Map.of("sourceId", sourceId, "chunksDeleted", deleted));
    }

    // ── GET /api/sources/{sourceId}/search?q=&topK= ───────────────────────

    @GetMapping("/search")
    public ResponseEntity<List<RetrievedChunk>> search(@PathVariable long sourceId,
                                                       @RequestParam("q") String query,
                                                       @RequestParam(defaultValue = "3") int topK) {
        return ResponseEntity.ok(retrievalService.retrieve(query, sourceId, topK));
    }

    // ── POST /api/sources/{sourceId}/topics ───────────────────────────────

    @PostMapping("/topics")
    public ResponseEntity<List<Topic>> extractTopics(@PathVariable long sourceId,
                                                     @RequestBody TopicExtractionRequest request) {
        SourceMetadata metadata = SourceMetadata.builder()
                .title(request.getTitle())
                .course(request.getCourse())
                .subject(request.getSubject())
                .sourceType(request.getSourceType())
                .build();
        return ResponseEntity.ok(topicExtractionService.extractTopics(sourceId, metadata));
    }
}
