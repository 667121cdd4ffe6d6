package com.ai.tutor.controller;

import com.ai.tutor.dto.TopicSummaryResponse;
import com.ai.tutor.service.ContextCacheService;
import com.ai.tutor.service.TopicSummaryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/topics/{topicId}")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class TopicController {

    private final ContextCacheService contextCacheService;
    private final TopicSummaryService topicSummaryService;

    @GetMapping("/context")
    public ResponseEntity<Map<String, Object>> getContext(@PathVariable long topicId,
                                                          @RequestParam(defaultValue = "3") int topK) {
        String context = contextCacheService.getContext(topicId, topK);
        return ResponseEntity.ok(Map.of("topicId", topicId, "topK", topK, "context", context));
    }

    @GetMapping("/summary")
    public ResponseEntity<TopicSummaryResponse> getSummary(@PathVariable long topicId,
                                                           @RequestParam(required = false) String course) {
        return ResponseEntity.ok(topicSummaryService.summarize(topicId, course));
    }
}
