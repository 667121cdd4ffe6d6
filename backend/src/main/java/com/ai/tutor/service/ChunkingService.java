package com.ai.tutor.service;

import com.ai.tutor.config.TutorProperties;
import com.ai.tutor.dto.SourceChunk;
import com.ai.tutor.dto.SourcePage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits source text into overlapping character windows for embedding.
 *
 * <p>
 * A window is cut back to the last sentence end ({@code . ? !}) when that end
 * lies in its second half, so chunks rarely stop mid-sentence. Consecutive
 * windows share {@code overlap} characters.
 * </p>
 */
@Slf4j
@Service
public class ChunkingService {

    private final int chunkSize;
    private final int overlap;

    public ChunkingService(TutorProperties properties) {
        this.chunkSize = properties.getChunking().getSize();
        this.overlap = properties.getChunking().getOverlap();
        if (chunkSize <= 0 || overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("Invalid chunking settings: size=" + chunkSize
                    + ", overlap=" + overlap);
        }
    }

    /** Chunks a single block of text; chunks carry no locator. */
    public List<SourceChunk> chunk(String text) {
        return chunkPages(List.of(new SourcePage(null, text)));
    }

    /**
     * Chunks every page in order. Chunk indexes run across the whole source and
     * each chunk keeps the locator of the page it was cut from.
     */
    public List<SourceChunk> chunkPages(List<SourcePage> pages) {
        List<SourceChunk> chunks = new ArrayList<>();
        for (SourcePage page : pages) {
            String text = page.getText();
            if (text == null || text.isBlank()) {
                continue;
            }
            for (String window : windows(text)) {
                chunks.add(new SourceChunk(window, chunks.size(), page.getLocator()));
            }
        }
        log.debug("Chunked {} pages into {} chunks (size={}, overlap={})",
                pages.size(), chunks.size(), chunkSize, overlap);
        return chunks;
    }

    private List<String> windows(String text) {
        List<String> windows = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(start + chunkSize, text.length());
            if (end < text.length()) {
                int sentenceEnd = lastSentenceEnd(text, start, end);
                if (sentenceEnd - start > chunkSize / 2) {
                    end = sentenceEnd + 1;
                }
            }
            String window = text.substring(start, end).trim();
            if (!window.isEmpty()) {
                windows.add(window);
            }
            if (end >= text.length()) {
                break;
            }
            start = Math.max(end - overlap, start + 1);
        }
        return windows;
    }

    private static int lastSentenceEnd(String text, int from, int to) {
        for (int i = to - 1; i >= from; i--) {
            char c = text.charAt(i);
            if (c == '.' || c == '?' || c == '!') {
                return i;
            }
        }
        return -1;
    }
}
