package com.ai.tutor.embedding;

import com.ai.tutor.config.TutorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * EmbeddingGenerator turns text into fixed-size vectors using the one model
 * instance held by {@link EmbeddingModelHolder}.
 *
 * <h2>Caching</h2>
 * <p>
 * Each text is keyed by the MD5 of its UTF-8 bytes. Hits are served from a
 * bounded LRU cache ({@code tutor.embedding.cache-size}, default 5000) without
 * calling the model; misses are encoded and stored. Vectors handed out are
 * copies, so a caller mutating its array never changes what the next caller
 * receives.
 * </p>
 */
@Slf4j
@Service
public class EmbeddingGenerator {

    private final EmbeddingModelHolder modelHolder;
    private final LruEmbeddingCache cache;
    private final int batchSize;
    private final int dimensions;

    public EmbeddingGenerator(EmbeddingModelHolder modelHolder, TutorProperties properties) {
        TutorProperties.Embedding embedding = properties.getEmbedding();
        this.modelHolder = modelHolder;
        this.cache = new LruEmbeddingCache(embedding.getCacheSize());
        this.batchSize = Math.max(1, embedding.getBatchSize());
        this.dimensions = embedding.getDimensions();
    }

    // ── Public API ──────────────────────────────────────────────────────────

    /**
     * Returns the embedding of {@code text}, computing it only on a cache miss.
     */
    public float[] generateEmbedding(String text) {
        String key = contentHash(text);
        float[] cached = cache.get(key);
        if (cached != null) {
            return copy(cached);
        }

        float[] vector = modelHolder.get().embed(text);
        cache.put(key, copy(vector));
        return copy(vector);
    }

    /**
     * Embeds many texts at once for ingestion. Cached texts are skipped; the rest
     * are sent to the model {@code batchSize} at a time. The result list is in the
     * same order as {@code texts}.
     */
    public List<float[]> batchEncode(List<String> texts) {
        float[][] results = new float[texts.size()][];
        List<Integer> missing = new ArrayList<>();

        for (int i = 0; i < texts.size(); i++) {
            float[] cached = cache.get(contentHash(texts.get(i)));
            if (cached != null) {
                results[i] = copy(cached);
            } else {
                missing.add(i);
            }
        }

        log.debug("batchEncode: {} texts, {} cache hits, {} to encode",
                texts.size(), texts.size() - missing.size(), missing.size());

        if (!missing.isEmpty()) {
            EmbeddingModel model = modelHolder.get();
            for (int start = 0; start < missing.size(); start += batchSize) {
                List<Integer> batch = missing.subList(start, Math.min(start + batchSize, missing.size()));
                List<String> batchTexts = batch.stream().map(texts::get).toList();
                List<float[]> vectors = model.embed(batchTexts);

                if (vectors.size() != batchTexts.size()) {
                    throw new IllegalStateException("Embedding model returned " + vectors.size()
                            + " vectors for " + batchTexts.size() + " texts");
                }
                for (int j = 0; j < batch.size(); j++) {
                    int index = batch.get(j);
                    float[] vector = vectors.get(j);
                    cache.put(contentHash(texts.get(index)), copy(vector));
                    results[index] = copy(vector);
                }
            }
        }

        return Arrays.asList(results);
    }

    /** Dimension every vector produced by the configured model is expected to have. */
    public int dimensions() {
        return dimensions;
    }

    public int cacheSize() {
        return cache.size();
    }

    // ── Private helpers ─────────────────────────────────────────────────────

    static String contentHash(String text) {
        return DigestUtils.md5DigestAsHex(text.getBytes(StandardCharsets.UTF_8));
    }

    private static float[] copy(float[] vector) {
        return Arrays.copyOf(vector, vector.length);
    }
}
