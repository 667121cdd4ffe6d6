package com.ai.tutor.embedding;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded least-recently-used map from content hash to embedding vector.
 * Access-ordered {@link LinkedHashMap}; every method synchronizes on the cache.
 */
class LruEmbeddingCache {

    private final int maxSize;
    private final LinkedHashMap<String, float[]> entries;

    LruEmbeddingCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Embedding cache size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(Math.min(maxSize, 1024), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, float[]> eldest) {
                return size() > LruEmbeddingCache.this.maxSize;
            }
        };
    }

    synchronized float[] get(String key) {
        return entries.get(key);
    }

    synchronized void put(String key, float[] vector) {
        entries.put(key, vector);
    }

    synchronized int size() {
        return entries.size();
    }
}
