package com.ai.tutor.embedding;

import com.ai.tutor.exception.EmbeddingModelException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * Process-wide handle to the loaded embedding model.
 *
 * <p>
 * The model is loaded lazily by the first caller of {@link #get()}; concurrent
 * callers block on the same monitor until loading finishes and then share the
 * instance. A failed load is remembered: every later call rethrows the same
 * {@link EmbeddingModelException} without touching the loader again.
 * </p>
 */
@Slf4j
public class EmbeddingModelHolder {

    private final EmbeddingModelLoader loader;
    private final Object lock = new Object();

    private volatile EmbeddingModel model;
    private volatile EmbeddingModelException failure;

    public EmbeddingModelHolder(EmbeddingModelLoader loader) {
        this.loader = loader;
    }

    public EmbeddingModel get() {
        EmbeddingModel local = model;
        if (local != null) {
            return local;
        }
        synchronized (lock) {
            if (model == null) {
                if (failure != null) {
                    throw failure;
                }
                model = load();
            }
            return model;
        }
    }

    public boolean isLoaded() {
        return model != null;
    }

    private EmbeddingModel load() {
        long startTime = System.currentTimeMillis();
        log.info("Loading embedding model...");
        try {
            EmbeddingModel loaded = loader.load();
            if (loaded == null) {
                throw new IllegalStateException("Embedding model loader returned null");
            }
            log.info("Embedding model loaded in {}ms", System.currentTimeMillis() - startTime);
            return loaded;
        } catch (Exception e) {
            log.error("Embedding model failed to load: {}", e.getMessage(), e);
            failure = new EmbeddingModelException("Embedding model failed to load: " + e.getMessage(), e);
            throw failure;
        }
    }
}
