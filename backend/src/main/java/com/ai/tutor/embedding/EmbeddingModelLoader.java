package com.ai.tutor.embedding;

import org.springframework.ai.embedding.EmbeddingModel;

/**
 * Produces the embedding model instance. Called at most once per
 * {@link EmbeddingModelHolder}.
 */
@FunctionalInterface
public interface EmbeddingModelLoader {

    EmbeddingModel load() throws Exception;
}
