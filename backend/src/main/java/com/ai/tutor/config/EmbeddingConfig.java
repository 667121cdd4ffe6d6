package com.ai.tutor.config;

import com.ai.tutor.embedding.EmbeddingModelHolder;
import com.ai.tutor.embedding.EmbeddingModelLoader;
import org.springframework.ai.transformers.TransformersEmbeddingModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * EmbeddingConfig wires the local sentence-transformer model.
 *
 * The model (all-MiniLM-L6-v2 exported to ONNX, 384 dimensions) runs in-process
 * through Spring AI's {@link TransformersEmbeddingModel}. Loading it takes a few
 * seconds and a few hundred MB, so it is not created here: the
 * {@link EmbeddingModelHolder} calls the loader the first time a vector is
 * needed and keeps the instance for the lifetime of the process.
 */
@Configuration
public class EmbeddingConfig {

    @Bean
    public EmbeddingModelLoader embeddingModelLoader(TutorProperties properties) {
        TutorProperties.Embedding embedding = properties.getEmbedding();
        return () -> {
            TransformersEmbeddingModel model = new TransformersEmbeddingModel();
            if (StringUtils.hasText(embedding.getModelResource())) {
                model.setModelResource(embedding.getModelResource());
            }
            if (StringUtils.hasText(embedding.getTokenizerResource())) {
                model.setTokenizerResource(embedding.getTokenizerResource());
            }
            if (StringUtils.hasText(embedding.getResourceCacheDirectory())) {
                model.setResourceCacheDirectory(embedding.getResourceCacheDirectory());
            }
            model.afterPropertiesSet();
            return model;
        };
    }

    @Bean
    public EmbeddingModelHolder embeddingModelHolder(EmbeddingModelLoader embeddingModelLoader) {
        return new EmbeddingModelHolder(embeddingModelLoader);
    }
}
