package com.ai.tutor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Typed settings for the retrieval and generation pipeline, bound from {@code tutor.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "tutor")
public class TutorProperties {

    private Embedding embedding = new Embedding();
    private Chunking chunking = new Chunking();
    private Retrieval retrieval = new Retrieval();
    private Context context = new Context();
    private Pool pool = new Pool();
    private Summary summary = new Summary();
    private Prefetch prefetch = new Prefetch();
    private Cache cache = new Cache();

    @Getter
    @Setter
    public static class Embedding {
        /** ONNX model of all-MiniLM-L6-v2; Spring AI's default when left blank. */
        private String modelResource = "";
        private String tokenizerResource = "";
        private String resourceCacheDirectory = "";

        /** Output dimension every stored vector must have. */
        private int dimensions = 384;

        /** Maximum number of cached embeddings (least-recently-used evicted first). */
        private int cacheSize = 5000;

        private int batchSize = 32;
    }

    @Getter
    @Setter
    public static class Chunking {
        private int size = 500;
        private int overlap = 50;
    }

    @Getter
    @Setter
    public static class Retrieval {
        private int defaultTopK = 3;

        /** Rows written per transaction during ingestion. */
        private int storeBatchSize = 32;
    }

    @Getter
    @Setter
    public static class Context {
        private Duration ttl = Duration.ofHours(24);

        /** Chunks per topic when warming the cache on session entry. */
        private int prefetchTopK = 3;

        /** Chunks per topic fed to the generative engine. */
        private int generationTopK = 2;
    }

    @Getter
    @Setter
    public static class Pool {
        private int capacity = 5;
        private int maxGenerationAttempts = 3;
        private Duration ttl = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Summary {
        private Duration ttl = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Prefetch {
        private int contextTopics = 3;
        private int exerciseTopics = 2;
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 50;
    }

    @Getter
    @Setter
    public static class Cache {
        /** "redis" (default) or "memory". */
        private String type = "redis";
    }
}
