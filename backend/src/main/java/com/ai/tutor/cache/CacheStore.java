package com.ai.tutor.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store shared by the context cache, the exercise pool and summary
 * memoization. Implementations never throw on an unreachable backend: reads
 * report a miss and writes report {@code false}.
 */
public interface CacheStore {

    Optional<String> get(String key);

    boolean set(String key, String value, Duration ttl);

    boolean delete(String key);

    /**
     * Deletes every key matching a glob pattern such as {@code "context:*"}.
     *
     * @return number of keys removed
     */
    long clearPattern(String pattern);

    boolean isAvailable();
}
