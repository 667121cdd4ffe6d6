package com.ai.tutor.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Explicit cache-aside over a {@link CacheStore}: look the key up, and on a miss
 * compute the value, store it with a TTL and return it. Values are stored as
 * JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheAsideClient {

    private final CacheStore cacheStore;
    private final ObjectMapper objectMapper;

    public <T> T getOrCompute(String key, Duration ttl, Class<T> type, Supplier<T> compute) {
        return getOrCompute(key, ttl, type, compute, value -> value != null);
    }

    /**
     * Same as {@link #getOrCompute(String, Duration, Class, Supplier)} but only
     * values accepted by {@code cacheable} are written back.
     */
    public <T> T getOrCompute(String key, Duration ttl, Class<T> type, Supplier<T> compute,
                              Predicate<T> cacheable) {
        long startTime = System.currentTimeMillis();
        Optional<T> cached = read(key, type);
        if (cached.isPresent()) {
            log.debug("Cache HIT for {} ({}ms)", key, System.currentTimeMillis() - startTime);
            return cached.get();
        }

        log.debug("Cache MISS for {}", key);
        T value = compute.get();
        if (cacheable.test(value)) {
            write(key, value, ttl);
        }
        log.debug("Computed {} in {}ms", key, System.currentTimeMillis() - startTime);
        return value;
    }

    public long evictPattern(String pattern) {
        long removed = cacheStore.clearPattern(pattern);
        log.info("Evicted {} cache entries matching {}", removed, pattern);
        return removed;
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        Optional<String> raw = cacheStore.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(raw.get(), type));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getMessage());
            cacheStore.delete(key);
            return Optional.empty();
        }
    }

    private void write(String key, Object value, Duration ttl) {
        try {
            cacheStore.set(key, objectMapper.writeValueAsString(value), ttl);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize value for cache key {}: {}", key, e.getMessage());
        }
    }
}
