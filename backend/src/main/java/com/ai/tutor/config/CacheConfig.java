package com.ai.tutor.config;

import com.ai.tutor.cache.CacheStore;
import com.ai.tutor.cache.InMemoryCacheStore;
import com.ai.tutor.cache.RedisCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the cache store backing the context cache, the exercise pool and the
 * summary memo. Redis is the default; {@code tutor.cache.type=memory} keeps
 * everything in the JVM for single-instance or offline runs.
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(name = "tutor.cache.type", havingValue = "redis", matchIfMissing = true)
    public CacheStore redisCacheStore(StringRedisTemplate stringRedisTemplate) {
        RedisCacheStore store = new RedisCacheStore(stringRedisTemplate);
        if (!store.isAvailable()) {
            log.warn("Redis not reachable at startup. Caching degrades to always-miss until it is.");
        }
        return store;
    }

    @Bean
    @ConditionalOnProperty(name = "tutor.cache.type", havingValue = "memory")
    public CacheStore inMemoryCacheStore() {
        log.info("Using in-memory cache store");
        return new InMemoryCacheStore();
    }
}
