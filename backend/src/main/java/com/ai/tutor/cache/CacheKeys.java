package com.ai.tutor.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic cache keys: {@code prefix:md5(json of params sorted by name)}.
 */
public final class CacheKeys {

    public static final String CONTEXT = "context";
    public static final String EXERCISE_POOL = "exercise_pool";
    public static final String SUMMARY = "summary";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CacheKeys() {
    }

    public static String generate(String prefix, Map<String, ?> params) {
        try {
            String json = MAPPER.writeValueAsString(new TreeMap<>(params));
            return prefix + ":" + DigestUtils.md5DigestAsHex(json.getBytes(StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache key parameters are not serializable: " + params, e);
        }
    }

    /** Glob matching every key written with {@code prefix}. */
    public static String pattern(String prefix) {
        return prefix + ":*";
    }
}
