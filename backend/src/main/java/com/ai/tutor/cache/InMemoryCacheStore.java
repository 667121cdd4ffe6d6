package com.ai.tutor.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Single-process {@link CacheStore} with per-entry expiry. Used when
 * {@code tutor.cache.type=memory} and in tests.
 */
public class InMemoryCacheStore implements CacheStore {

    private record Entry(String value, Instant expiresAt) {
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCacheStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCacheStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    /** Also drops every expired entry, so keys that are never read again do not pile up. */
    @Override
    public boolean set(String key, String value, Duration ttl) {
        Instant now = clock.instant();
        purgeExpired(now);
        entries.put(key, new Entry(value, now.plus(ttl)));
        return true;
    }

    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public long clearPattern(String pattern) {
        Pattern regex = globToRegex(pattern);
        purgeExpired(clock.instant());
        long before = entries.size();
        entries.keySet().removeIf(key -> regex.matcher(key).matches());
        return before - entries.size();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    /** Number of entries held, expired ones included until the next purge. */
    int entryCount() {
        return entries.size();
    }

    private void purgeExpired(Instant now) {
        entries.values().removeIf(entry -> !now.isBefore(entry.expiresAt()));
    }

    private static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }
}
