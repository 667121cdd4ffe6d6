package com.ai.tutor.pool;

import com.ai.tutor.cache.CacheKeys;
import com.ai.tutor.cache.CacheStore;
import com.ai.tutor.config.TutorProperties;
import com.ai.tutor.dto.ExercisePayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO queues of pre-generated exercises, one per {@link PoolKey},
 * kept in the cache store as JSON lists with a TTL.
 *
 * <p>
 * Every read-modify-write of a queue runs under that key's lock, which makes
 * the two queue rules hold whatever the interleaving of producers and
 * consumers:
 * </p>
 * <ul>
 * <li>a queue never holds more than {@code tutor.pool.capacity} entries; on
 * overflow the oldest entries are dropped</li>
 * <li>no two entries of a queue have the same {@code content}</li>
 * </ul>
 * <p>
 * Locks are per process and striped by key hash. Queues stay consistent
 * across instances only as far as the store's last write wins.
 * </p>
 * <p>
 * A queue change only counts once the store has accepted it: an insert the
 * store refused reports {@code false}, and an entry whose removal could not be
 * written is not handed out.
 * </p>
 */
@Slf4j
@Component
public class ExercisePoolCache {

    private static final TypeReference<List<ExercisePayload>> QUEUE_TYPE = new TypeReference<>() {
    };

    private final CacheStore cacheStore;
    private final ObjectMapper objectMapper;
    private final int capacity;
    private final Duration ttl;

    private static final int LOCK_STRIPES = 64;

    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];
    private final Set<String> refilling = ConcurrentHashMap.newKeySet();

    public ExercisePoolCache(CacheStore cacheStore, ObjectMapper objectMapper, TutorProperties properties) {
        this.cacheStore = cacheStore;
        this.objectMapper = objectMapper;
        this.capacity = properties.getPool().getCapacity();
        this.ttl = properties.getPool().getTtl();
        if (capacity <= 0) {
            throw new IllegalArgumentException("Pool capacity must be positive: " + capacity);
        }
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * Appends an exercise to the key's queue.
     *
     * @return {@code false} when the content is blank, already queued, or the
     *         store did not accept the updated queue
     */
    public boolean add(PoolKey key, ExercisePayload payload) {
        if (payload == null || payload.getContent() == null || payload.getContent().isBlank()) {
            return false;
        }
        String cacheKey = key.cacheKey();
        ReentrantLock lock = lockFor(cacheKey);
        lock.lock();
        try {
            List<ExercisePayload> queue = read(cacheKey);
            boolean duplicate = queue.stream().anyMatch(e -> payload.getContent().equals(e.getContent()));
            if (duplicate) {
                log.debug("Pool {} already holds this exercise, not adding", key);
                return false;
            }
            queue.add(payload);
            while (queue.size() > capacity) {
                queue.remove(0);
            }
            if (!write(cacheKey, queue)) {
                return false;
            }
            log.info("Added exercise to pool {} (size {}/{})", key, queue.size(), capacity);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the oldest queued exercise whose content the student
     * has not completed. Entries the student has completed stay queued for
     * other students.
     */
    public Optional<ExercisePayload> take(PoolKey key, Set<String> completedContents) {
        String cacheKey = key.cacheKey();
        ReentrantLock lock = lockFor(cacheKey);
        lock.lock();
        try {
            List<ExercisePayload> queue = read(cacheKey);
            Iterator<ExercisePayload> it = queue.iterator();
            while (it.hasNext()) {
                ExercisePayload candidate = it.next();
                if (!completedContents.contains(candidate.getContent())) {
                    it.remove();
                    boolean removed = queue.isEmpty() ? cacheStore.delete(cacheKey) : write(cacheKey, queue);
                    if (!removed) {
                        log.warn("Pool {} could not record the removal, treating as a miss", key);
                        return Optional.empty();
                    }
                    log.info("Pool HIT for {} ({} left)", key, queue.size());
                    return Optional.of(candidate);
                }
            }
            log.info("Pool MISS for {} ({} queued, none new for the student)", key, queue.size());
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public int size(PoolKey key) {
        return read(key.cacheKey()).size();
    }

    public boolean isFull(PoolKey key) {
        return size(key) >= capacity;
    }

    /** Queued contents, oldest first. */
    public List<String> contents(PoolKey key) {
        return read(key.cacheKey()).stream().map(ExercisePayload::getContent).toList();
    }

    /** Drops every queue, e.g. after the source text they were generated from changed. */
    public long clearAll() {
        return cacheStore.clearPattern(CacheKeys.pattern(CacheKeys.EXERCISE_POOL));
    }

    /**
     * Claims the right to refill a queue. Only one producer per key holds it;
     * the others should skip their refill.
     */
    public boolean tryBeginRefill(PoolKey key) {
        return refilling.add(key.cacheKey());
    }

    public void endRefill(PoolKey key) {
        refilling.remove(key.cacheKey());
    }

    private ReentrantLock lockFor(String cacheKey) {
        return locks[Math.floorMod(cacheKey.hashCode(), LOCK_STRIPES)];
    }

    private List<ExercisePayload> read(String cacheKey) {
        Optional<String> raw = cacheStore.get(cacheKey);
        if (raw.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(raw.get(), QUEUE_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable pool {}: {}", cacheKey, e.getOriginalMessage());
            cacheStore.delete(cacheKey);
            return new ArrayList<>();
        }
    }

    private boolean write(String cacheKey, List<ExercisePayload> queue) {
        try {
            if (!cacheStore.set(cacheKey, objectMapper.writeValueAsString(queue), ttl)) {
                log.warn("Pool {} could not be written, cache store unavailable", cacheKey);
                return false;
            }
            return true;
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize pool {}: {}", cacheKey, e.getOriginalMessage());
            return false;
        }
    }
}
