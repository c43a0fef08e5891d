package com.kotsin.stdev.engine;

import com.kotsin.stdev.window.EntityState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * All per-security window state carried from one batch to the next.
 *
 * Lifecycle: loaded by the state store, mutated by the engine across one batch, saved again.
 */
public class StateMap {

    private final int windowSize;
    private final Map<String, EntityState> entities = new LinkedHashMap<>();
    private Instant highWaterMark;

    public StateMap(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("Window size must be at least 1, was " + windowSize);
        }
        this.windowSize = windowSize;
    }

    public EntityState getOrCreate(String entityId) {
        return entities.computeIfAbsent(entityId, k -> new EntityState(windowSize));
    }

    public Optional<EntityState> get(String entityId) {
        return Optional.ofNullable(entities.get(entityId));
    }

    public void put(String entityId, EntityState state) {
        entities.put(entityId, state);
    }

    public Map<String, EntityState> getEntities() {
        return Collections.unmodifiableMap(entities);
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    public int getWindowSize() {
        return windowSize;
    }

    /**
     * Latest snapshot time applied to any security, null before the first one.
     */
    public Instant getHighWaterMark() {
        return highWaterMark;
    }

    public void advanceHighWaterMark(Instant timestamp) {
        if (highWaterMark == null || timestamp.isAfter(highWaterMark)) {
            highWaterMark = timestamp;
        }
    }
}
