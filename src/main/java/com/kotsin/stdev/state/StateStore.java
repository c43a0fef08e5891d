package com.kotsin.stdev.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kotsin.stdev.config.ProcessingConstants;
import com.kotsin.stdev.config.StdevProperties;
import com.kotsin.stdev.engine.StateMap;
import com.kotsin.stdev.model.PriceField;
import com.kotsin.stdev.retry.RetryHandler;
import com.kotsin.stdev.state.PersistedState.PersistedEntity;
import com.kotsin.stdev.state.PersistedState.PersistedWindow;
import com.kotsin.stdev.window.EntityState;
import com.kotsin.stdev.window.RollingWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the {@link StateMap} as a JSON file.
 *
 * A missing file is a cold start. A file that exists but fails any structural check is an error,
 * never an empty state. Writes go to a temporary file in the target directory which is then moved
 * over the target, so readers see either the old or the new file.
 */
@Component
@Slf4j
public class StateStore {

    private final ObjectMapper mapper;
    private final RetryHandler retryHandler;
    private final int windowSize;
    private final Clock clock;

    @Autowired
    public StateStore(StdevProperties properties, RetryHandler retryHandler) {
        this(properties.getWindowSize(), retryHandler, Clock.systemUTC());
    }

    StateStore(int windowSize, RetryHandler retryHandler, Clock clock) {
        this.windowSize = windowSize;
        this.retryHandler = retryHandler;
        this.clock = clock;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    // ==================== LOAD ====================

    public StateMap load(Path path) {
        if (!Files.exists(path)) {
            log.info("No state file at {}, starting cold", path);
            return new StateMap(windowSize);
        }

        PersistedState persisted;
        try {
            persisted = mapper.readValue(path.toFile(), PersistedState.class);
        } catch (IOException e) {
            throw new StateStoreException("Unreadable state file " + path + ": " + e.getMessage(), e);
        }
        if (persisted == null) {
            throw corrupt(path, "file holds no state document");
        }

        StateMap state = toStateMap(path, persisted);
        log.info("📂 Loaded state for {} securities from {} (high-water mark {})",
            state.size(), path, state.getHighWaterMark());
        return state;
    }

    private StateMap toStateMap(Path path, PersistedState persisted) {
        if (persisted.getFormatVersion() == null
            || persisted.getFormatVersion() != ProcessingConstants.STATE_FORMAT_VERSION) {
            throw corrupt(path, "unsupported format version " + persisted.getFormatVersion());
        }
        if (persisted.getWindowSize() == null) {
            throw corrupt(path, "missing window size");
        }
        if (persisted.getWindowSize() != windowSize) {
            throw new StateStoreException("State file " + path + " was written with window size "
                + persisted.getWindowSize() + " but the configured window size is " + windowSize
                + "; move the file aside to start cold with the new size");
        }
        Map<String, PersistedEntity> entities = persisted.getEntities();
        if (entities == null) {
            throw corrupt(path, "missing entities");
        }
        if (persisted.getEntityCount() == null || persisted.getEntityCount() != entities.size()) {
            throw corrupt(path, "entity count " + persisted.getEntityCount()
                + " does not match " + entities.size() + " stored entities");
        }

        Instant highWaterMark = persisted.getHighWaterMark();
        StateMap state = new StateMap(windowSize);
        for (Map.Entry<String, PersistedEntity> entry : entities.entrySet()) {
            String entityId = entry.getKey();
            PersistedEntity entity = entry.getValue();
            if (entity == null || entity.getWindows() == null) {
                throw corrupt(path, "entity " + entityId + " has no windows");
            }
            Instant lastTimestamp = entity.getLastTimestamp();
            if (lastTimestamp != null && (highWaterMark == null || lastTimestamp.isAfter(highWaterMark))) {
                throw corrupt(path, "entity " + entityId + " last seen at " + lastTimestamp
                    + " after high-water mark " + highWaterMark);
            }

            Map<PriceField, RollingWindow> windows = new EnumMap<>(PriceField.class);
            for (PriceField field : PriceField.values()) {
                PersistedWindow window = entity.getWindows().get(field);
                if (window == null) {
                    throw corrupt(path, "entity " + entityId + " has no " + field + " window");
                }
                windows.put(field, toWindow(path, entityId, field, window));
            }
            state.put(entityId, EntityState.restore(windows, lastTimestamp));
        }
        if (highWaterMark != null) {
            state.advanceHighWaterMark(highWaterMark);
        }
        return state;
    }

    private RollingWindow toWindow(Path path, String entityId, PriceField field, PersistedWindow window) {
        String where = entityId + "/" + field;
        List<Double> values = window.getValues();
        if (values == null || window.getAnchor() == null || window.getSum() == null
            || window.getSumOfSquares() == null || window.getPeakSumOfSquares() == null
            || window.getEvictionsSinceRebuild() == null) {
            throw corrupt(path, where + " is missing values or sums");
        }
        if (values.size() > windowSize) {
            throw corrupt(path, where + " holds " + values.size() + " values, more than window size " + windowSize);
        }
        if (window.getEvictionsSinceRebuild() < 0 || window.getEvictionsSinceRebuild() >= windowSize) {
            throw corrupt(path, where + " has eviction count " + window.getEvictionsSinceRebuild()
                + " outside [0, " + windowSize + ")");
        }
        double anchor = window.getAnchor();
        if (!isFinite(anchor) || !isFinite(window.getSum()) || !isFinite(window.getSumOfSquares())
            || !isFinite(window.getPeakSumOfSquares())) {
            throw corrupt(path, where + " holds non-finite sums");
        }

        double sum = 0.0;
        double absSum = 0.0;
        double sumOfSquares = 0.0;
        for (Double value : values) {
            if (value == null || !isFinite(value)) {
                throw corrupt(path, where + " holds non-finite value " + value);
            }
            double d = value - anchor;
            sum += d;
            absSum += Math.abs(d);
            sumOfSquares += d * d;
        }
        double tolerance = ProcessingConstants.STATE_SUM_TOLERANCE;
        if (Math.abs(sum - window.getSum()) > tolerance * absSum
            || Math.abs(sumOfSquares - window.getSumOfSquares()) > tolerance * sumOfSquares
            || window.getPeakSumOfSquares() < window.getSumOfSquares()) {
            throw corrupt(path, where + " sums do not match its values");
        }
        Double lastStdev = window.getLastStdev();
        if (lastStdev != null && (!isFinite(lastStdev) || lastStdev < 0)) {
            throw corrupt(path, where + " has invalid last stdev " + lastStdev);
        }

        RollingWindow.Sums sums = RollingWindow.Sums.builder()
            .anchor(anchor)
            .sum(window.getSum())
            .sumOfSquares(window.getSumOfSquares())
            .peakSumOfSquares(window.getPeakSumOfSquares())
            .evictionsSinceRebuild(window.getEvictionsSinceRebuild())
            .build();
        return RollingWindow.resume(windowSize, values, sums, lastStdev);
    }

    private static boolean isFinite(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }

    private static StateStoreException corrupt(Path path, String detail) {
        return new StateStoreException("Corrupt state file " + path + ": " + detail);
    }

    // ==================== SAVE ====================

    public void save(Path path, StateMap state) {
        if (state.getWindowSize() != windowSize) {
            throw new StateStoreException("Refusing to save state with window size " + state.getWindowSize()
                + " under configured window size " + windowSize);
        }
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(toPersisted(state));
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to serialize state for " + path, e);
        }

        try {
            retryHandler.executeWithRetry(() -> writeAtomically(path, bytes), "state-save");
        } catch (RuntimeException e) {
            throw new StateStoreException("Failed to save state to " + path, e);
        }
        log.info("💾 Saved state for {} securities to {} (high-water mark {})",
            state.size(), path, state.getHighWaterMark());
    }

    private PersistedState toPersisted(StateMap state) {
        Map<String, PersistedEntity> entities = new LinkedHashMap<>();
        state.getEntities().forEach((entityId, entity) -> {
            Map<PriceField, PersistedWindow> windows = new EnumMap<>(PriceField.class);
            for (PriceField field : PriceField.values()) {
                RollingWindow window = entity.window(field);
                RollingWindow.Sums sums = window.getSums();
                windows.put(field, PersistedWindow.builder()
                    .values(window.getValues())
                    .anchor(sums.getAnchor())
                    .sum(sums.getSum())
                    .sumOfSquares(sums.getSumOfSquares())
                    .peakSumOfSquares(sums.getPeakSumOfSquares())
                    .evictionsSinceRebuild(sums.getEvictionsSinceRebuild())
                    .lastStdev(window.getLastStdev())
                    .build());
            }
            entities.put(entityId, PersistedEntity.builder()
                .lastTimestamp(entity.getLastTimestamp())
                .windows(windows)
                .build());
        });

        return PersistedState.builder()
            .formatVersion(ProcessingConstants.STATE_FORMAT_VERSION)
            .windowSize(state.getWindowSize())
            .highWaterMark(state.getHighWaterMark())
            .savedAt(clock.instant())
            .entityCount(entities.size())
            .entities(entities)
            .build();
    }

    private void writeAtomically(Path path, byte[] bytes) {
        Path target = path.toAbsolutePath();
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), target.getFileName().toString(),
                ProcessingConstants.STATE_TEMP_SUFFIX);
            Files.write(temp, bytes);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                channel.force(true);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("⚠️ Atomic move not supported for {}, falling back to replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteTemp(temp);
            throw new UncheckedIOException("Failed to write state file " + target, e);
        }
    }

    private void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary state file {}: {}", temp, e.getMessage());
        }
    }
}
