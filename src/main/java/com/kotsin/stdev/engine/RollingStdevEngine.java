package com.kotsin.stdev.engine;

import com.kotsin.stdev.config.StdevProperties;
import com.kotsin.stdev.model.MissingValuePolicy;
import com.kotsin.stdev.model.PriceField;
import com.kotsin.stdev.model.Snapshot;
import com.kotsin.stdev.model.StdevMode;
import com.kotsin.stdev.model.StdevResult;
import com.kotsin.stdev.monitoring.ProcessingMetrics;
import com.kotsin.stdev.util.ValidationUtils;
import com.kotsin.stdev.window.EntityState;
import com.kotsin.stdev.window.EntityState.Observation;
import com.kotsin.stdev.window.GapDetector;
import com.kotsin.stdev.window.RollingWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Incremental rolling stdev over bid, mid and ask for many securities.
 *
 * Snapshots are dispatched to the {@link EntityState} of their security in the {@link StateMap}.
 * Snapshots before the batch start only warm windows up; snapshots after the batch end are not
 * applied; snapshots at or before a security's last applied time are skipped, which keeps
 * re-processing of a covered range from disturbing the windows.
 */
@Component
@Slf4j
public class RollingStdevEngine {

    private final int windowSize;
    private final int minPeriods;
    private final GapDetector gapDetector;
    private final MissingValuePolicy missingValuePolicy;
    private final StdevMode stdevMode;
    private final double maxAbsValue;

    public RollingStdevEngine(StdevProperties properties) {
        this.windowSize = properties.getWindowSize();
        this.minPeriods = properties.getMinPeriods();
        this.gapDetector = new GapDetector(properties.getCadence(), properties.getGapTolerance());
        this.missingValuePolicy = properties.getMissingValuePolicy();
        this.stdevMode = properties.getStdevMode();
        this.maxAbsValue = properties.getMaxAbsValue();
    }

    public Stream<StdevResult> process(StateMap state, Stream<Snapshot> snapshots, Instant start, Instant end) {
        return process(state, snapshots, start, end, new ProcessingMetrics());
    }

    /**
     * Lazily apply snapshots to the state and emit results in snapshot order.
     *
     * Nothing is applied until the returned stream is consumed. Closing the returned stream
     * closes the snapshot stream.
     */
    public Stream<StdevResult> process(StateMap state, Stream<Snapshot> snapshots, Instant start, Instant end,
                                       ProcessingMetrics metrics) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(snapshots, "snapshots");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(metrics, "metrics");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Batch end " + end + " is before start " + start);
        }
        if (state.getWindowSize() != windowSize) {
            throw new IllegalArgumentException("State window size " + state.getWindowSize()
                + " does not match configured window size " + windowSize);
        }

        Iterator<StdevResult> results = new ResultIterator(state, snapshots.sequential().iterator(), start, end, metrics);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(results, Spliterator.ORDERED | Spliterator.NONNULL), false)
            .onClose(snapshots::close);
    }

    /**
     * Apply one snapshot. Returns the result to emit, or null when nothing is emitted.
     */
    StdevResult apply(StateMap state, Snapshot snapshot, Instant start, Instant end, ProcessingMetrics metrics) {
        if (!ValidationUtils.isRoutable(snapshot)) {
            throw new IllegalArgumentException("Snapshot without entity id or timestamp: " + snapshot);
        }
        String entityId = snapshot.getEntityId();
        Instant timestamp = snapshot.getTimestamp();

        if (timestamp.isAfter(end)) {
            metrics.recordBeyondEnd();
            log.debug("Ignoring {} at {}: after batch end {}", entityId, timestamp, end);
            return null;
        }

        EntityState entity = state.getOrCreate(entityId);
        if (entity.isStale(timestamp)) {
            metrics.recordStale();
            log.debug("Skipping {} at {}: already applied up to {}", entityId, timestamp, entity.getLastTimestamp());
            return null;
        }

        Observation observation = entity.observe(snapshot, gapDetector, missingValuePolicy, maxAbsValue);
        state.advanceHighWaterMark(timestamp);
        metrics.recordApplied(observation.gapReset(), observation.absentFields());
        if (observation.gapReset()) {
            log.debug("Gap reset for {} at {}", entityId, timestamp);
        }

        StdevResult result = StdevResult.builder()
            .entityId(entityId)
            .timestamp(timestamp)
            .bidStdev(fieldStdev(entity, PriceField.BID, observation))
            .midStdev(fieldStdev(entity, PriceField.MID, observation))
            .askStdev(fieldStdev(entity, PriceField.ASK, observation))
            .build();

        if (timestamp.isBefore(start)) {
            metrics.recordWarmup();
            return null;
        }
        if (!result.hasAnyValue()) {
            return null;
        }
        metrics.recordEmitted();
        return result;
    }

    private Double fieldStdev(EntityState entity, PriceField field, Observation observation) {
        RollingWindow window = entity.window(field);
        if (observation.isAbsent(field)) {
            switch (missingValuePolicy) {
                case EMIT_NONE:
                    return null;
                case RESET_WINDOW:
                    return window.getLastStdev();
                case CARRY_FORWARD:
                default:
                    break;
            }
        }
        OptionalDouble stdev = window.size() < minPeriods ? OptionalDouble.empty() : window.stdev(stdevMode);
        if (stdev.isEmpty()) {
            // A restarted window reports its previous statistic until it has refilled
            return missingValuePolicy == MissingValuePolicy.RESET_WINDOW ? window.getLastStdev() : null;
        }
        window.rememberStdev(stdev.getAsDouble());
        return stdev.getAsDouble();
    }

    public GapDetector getGapDetector() {
        return gapDetector;
    }

    public int getWindowSize() {
        return windowSize;
    }

    /**
     * Pulls snapshots until one yields a result.
     */
    private final class ResultIterator implements Iterator<StdevResult> {

        private final StateMap state;
        private final Iterator<Snapshot> snapshots;
        private final Instant start;
        private final Instant end;
        private final ProcessingMetrics metrics;
        private StdevResult next;

        private ResultIterator(StateMap state, Iterator<Snapshot> snapshots, Instant start, Instant end,
                               ProcessingMetrics metrics) {
            this.state = state;
            this.snapshots = snapshots;
            this.start = start;
            this.end = end;
            this.metrics = metrics;
        }

        @Override
        public boolean hasNext() {
            while (next == null && snapshots.hasNext()) {
                next = apply(state, snapshots.next(), start, end, metrics);
            }
            return next != null;
        }

        @Override
        public StdevResult next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            StdevResult result = next;
            next = null;
            return result;
        }
    }
}
