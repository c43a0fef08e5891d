package com.kotsin.stdev.window;

import com.kotsin.stdev.model.MissingValuePolicy;
import com.kotsin.stdev.model.PriceField;
import com.kotsin.stdev.model.Snapshot;
import com.kotsin.stdev.util.ValidationUtils;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Bid, mid and ask windows of one security plus the time of its last applied snapshot.
 */
public class EntityState {

    private final Map<PriceField, RollingWindow> windows;
    private Instant lastTimestamp;

    public EntityState(int windowSize) {
        this.windows = new EnumMap<>(PriceField.class);
        for (PriceField field : PriceField.values()) {
            windows.put(field, new RollingWindow(windowSize));
        }
    }

    private EntityState(Map<PriceField, RollingWindow> windows, Instant lastTimestamp) {
        this.windows = new EnumMap<>(windows);
        this.lastTimestamp = lastTimestamp;
    }

    /**
     * Rebuild persisted state. Every field must have a window.
     */
    public static EntityState restore(Map<PriceField, RollingWindow> windows, Instant lastTimestamp) {
        for (PriceField field : PriceField.values()) {
            if (!windows.containsKey(field)) {
                throw new IllegalArgumentException("Missing " + field + " window");
            }
        }
        return new EntityState(windows, lastTimestamp);
    }

    /**
     * True when the snapshot time is not after the last applied one.
     */
    public boolean isStale(Instant timestamp) {
        return lastTimestamp != null && !timestamp.isAfter(lastTimestamp);
    }

    /**
     * Apply one snapshot: reset all windows on a gap, then push each usable field value.
     */
    public Observation observe(Snapshot snapshot, GapDetector gapDetector,
                               MissingValuePolicy missingValuePolicy, double maxAbsValue) {
        Instant timestamp = snapshot.getTimestamp();
        boolean gapReset = gapDetector.isGap(lastTimestamp, timestamp);
        if (gapReset) {
            windows.values().forEach(RollingWindow::reset);
        }

        Set<PriceField> absent = EnumSet.noneOf(PriceField.class);
        for (PriceField field : PriceField.values()) {
            Double value = field.valueOf(snapshot);
            RollingWindow window = windows.get(field);
            if (ValidationUtils.isSaneValue(value, maxAbsValue)) {
                window.push(value);
            } else {
                absent.add(field);
                if (missingValuePolicy == MissingValuePolicy.RESET_WINDOW) {
                    window.reset();
                }
            }
        }

        lastTimestamp = timestamp;
        return new Observation(gapReset, Collections.unmodifiableSet(absent));
    }

    public RollingWindow window(PriceField field) {
        return windows.get(field);
    }

    public Instant getLastTimestamp() {
        return lastTimestamp;
    }

    /**
     * Outcome of applying one snapshot.
     */
    public record Observation(boolean gapReset, Set<PriceField> absentFields) {

        public boolean isAbsent(PriceField field) {
            return absentFields.contains(field);
        }
    }
}
