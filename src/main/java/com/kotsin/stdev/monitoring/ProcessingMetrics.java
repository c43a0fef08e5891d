package com.kotsin.stdev.monitoring;

import com.kotsin.stdev.model.PriceField;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for one batch run of the engine.
 */
public class ProcessingMetrics {

    // ==================== SNAPSHOT COUNTERS ====================
    private final AtomicLong snapshotsApplied = new AtomicLong(0);
    private final AtomicLong warmupApplied = new AtomicLong(0);
    private final AtomicLong staleSkipped = new AtomicLong(0);
    private final AtomicLong beyondEndIgnored = new AtomicLong(0);

    // ==================== WINDOW COUNTERS ====================
    private final AtomicLong gapResets = new AtomicLong(0);
    private final Map<PriceField, AtomicLong> absentValues = new EnumMap<>(PriceField.class);

    // ==================== OUTPUT COUNTERS ====================
    private final AtomicLong resultsEmitted = new AtomicLong(0);

    public ProcessingMetrics() {
        for (PriceField field : PriceField.values()) {
            absentValues.put(field, new AtomicLong(0));
        }
    }

    // ==================== INCREMENT METHODS ====================

    public void recordApplied(boolean gapReset, Iterable<PriceField> absentFields) {
        snapshotsApplied.incrementAndGet();
        if (gapReset) {
            gapResets.incrementAndGet();
        }
        for (PriceField field : absentFields) {
            absentValues.get(field).incrementAndGet();
        }
    }

    public void recordWarmup() {
        warmupApplied.incrementAndGet();
    }

    public void recordStale() {
        staleSkipped.incrementAndGet();
    }

    public void recordBeyondEnd() {
        beyondEndIgnored.incrementAndGet();
    }

    public void recordEmitted() {
        resultsEmitted.incrementAndGet();
    }

    // ==================== GETTER METHODS ====================

    public long getSnapshotsApplied() {
        return snapshotsApplied.get();
    }

    public long getWarmupApplied() {
        return warmupApplied.get();
    }

    public long getStaleSkipped() {
        return staleSkipped.get();
    }

    public long getBeyondEndIgnored() {
        return beyondEndIgnored.get();
    }

    public long getGapResets() {
        return gapResets.get();
    }

    public long getAbsentValues(PriceField field) {
        return absentValues.get(field).get();
    }

    public long getResultsEmitted() {
        return resultsEmitted.get();
    }

    public Summary getSummary() {
        Map<PriceField, Long> absent = new EnumMap<>(PriceField.class);
        absentValues.forEach((k, v) -> absent.put(k, v.get()));
        return Summary.builder()
            .snapshotsApplied(snapshotsApplied.get())
            .warmupApplied(warmupApplied.get())
            .staleSkipped(staleSkipped.get())
            .beyondEndIgnored(beyondEndIgnored.get())
            .gapResets(gapResets.get())
            .absentValues(absent)
            .resultsEmitted(resultsEmitted.get())
            .build();
    }

    /**
     * Immutable copy of the counters, for logging and batch summaries.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private long snapshotsApplied;
        private long warmupApplied;
        private long staleSkipped;
        private long beyondEndIgnored;
        private long gapResets;
        private Map<PriceField, Long> absentValues;
        private long resultsEmitted;
    }
}
