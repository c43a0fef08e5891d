package com.kotsin.stdev.batch;

import com.kotsin.stdev.config.StdevProperties;
import com.kotsin.stdev.engine.RollingStdevEngine;
import com.kotsin.stdev.engine.StateMap;
import com.kotsin.stdev.model.StdevResult;
import com.kotsin.stdev.monitoring.ProcessingMetrics;
import com.kotsin.stdev.state.StateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs one batch: load state, fetch snapshots, stream results to the sinks, save state.
 *
 * State is saved only after every result has been handed to the sinks and every sink has
 * completed. Any failure before that leaves the previous state file as it was.
 */
@Service
@Slf4j
public class StdevBatchService {

    private final StdevProperties properties;
    private final StateStore stateStore;
    private final RollingStdevEngine engine;
    private final List<ResultSink> sinks;

    @Autowired
    public StdevBatchService(StdevProperties properties, StateStore stateStore, RollingStdevEngine engine,
                             ObjectProvider<ResultSink> sinks) {
        this(properties, stateStore, engine, sinks.orderedStream().collect(Collectors.toList()));
    }

    public StdevBatchService(StdevProperties properties, StateStore stateStore, RollingStdevEngine engine,
                             List<ResultSink> sinks) {
        this.properties = properties;
        this.stateStore = stateStore;
        this.engine = engine;
        this.sinks = List.copyOf(sinks);
    }

    public BatchSummary run(SnapshotSource source, Instant start, Instant end) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Batch end " + end + " is before start " + start);
        }

        Path statePath = Path.of(properties.getStatePath());
        Instant fetchFrom = start.minus(properties.getLookback());
        log.info("▶️ Starting batch [{} .. {}] (fetching from {}), state {}, {} sink(s)",
            start, end, fetchFrom, statePath, sinks.size());

        try {
            StateMap state = stateStore.load(statePath);
            ProcessingMetrics metrics = new ProcessingMetrics();

            try (Stream<StdevResult> results = engine.process(state, source.fetch(fetchFrom, end), start, end, metrics)) {
                results.forEach(this::publish);
            }
            for (ResultSink sink : sinks) {
                sink.complete();
            }

            stateStore.save(statePath, state);

            BatchSummary summary = BatchSummary.builder()
                .start(start)
                .end(end)
                .statePath(statePath.toString())
                .securities(state.size())
                .highWaterMark(state.getHighWaterMark())
                .metrics(metrics.getSummary())
                .build();
            logSummary(summary);
            return summary;
        } catch (RuntimeException e) {
            log.error("❌ Batch [{} .. {}] failed, state at {} left unchanged: {}", start, end, statePath, e.getMessage());
            throw e;
        }
    }

    private void publish(StdevResult result) {
        for (ResultSink sink : sinks) {
            sink.accept(result);
        }
    }

    private void logSummary(BatchSummary summary) {
        ProcessingMetrics.Summary m = summary.getMetrics();
        log.info("✅ Batch [{} .. {}] complete: {} results from {} snapshots ({} warm-up), {} securities",
            summary.getStart(), summary.getEnd(), m.getResultsEmitted(), m.getSnapshotsApplied(),
            m.getWarmupApplied(), summary.getSecurities());
        log.info("  Gap resets: {}, absent values: {}", m.getGapResets(), m.getAbsentValues());
        if (m.getStaleSkipped() > 0) {
            log.warn("⚠️ Skipped {} snapshots already covered by saved state", m.getStaleSkipped());
        }
        if (m.getBeyondEndIgnored() > 0) {
            log.warn("⚠️ Ignored {} snapshots after batch end", m.getBeyondEndIgnored());
        }
    }
}
