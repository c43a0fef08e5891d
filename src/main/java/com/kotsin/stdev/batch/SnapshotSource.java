package com.kotsin.stdev.batch;

import com.kotsin.stdev.model.Snapshot;

import java.time.Instant;
import java.util.stream.Stream;

/**
 * Supplies already validated snapshots for a time range.
 *
 * Implementations return snapshots ordered by entity id, then by timestamp, with timestamps
 * strictly increasing per entity. A record that cannot be turned into a snapshot must fail the
 * fetch rather than be dropped.
 */
public interface SnapshotSource {

    /**
     * @param from inclusive lower bound
     * @param to   inclusive upper bound
     */
    Stream<Snapshot> fetch(Instant from, Instant to);
}
