package com.kotsin.stdev.window;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether two consecutive snapshots of a security are contiguous in time.
 *
 * Consecutive snapshots are contiguous when the time between them is the cadence,
 * give or take the tolerance. Anything else breaks the window.
 */
public class GapDetector {

    private final Duration cadence;
    private final Duration tolerance;

    public GapDetector(Duration cadence, Duration tolerance) {
        if (cadence == null || cadence.isNegative() || cadence.isZero()) {
            throw new IllegalArgumentException("Cadence must be positive, was " + cadence);
        }
        if (tolerance == null || tolerance.isNegative()) {
            throw new IllegalArgumentException("Tolerance must not be negative, was " + tolerance);
        }
        this.cadence = cadence;
        this.tolerance = tolerance;
    }

    /**
     * @param previous last timestamp seen for the security, null before the first snapshot
     * @param current  timestamp of the incoming snapshot
     */
    public boolean isGap(Instant previous, Instant current) {
        if (previous == null) {
            return false;
        }
        Duration elapsed = Duration.between(previous, current);
        return elapsed.minus(cadence).abs().compareTo(tolerance) > 0;
    }

    public Duration getCadence() {
        return cadence;
    }

    public Duration getTolerance() {
        return tolerance;
    }
}
