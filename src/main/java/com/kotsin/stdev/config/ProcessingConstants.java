package com.kotsin.stdev.config;

import java.time.Duration;

/**
 * Central constants for rolling stdev processing.
 */
public final class ProcessingConstants {

    private ProcessingConstants() {
        throw new UnsupportedOperationException("Constants class");
    }

    // ========== WINDOW DEFAULTS ==========

    public static final int DEFAULT_WINDOW_SIZE = 20;
    public static final int DEFAULT_MIN_PERIODS = 1;
    public static final Duration DEFAULT_CADENCE = Duration.ofHours(1);
    public static final Duration DEFAULT_GAP_TOLERANCE = Duration.ZERO;
    public static final Duration DEFAULT_LOOKBACK = Duration.ofDays(7);

    // ========== VALIDATION CONSTANTS ==========

    public static final double DEFAULT_MAX_ABS_VALUE = 1e12;

    // ========== STATE FILE CONSTANTS ==========

    public static final int STATE_FORMAT_VERSION = 2;
    public static final String DEFAULT_STATE_PATH = "state/stdev-state.json";
    public static final String STATE_TEMP_SUFFIX = ".tmp";

    // Relative tolerance when checking persisted sums against persisted values
    public static final double STATE_SUM_TOLERANCE = 1e-6;

    // ========== RETRY CONSTANTS ==========

    public static final int MAX_RETRY_ATTEMPTS = 3;
    public static final long INITIAL_RETRY_DELAY_MS = 100;
    public static final double RETRY_BACKOFF_MULTIPLIER = 2.0;
    public static final long MAX_RETRY_DELAY_MS = 10000;

    // ========== KAFKA CONSTANTS ==========

    public static final String DEFAULT_SNAPSHOT_TOPIC = "price-snapshots";
    public static final String DEFAULT_RESULT_TOPIC = "rolling-stdev";
    public static final Duration KAFKA_POLL_TIMEOUT = Duration.ofMillis(500);
    public static final int MAX_EMPTY_POLLS = 20;
    public static final Duration PUBLISH_TIMEOUT = Duration.ofSeconds(30);
}
