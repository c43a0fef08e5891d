package com.kotsin.stdev.model;

/**
 * Denominator used for the window variance.
 */
public enum StdevMode {
    /** Divide by n. */
    POPULATION,
    /** Divide by n - 1; undefined for a single sample. */
    SAMPLE
}
