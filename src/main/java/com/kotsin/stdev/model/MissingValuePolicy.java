package com.kotsin.stdev.model;

/**
 * What happens to a field's window when a snapshot has no usable value for that field.
 */
public enum MissingValuePolicy {

    /** Window untouched; the stdev is computed from the window as it stands. */
    CARRY_FORWARD,

    /** Window untouched; no stdev is emitted for the field at that timestamp. */
    EMIT_NONE,

    /** Window cleared; the last stdev the window produced is emitted. */
    RESET_WINDOW
}
