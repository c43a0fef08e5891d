package com.kotsin.stdev.util;

import com.kotsin.stdev.model.Snapshot;

import java.util.Objects;

/**
 * Null handling and value sanity checks shared by the engine and the adapters.
 */
public final class ValidationUtils {

    private ValidationUtils() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * A snapshot the engine can route: it names an entity and a point in time.
     * Field values are not checked here; they are judged one by one.
     */
    public static boolean isRoutable(Snapshot snapshot) {
        return Objects.nonNull(snapshot)
            && isNotNullOrEmpty(snapshot.getEntityId())
            && Objects.nonNull(snapshot.getTimestamp());
    }

    /**
     * A field value usable as a window sample: present, finite and within +/- maxAbsValue.
     */
    public static boolean isSaneValue(Double value, double maxAbsValue) {
        return Objects.nonNull(value)
            && !value.isNaN()
            && !value.isInfinite()
            && Math.abs(value) <= maxAbsValue;
    }

    public static boolean isNullOrEmpty(String str) {
        return Objects.isNull(str) || str.trim().isEmpty();
    }

    public static boolean isNotNullOrEmpty(String str) {
        return !isNullOrEmpty(str);
    }
}
