package com.kotsin.stdev.window;

import com.kotsin.stdev.model.StdevMode;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Fixed-capacity sliding window over one price series of one security.
 *
 * Running sums are kept relative to an anchor value taken from the window itself, so that the
 * price level cancels out before squaring and identical values give exactly zero. Push and stdev
 * are O(1); the sums are rebuilt from the held values once every {@code capacity} evictions and
 * whenever evictions have cancelled most of what was accumulated, which bounds rounding drift.
 */
public class RollingWindow {

    // Rebuild once the sum of squares has fallen below this share of its peak since the last rebuild
    private static final double DECAY_REBUILD_RATIO = 1e-3;

    // Rebuild when the variance is this small relative to the mean square about the anchor
    private static final double CANCELLATION_RATIO = 1e-8;

    private final int capacity;
    private final ArrayDeque<Double> values;
    private double anchor;
    private double sum;
    private double sumOfSquares;
    private double peakSumOfSquares;
    private int evictionsSinceRebuild;
    private Double lastStdev;

    public RollingWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Window capacity must be at least 1, was " + capacity);
        }
        this.capacity = capacity;
        this.values = new ArrayDeque<>(capacity + 1);
    }

    /**
     * Rebuild a window from values alone, oldest first. Sums are recomputed.
     */
    public static RollingWindow restore(int capacity, Collection<Double> values, Double lastStdev) {
        RollingWindow window = withValues(capacity, values, lastStdev);
        window.rebuild();
        return window;
    }

    /**
     * Rebuild a window exactly as it was saved, so that it continues bit for bit.
     */
    public static RollingWindow resume(int capacity, Collection<Double> values, Sums sums, Double lastStdev) {
        if (sums.getEvictionsSinceRebuild() < 0 || sums.getEvictionsSinceRebuild() >= capacity) {
            throw new IllegalArgumentException("Evictions since rebuild " + sums.getEvictionsSinceRebuild()
                + " outside [0, " + capacity + ")");
        }
        RollingWindow window = withValues(capacity, values, lastStdev);
        window.anchor = sums.getAnchor();
        window.sum = sums.getSum();
        window.sumOfSquares = sums.getSumOfSquares();
        window.peakSumOfSquares = sums.getPeakSumOfSquares();
        window.evictionsSinceRebuild = sums.getEvictionsSinceRebuild();
        return window;
    }

    private static RollingWindow withValues(int capacity, Collection<Double> values, Double lastStdev) {
        if (values.size() > capacity) {
            throw new IllegalArgumentException(
                "Cannot restore " + values.size() + " values into a window of capacity " + capacity);
        }
        RollingWindow window = new RollingWindow(capacity);
        window.values.addAll(values);
        window.lastStdev = lastStdev;
        return window;
    }

    /**
     * Append a value, evicting the oldest one once the window is over capacity.
     */
    public void push(double value) {
        if (values.isEmpty()) {
            anchor = value;
        }
        values.addLast(value);
        double d = value - anchor;
        sum += d;
        sumOfSquares += d * d;
        peakSumOfSquares = Math.max(peakSumOfSquares, sumOfSquares);

        if (values.size() > capacity) {
            double e = values.removeFirst() - anchor;
            sum -= e;
            sumOfSquares -= e * e;
            evictionsSinceRebuild++;
            if (evictionsSinceRebuild >= capacity || sumOfSquares < peakSumOfSquares * DECAY_REBUILD_RATIO) {
                rebuild();
                return;
            }
        }
        if (isCancelling()) {
            rebuild();
        }
    }

    /**
     * Re-anchor on the newest value and recompute the sums from the held values.
     */
    private void rebuild() {
        anchor = values.isEmpty() ? 0.0 : values.peekLast();
        sum = 0.0;
        sumOfSquares = 0.0;
        for (double v : values) {
            double d = v - anchor;
            sum += d;
            sumOfSquares += d * d;
        }
        peakSumOfSquares = sumOfSquares;
        evictionsSinceRebuild = 0;
    }

    private boolean isCancelling() {
        if (sumOfSquares <= 0.0) {
            return false;
        }
        int n = values.size();
        double meanOfSquares = sumOfSquares / n;
        double mean = sum / n;
        return meanOfSquares - mean * mean < meanOfSquares * CANCELLATION_RATIO;
    }

    /**
     * Drop all held values. The last emitted stdev survives.
     */
    public void reset() {
        values.clear();
        anchor = 0.0;
        sum = 0.0;
        sumOfSquares = 0.0;
        peakSumOfSquares = 0.0;
        evictionsSinceRebuild = 0;
    }

    /**
     * Population standard deviation of the held values, empty when the window is empty.
     */
    public OptionalDouble stdev() {
        if (values.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.sqrt(populationVariance()));
    }

    /**
     * Sample (n - 1) standard deviation, empty with fewer than two values.
     */
    public OptionalDouble sampleStdev() {
        int n = values.size();
        if (n < 2) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.sqrt(populationVariance() * n / (n - 1)));
    }

    public OptionalDouble stdev(StdevMode mode) {
        return mode == StdevMode.SAMPLE ? sampleStdev() : stdev();
    }

    private double populationVariance() {
        int n = values.size();
        double mean = sum / n;
        return Math.max(0.0, sumOfSquares / n - mean * mean);
    }

    public void rememberStdev(double stdev) {
        this.lastStdev = stdev;
    }

    public Double getLastStdev() {
        return lastStdev;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Sum of the held values.
     */
    public double getSum() {
        return sum + values.size() * anchor;
    }

    /**
     * Sum of squares of the held values.
     */
    public double getSumOfSquares() {
        return sumOfSquares + 2.0 * anchor * sum + values.size() * anchor * anchor;
    }

    /**
     * Accumulator state as kept internally, for persistence.
     */
    public Sums getSums() {
        return Sums.builder()
            .anchor(anchor)
            .sum(sum)
            .sumOfSquares(sumOfSquares)
            .peakSumOfSquares(peakSumOfSquares)
            .evictionsSinceRebuild(evictionsSinceRebuild)
            .build();
    }

    /**
     * Copy of the held values, oldest first.
     */
    public List<Double> getValues() {
        return new ArrayList<>(values);
    }

    @Override
    public String toString() {
        return "RollingWindow{size=" + values.size() + "/" + capacity + ", anchor=" + anchor + ", sum=" + sum
            + ", sumOfSquares=" + sumOfSquares + ", lastStdev=" + lastStdev + "}";
    }

    /**
     * Sums of {@code value - anchor} and their squares over the held values.
     */
    @Value
    @Builder
    public static class Sums {
        double anchor;
        double sum;
        double sumOfSquares;
        double peakSumOfSquares;
        int evictionsSinceRebuild;
    }
}
