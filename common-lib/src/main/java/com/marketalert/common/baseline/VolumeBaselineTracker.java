package com.marketalert.common.baseline;

import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling per-symbol volume baseline used by the volume spike rule.
 *
 * <p>Each symbol owns a window of the most recent {@code capacity} samples, created lazily
 * on first sighting. The average is undefined (empty) until {@code minSamples} samples have
 * been observed, which the spike rule treats as "no spike possible".
 *
 * <p>Deterministic: the average sequence depends only on the sequence of observed volumes.
 * Windows live in a {@link ConcurrentHashMap}; each window is mutated under its own lock so
 * concurrent scans never tear a window.
 */
public class VolumeBaselineTracker {

    public static final int DEFAULT_CAPACITY    = 30;
    public static final int DEFAULT_MIN_SAMPLES = 5;

    private final int capacity;
    private final int minSamples;
    private final ConcurrentHashMap<String, VolumeWindow> windows = new ConcurrentHashMap<>();

    public VolumeBaselineTracker() {
        this(DEFAULT_CAPACITY, DEFAULT_MIN_SAMPLES);
    }

    public VolumeBaselineTracker(int capacity, int minSamples) {
        if (capacity < 1 || minSamples < 1 || minSamples > capacity) {
            throw new IllegalArgumentException(
                "invalid baseline window capacity=" + capacity + " minSamples=" + minSamples);
        }
        this.capacity   = capacity;
        this.minSamples = minSamples;
    }

    /**
     * Appends {@code volume} to the symbol's window, evicting the oldest sample beyond
     * capacity.
     *
     * @return mean of the retained samples including this one, or empty below the minimum count
     */
    public OptionalDouble observe(String symbol, long volume) {
        VolumeWindow window = windows.computeIfAbsent(symbol, s -> new VolumeWindow(capacity, minSamples));
        synchronized (window) {
            window.append(volume);
            return window.average();
        }
    }

    /**
     * Current baseline without recording anything. Read before {@link #observe} so that a
     * new sample is compared against the history that preceded it.
     */
    public OptionalDouble average(String symbol) {
        VolumeWindow window = windows.get(symbol);
        if (window == null) {
            return OptionalDouble.empty();
        }
        synchronized (window) {
            return window.average();
        }
    }

    public int sampleCount(String symbol) {
        VolumeWindow window = windows.get(symbol);
        if (window == null) {
            return 0;
        }
        synchronized (window) {
            return window.size();
        }
    }

    public int trackedSymbols() {
        return windows.size();
    }
}
