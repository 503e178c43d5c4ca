package com.marketalert.common.baseline;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalDouble;

/**
 * Bounded FIFO of recent volume samples for one symbol with a running sum.
 *
 * <p>Not thread-safe on its own; {@link VolumeBaselineTracker} guards each window.
 */
final class VolumeWindow {

    private final int capacity;
    private final int minSamples;
    private final Deque<Long> samples;
    private long sum;

    VolumeWindow(int capacity, int minSamples) {
        this.capacity   = capacity;
        this.minSamples = minSamples;
        this.samples    = new ArrayDeque<>(capacity);
    }

    void append(long volume) {
        samples.addLast(volume);
        sum += volume;
        if (samples.size() > capacity) {
            sum -= samples.removeFirst();
        }
    }

    OptionalDouble average() {
        if (samples.size() < minSamples) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) sum / samples.size());
    }

    int size() {
        return samples.size();
    }
}
