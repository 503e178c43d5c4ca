package com.marketalert.common.baseline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link VolumeBaselineTracker} window and average rules.
 */
class VolumeBaselineTrackerTest {

    @Test
    @DisplayName("average is undefined below the minimum sample count")
    void undefinedBelowMinimum() {
        VolumeBaselineTracker tracker = new VolumeBaselineTracker(30, 5);
        for (int i = 1; i <= 4; i++) {
            assertTrue(tracker.observe("AAA", 1_000L * i).isEmpty(), "sample " + i);
        }
        assertTrue(tracker.average("AAA").isEmpty());

        OptionalDouble fifth = tracker.observe("AAA", 5_000);
        assertTrue(fifth.isPresent());
        assertEquals(3_000.0, fifth.getAsDouble(), 1e-9);
    }

    @Test
    @DisplayName("unknown symbol has no baseline and no samples")
    void unknownSymbol() {
        VolumeBaselineTracker tracker = new VolumeBaselineTracker();
        assertTrue(tracker.average("NOPE").isEmpty());
        assertEquals(0, tracker.sampleCount("NOPE"));
    }

    @Test
    @DisplayName("oldest sample is evicted beyond capacity")
    void fifoEviction() {
        VolumeBaselineTracker tracker = new VolumeBaselineTracker(3, 1);
        tracker.observe("AAA", 100);
        tracker.observe("AAA", 200);
        tracker.observe("AAA", 300);
        assertEquals(200.0, tracker.average("AAA").getAsDouble(), 1e-9);

        OptionalDouble after = tracker.observe("AAA", 1_000);
        assertEquals(3, tracker.sampleCount("AAA"));
        assertEquals(500.0, after.getAsDouble(), 1e-9);
    }

    @Test
    @DisplayName("symbols are tracked independently")
    void independentSymbols() {
        VolumeBaselineTracker tracker = new VolumeBaselineTracker(10, 1);
        tracker.observe("AAA", 100);
        tracker.observe("BBB", 900);
        assertEquals(100.0, tracker.average("AAA").getAsDouble(), 1e-9);
        assertEquals(900.0, tracker.average("BBB").getAsDouble(), 1e-9);
        assertEquals(2, tracker.trackedSymbols());
    }

    @Test
    @DisplayName("identical volume sequences yield identical average sequences")
    void deterministic() {
        long[] volumes = {12_000, 9_500, 40_000, 7_000, 15_500, 11_000, 300_000, 8_000};
        assertEquals(averages(volumes), averages(volumes));
    }

    @Test
    @DisplayName("rejects minimum above capacity")
    void rejectsInvalidWindow() {
        assertThrows(IllegalArgumentException.class, () -> new VolumeBaselineTracker(3, 4));
    }

    private static List<OptionalDouble> averages(long[] volumes) {
        VolumeBaselineTracker tracker = new VolumeBaselineTracker(5, 3);
        List<OptionalDouble> out = new ArrayList<>();
        for (long v : volumes) {
            out.add(tracker.observe("XYZ", v));
        }
        return out;
    }
}
