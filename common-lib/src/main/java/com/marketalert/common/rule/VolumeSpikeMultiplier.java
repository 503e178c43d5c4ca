package com.marketalert.common.rule;

import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Step table selecting how many times the baseline volume a bar must print before it
 * counts as a spike. Larger moves demand larger multiples.
 *
 * <pre>
 *   |change%|  [1,10)   → 10
 *              [10,50)  → 20
 *              [50,100) → 30
 *              [100,200)→ 50
 *              [200,∞)  → 100
 *   below 1             → 10
 * </pre>
 *
 * <p>Lower bounds are inclusive: exactly 10% selects 20, exactly 200% selects 100.
 */
public final class VolumeSpikeMultiplier {

    static final int DEFAULT_MULTIPLIER = 10;

    private static final NavigableMap<Double, Integer> STEPS = new TreeMap<>();

    static {
        STEPS.put(1.0,   10);
        STEPS.put(10.0,  20);
        STEPS.put(50.0,  30);
        STEPS.put(100.0, 50);
        STEPS.put(200.0, 100);
    }

    private VolumeSpikeMultiplier() {}

    /**
     * @param absChangePercent magnitude of the move; the sign is ignored
     */
    public static int forChange(double absChangePercent) {
        var step = STEPS.floorEntry(Math.abs(absChangePercent));
        return step == null ? DEFAULT_MULTIPLIER : step.getValue();
    }
}
