package com.marketalert.common.rule;

import com.marketalert.common.model.AlertKind;
import com.marketalert.common.model.InstrumentSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Result of running the primary rules against one snapshot.
 *
 * @param snapshot              the evaluated instrument
 * @param baseline              volume average the spike rule compared against; empty when undefined
 * @param multiplier            spike multiplier selected from the step table
 * @param volumeSpike           spike rule fired
 * @param passedMoveGate        |change%| reached the minimum move
 * @param bidMatch              {@code BID_MATCH_EXACT}, {@code BID_MATCH_HIGH_VALUE} or {@code null}
 * @param insiderCheckRequired  gate passed and no bid-match fired; the caller must fetch insider trades
 */
public record PrimaryEvaluation(
    InstrumentSnapshot snapshot,
    OptionalDouble baseline,
    int multiplier,
    boolean volumeSpike,
    boolean passedMoveGate,
    AlertKind bidMatch,
    boolean insiderCheckRequired
) {

    public String symbol() {
        return snapshot.symbol();
    }

    public Optional<AlertKind> bidMatchKind() {
        return Optional.ofNullable(bidMatch);
    }

    /** Spike threshold in shares, or {@code 0} when the baseline is undefined. */
    public double spikeThreshold() {
        return baseline.isPresent() ? baseline.getAsDouble() * multiplier : 0.0;
    }

    /**
     * Alerts decided from the snapshot alone, in priority order. The insider rule needs
     * secondary data and is not included.
     */
    public List<AlertKind> firedKinds() {
        List<AlertKind> kinds = new ArrayList<>(2);
        if (volumeSpike) {
            kinds.add(AlertKind.VOLUME_SPIKE);
        }
        if (bidMatch != null) {
            kinds.add(bidMatch);
        }
        return kinds;
    }
}
