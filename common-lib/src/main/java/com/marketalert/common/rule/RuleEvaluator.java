package com.marketalert.common.rule;

import com.marketalert.common.model.AlertKind;
import com.marketalert.common.model.InstrumentSnapshot;

import java.util.OptionalDouble;

/**
 * Pure evaluation of the primary alert rules for one instrument snapshot.
 *
 * <p>Rules in priority order:
 * <ol>
 *   <li>Volume spike: {@code volume > baseline × multiplier(|change%|)}; independent of the
 *       move gate, never fires against an undefined or non-positive baseline.</li>
 *   <li>Minimum-move gate: the remaining rules only run when {@code |change%| ≥ minPercentMove}.</li>
 *   <li>Bid-match exact: {@code bid == exactBidPrice && bidSize == exactBidShares}.</li>
 *   <li>Bid-match high-value: only when exact did not match;
 *       {@code bid ≥ highValueBidPrice && bidSize ≥ highValueBidShares}.</li>
 *   <li>Insider activity: only when neither bid-match fired; flagged via
 *       {@link PrimaryEvaluation#insiderCheckRequired()} for the caller to resolve.</li>
 * </ol>
 *
 * <p>No I/O, no clock, no mutation: replaying the same snapshot with the same baseline
 * always yields the same evaluation.
 */
public final class RuleEvaluator {

    private final RuleThresholds thresholds;

    public RuleEvaluator(RuleThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * @param snapshot instrument to evaluate
     * @param baseline volume average from samples observed before this snapshot
     */
    public PrimaryEvaluation evaluate(InstrumentSnapshot snapshot, OptionalDouble baseline) {
        double pct = snapshot.absChangePercent();

        int multiplier = VolumeSpikeMultiplier.forChange(pct);
        boolean spike = isVolumeSpike(snapshot.volume(), baseline, multiplier);

        boolean gate = pct >= thresholds.minPercentMove();
        AlertKind bidMatch = gate ? matchBid(snapshot) : null;
        boolean insiderCheck = gate && bidMatch == null;

        return new PrimaryEvaluation(snapshot, baseline, multiplier, spike, gate, bidMatch, insiderCheck);
    }

    /**
     * Bid-match classification independent of the move gate. Exact takes priority, so at
     * most one kind is ever returned.
     */
    public AlertKind matchBid(InstrumentSnapshot snapshot) {
        if (snapshot.bid() == thresholds.exactBidPrice()
            && snapshot.bidSize() == thresholds.exactBidShares()) {
            return AlertKind.BID_MATCH_EXACT;
        }
        if (snapshot.bid() >= thresholds.highValueBidPrice()
            && snapshot.bidSize() >= thresholds.highValueBidShares()) {
            return AlertKind.BID_MATCH_HIGH_VALUE;
        }
        return null;
    }

    static boolean isVolumeSpike(long volume, OptionalDouble baseline, int multiplier) {
        if (baseline.isEmpty()) {
            return false;
        }
        double average = baseline.getAsDouble();
        return average > 0 && volume > average * multiplier;
    }

    public RuleThresholds thresholds() {
        return thresholds;
    }
}
