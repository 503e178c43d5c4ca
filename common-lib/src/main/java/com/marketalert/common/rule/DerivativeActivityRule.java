package com.marketalert.common.rule;

import com.marketalert.common.model.DerivativeEvent;

/**
 * Unusual options activity check for one contract: fires when volume dwarfs open interest
 * or when absolute volume is large on its own.
 */
public final class DerivativeActivityRule {

    private DerivativeActivityRule() {}

    public static boolean isUnusual(DerivativeEvent event, RuleThresholds thresholds) {
        if (event.volume() > thresholds.optionsVolumeFloor()) {
            return true;
        }
        return event.volumeToOpenInterest().orElse(0.0) > thresholds.optionsVolumeOiRatio();
    }
}
