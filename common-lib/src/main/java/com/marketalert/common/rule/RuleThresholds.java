package com.marketalert.common.rule;

/**
 * Fixed thresholds for every alert rule. Bound from configuration at startup and
 * immutable afterwards.
 *
 * @param minPercentMove         gate for bid-match and insider rules (absolute % change)
 * @param exactBidPrice          bid price for the exact match
 * @param exactBidShares         bid size for the exact match
 * @param highValueBidPrice      minimum bid for the high-value match
 * @param highValueBidShares     minimum bid size for the high-value match
 * @param insiderShareFloor      minimum shares for insider activity and large-sale alerts
 * @param optionsVolumeOiRatio   volume / open interest must exceed this
 * @param optionsVolumeFloor     or absolute contract volume must exceed this
 */
public record RuleThresholds(
    double minPercentMove,
    double exactBidPrice,
    long exactBidShares,
    double highValueBidPrice,
    long highValueBidShares,
    long insiderShareFloor,
    double optionsVolumeOiRatio,
    long optionsVolumeFloor
) {

    public static RuleThresholds defaults() {
        return new RuleThresholds(5.0, 199_999.0, 100, 2_000.0, 20, 10_000, 5.0, 5_000);
    }
}
