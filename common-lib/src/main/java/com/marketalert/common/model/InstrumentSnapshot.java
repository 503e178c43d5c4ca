package com.marketalert.common.model;

/**
 * Point-in-time quote for one instrument as returned by the screener.
 *
 * <p>Produced fresh on every poll and discarded after one evaluation pass; only the
 * volume survives, aggregated into the per-symbol baseline.
 */
public record InstrumentSnapshot(
    String symbol,
    double price,
    double changePercent,
    long volume,
    double bid,
    long bidSize,
    double ask,
    long askSize
) {

    public InstrumentSnapshot {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
    }

    /** Magnitude of the move since previous close, direction ignored. */
    public double absChangePercent() {
        return Math.abs(changePercent);
    }
}
