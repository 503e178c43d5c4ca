package com.marketalert.common.rule;

import com.marketalert.common.model.InsiderTrade;

import java.util.List;
import java.util.Optional;

/**
 * Share-count floor checks over insider trade lists. Trades are inspected in the order
 * the data source returned them; the first qualifying trade wins.
 */
public final class InsiderActivityRule {

    private InsiderActivityRule() {}

    /** Primary-scan rule: any direction. */
    public static Optional<InsiderTrade> firstUnusual(List<InsiderTrade> trades, long shareFloor) {
        if (trades == null) {
            return Optional.empty();
        }
        return trades.stream()
            .filter(t -> t.shares() >= shareFloor)
            .findFirst();
    }

    /** Watchlist follow-up rule: sales only. */
    public static Optional<InsiderTrade> firstLargeSale(List<InsiderTrade> trades, long shareFloor) {
        if (trades == null) {
            return Optional.empty();
        }
        return trades.stream()
            .filter(InsiderTrade::isSale)
            .filter(t -> t.shares() >= shareFloor)
            .findFirst();
    }
}
