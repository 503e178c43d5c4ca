package com.marketalert.scheduler.job;

import com.marketalert.common.model.MarketState;

/**
 * Market-state precondition checked when a task comes due.
 */
public enum TaskGate {

    ALWAYS,
    MARKET_OPEN,
    MARKET_CLOSED;

    public boolean permits(MarketState state) {
        return switch (this) {
            case ALWAYS        -> true;
            case MARKET_OPEN   -> state == MarketState.OPEN;
            case MARKET_CLOSED -> state == MarketState.CLOSED;
        };
    }
}
