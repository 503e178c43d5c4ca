package com.marketalert.common.clock;

import com.marketalert.common.model.MarketState;

/**
 * Mutable OPEN/CLOSED state plus the "startup notice sent" flag.
 *
 * <p>Starts CLOSED with the flag cleared, so the first OPEN reading after boot is
 * reported as {@link MarketTransition#OPENED}. The flag is reset on every OPEN → CLOSED
 * transition so the notice fires again at the next opening.
 *
 * <p>All methods are synchronized; gated tasks read {@link #state()} from the loop thread
 * while shutdown may read it from a hook thread.
 */
public class MarketSession {

    private MarketState state = MarketState.CLOSED;
    private boolean startupNoticeSent;

    public synchronized MarketTransition update(boolean active) {
        MarketState next = active ? MarketState.OPEN : MarketState.CLOSED;
        if (next == state) {
            return MarketTransition.NONE;
        }
        state = next;
        if (next == MarketState.CLOSED) {
            startupNoticeSent = false;
            return MarketTransition.CLOSED;
        }
        return MarketTransition.OPENED;
    }

    public synchronized MarketState state() {
        return state;
    }

    public synchronized boolean isOpen() {
        return state == MarketState.OPEN;
    }

    public synchronized boolean startupNoticeSent() {
        return startupNoticeSent;
    }

    public synchronized void markStartupNoticeSent() {
        startupNoticeSent = true;
    }
}
