package com.marketalert.common.model;

/**
 * Every kind of message the bot can emit.
 *
 * <p>The first eight are rule alerts and are cooldown-gated per symbol by the ledger.
 * The operational kinds ({@link #STARTUP}, {@link #SHUTDOWN}, {@link #HEARTBEAT},
 * {@link #ERROR}) describe the bot itself and bypass the ledger.
 */
public enum AlertKind {

    BID_MATCH_EXACT,
    BID_MATCH_HIGH_VALUE,
    VOLUME_SPIKE,
    UNUSUAL_INSIDER_ACTIVITY,
    UNUSUAL_OPTIONS_ACTIVITY,
    HALT,
    LARGE_SALE,
    PERIODIC_SUMMARY,

    STARTUP,
    SHUTDOWN,
    HEARTBEAT,
    ERROR;

    public boolean isBidMatch() {
        return this == BID_MATCH_EXACT || this == BID_MATCH_HIGH_VALUE;
    }

    public boolean isOperational() {
        return this == STARTUP || this == SHUTDOWN || this == HEARTBEAT || this == ERROR;
    }
}
