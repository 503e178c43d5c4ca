package com.marketalert.common.clock;

/**
 * Outcome of feeding one clock reading into {@link MarketSession}.
 */
public enum MarketTransition {

    /** State unchanged since the previous reading. */
    NONE,

    /** CLOSED → OPEN. */
    OPENED,

    /** OPEN → CLOSED. The startup-notice flag has been reset. */
    CLOSED
}
