package com.marketalert.common.model;

/**
 * Whether the instrument universe is currently being watched.
 *
 * <ul>
 *   <li>{@link #OPEN}: inside the configured weekday trading window; gated tasks run.</li>
 *   <li>{@link #CLOSED}: weekend or outside the window; only the state recheck and heartbeat run.</li>
 * </ul>
 */
public enum MarketState {

    OPEN,

    CLOSED
}
