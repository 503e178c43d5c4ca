package com.marketalert.common.model;

import java.util.OptionalDouble;

/**
 * One contract from the unusual options activity feed, keyed back to its underlying.
 */
public record DerivativeEvent(
    String underlying,
    String contract,
    String contractType,
    double strike,
    String expiration,
    long volume,
    long openInterest
) {

    /**
     * Volume to open-interest ratio; empty when open interest is zero or unreported.
     */
    public OptionalDouble volumeToOpenInterest() {
        if (openInterest <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) volume / openInterest);
    }
}
