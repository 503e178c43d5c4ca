package com.marketalert.common.model;

/**
 * One reported insider transaction.
 *
 * @param insider insider name or title; may be {@code null} when the provider omits it
 * @param price   per-share price; {@code 0} when not reported
 */
public record InsiderTrade(
    String symbol,
    String insider,
    TransactionType type,
    long shares,
    double price
) {

    public boolean isSale() {
        return type == TransactionType.SELL;
    }
}
