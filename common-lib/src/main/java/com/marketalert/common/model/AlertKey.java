package com.marketalert.common.model;

/**
 * Cooldown ledger key. Summary alerts use a minute-bucket string in place of a symbol.
 */
public record AlertKey(String symbol, AlertKind kind) {

    public AlertKey {
        if (symbol == null || kind == null) {
            throw new IllegalArgumentException("symbol and kind are required");
        }
    }
}
