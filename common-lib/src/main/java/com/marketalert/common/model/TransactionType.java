package com.marketalert.common.model;

/**
 * Direction of an insider transaction. Anything the data source reports that is not
 * clearly a purchase or a sale (gifts, option exercises, grants) maps to {@link #OTHER}.
 */
public enum TransactionType {

    BUY,
    SELL,
    OTHER;

    /**
     * Lenient mapping from provider text such as {@code "Sale"}, {@code "S - Sale"},
     * {@code "Purchase"} or {@code "Buy"}.
     */
    public static TransactionType fromText(String raw) {
        if (raw == null) {
            return OTHER;
        }
        String text = raw.trim().toUpperCase();
        if (text.equals("S") || text.contains("SALE") || text.contains("SELL")) {
            return SELL;
        }
        if (text.equals("P") || text.startsWith("BUY") || text.contains("PURCHASE")) {
            return BUY;
        }
        return OTHER;
    }
}
