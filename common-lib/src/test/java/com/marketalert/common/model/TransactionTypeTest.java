package com.marketalert.common.model;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class TransactionTypeTest {

    @ParameterizedTest(name = "\"{0}\" → {1}")
    @CsvSource({
        "Sale,            SELL",
        "S - Sale,        SELL",
        "Sell,            SELL",
        "S,               SELL",
        "Proposed Sale,   SELL",
        "Purchase,        BUY",
        "P - Purchase,    BUY",
        "Buy,             BUY",
        "Option Exercise, OTHER",
        "Stock Award,     OTHER",
        "'',              OTHER"
    })
    void mapsProviderText(String raw, TransactionType expected) {
        assertEquals(expected, TransactionType.fromText(raw));
    }
}
