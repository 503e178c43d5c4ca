package com.marketalert.marketdata.client;

/**
 * Relative paths of the MBOUM endpoints the bot polls, plus the screener preset.
 */
public record MboumEndpoints(
    String screenerPath,
    String screenerFilter,
    String insiderTradesPath,
    String unusualOptionsPath,
    String quotePath
) {

    public static MboumEndpoints defaults() {
        return new MboumEndpoints(
            "/v1/screener",
            "day_gainers",
            "/v1/markets/insider-trades",
            "/v1/markets/options/unusual-options-activity",
            "/v1/markets/stock/quotes");
    }
}
