package com.marketalert.common.provider;

import com.marketalert.common.model.DerivativeEvent;
import com.marketalert.common.model.InsiderTrade;
import com.marketalert.common.model.InstrumentSnapshot;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Data source consumed by the alerting tasks.
 *
 * <p>Implementations must never signal an error for transient failures (timeouts,
 * non-2xx statuses, malformed payloads): they emit an empty list or {@code false} instead,
 * which callers treat as "no matches this cycle".
 */
public interface MarketDataProvider {

    Mono<List<InstrumentSnapshot>> fetchTopMovers(int limit);

    /**
     * @param symbol ticker to filter on, or {@code null} for the latest trades market-wide
     */
    Mono<List<InsiderTrade>> fetchInsiderTrades(String symbol);

    Mono<List<DerivativeEvent>> fetchUnusualDerivativeActivity();

    Mono<Boolean> fetchHaltStatus(String symbol);
}
