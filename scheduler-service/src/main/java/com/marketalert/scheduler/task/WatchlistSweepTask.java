package com.marketalert.scheduler.task;

import com.marketalert.common.format.AlertMessageFormatter;
import com.marketalert.common.model.AlertKind;
import com.marketalert.common.model.InsiderTrade;
import com.marketalert.common.provider.MarketDataProvider;
import com.marketalert.common.rule.InsiderActivityRule;
import com.marketalert.scheduler.dispatch.AlertDispatcher;
import com.marketalert.scheduler.state.AlertState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Large-sale follow-up for every symbol on the watchlist: insider sales at or above the
 * share floor raise a ledger-gated {@link AlertKind#LARGE_SALE}.
 */
public class WatchlistSweepTask implements AlertTask {

    private static final Logger log = LoggerFactory.getLogger(WatchlistSweepTask.class);

    private final MarketDataProvider dataProvider;
    private final AlertState state;
    private final AlertDispatcher dispatcher;
    private final long shareFloor;

    public WatchlistSweepTask(MarketDataProvider dataProvider, AlertState state,
                              AlertDispatcher dispatcher, long shareFloor) {
        this.dataProvider = dataProvider;
        this.state        = state;
        this.dispatcher   = dispatcher;
        this.shareFloor   = shareFloor;
    }

    @Override
    public String name() {
        return "watchlist-sweep";
    }

    @Override
    public Mono<Integer> run(Instant now) {
        return Mono.defer(() -> {
            List<String> symbols = state.watchlist().snapshot(now);
            if (symbols.isEmpty()) {
                return Mono.just(0);
            }
            return Flux.fromIterable(symbols)
                .concatMap(symbol -> sweep(symbol, now))
                .reduce(0, Integer::sum)
                .doOnNext(alerts -> log.info("WATCHLIST_SWEEP_COMPLETE symbols={} alerts={}", symbols.size(), alerts));
        });
    }

    private Mono<Integer> sweep(String symbol, Instant now) {
        return dataProvider.fetchInsiderTrades(symbol)
            .defaultIfEmpty(List.of())
            .flatMap(trades -> {
                Optional<InsiderTrade> sale = InsiderActivityRule.firstLargeSale(trades, shareFloor);
                if (sale.isEmpty() || !state.ledger().allow(symbol, AlertKind.LARGE_SALE, now)) {
                    return Mono.just(0);
                }
                return dispatcher.dispatch(AlertKind.LARGE_SALE, symbol, AlertMessageFormatter.largeSale(sale.get()))
                    .thenReturn(1);
            });
    }
}
