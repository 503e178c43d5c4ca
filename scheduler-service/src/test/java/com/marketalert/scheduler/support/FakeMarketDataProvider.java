package com.marketalert.scheduler.support;

import com.marketalert.common.model.DerivativeEvent;
import com.marketalert.common.model.InsiderTrade;
import com.marketalert.common.model.InstrumentSnapshot;
import com.marketalert.common.provider.MarketDataProvider;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory data source with call recording. Responses are set per test.
 */
public class FakeMarketDataProvider implements MarketDataProvider {

    private List<InstrumentSnapshot> topMovers = List.of();
    private List<DerivativeEvent> derivatives = List.of();
    private final Map<String, List<InsiderTrade>> insiderTrades = new HashMap<>();
    private final Set<String> halted = new HashSet<>();
    private RuntimeException topMoversFailure;

    public final List<Integer> topMoversCalls = new ArrayList<>();
    public final List<String> insiderCalls = new ArrayList<>();
    public final List<String> haltCalls = new ArrayList<>();
    public int derivativeCalls;

    public FakeMarketDataProvider topMovers(InstrumentSnapshot... snapshots) {
        this.topMovers = List.of(snapshots);
        return this;
    }

    public FakeMarketDataProvider derivatives(DerivativeEvent... events) {
        this.derivatives = List.of(events);
        return this;
    }

    public FakeMarketDataProvider insiderTrades(String symbol, InsiderTrade... trades) {
        insiderTrades.put(symbol, List.of(trades));
        return this;
    }

    public FakeMarketDataProvider halted(String symbol) {
        halted.add(symbol);
        return this;
    }

    public FakeMarketDataProvider failTopMovers(RuntimeException failure) {
        this.topMoversFailure = failure;
        return this;
    }

    @Override
    public Mono<List<InstrumentSnapshot>> fetchTopMovers(int limit) {
        topMoversCalls.add(limit);
        if (topMoversFailure != null) {
            return Mono.error(topMoversFailure);
        }
        return Mono.just(topMovers);
    }

    @Override
    public Mono<List<InsiderTrade>> fetchInsiderTrades(String symbol) {
        insiderCalls.add(symbol);
        return Mono.just(insiderTrades.getOrDefault(symbol, List.of()));
    }

    @Override
    public Mono<List<DerivativeEvent>> fetchUnusualDerivativeActivity() {
        derivativeCalls++;
        return Mono.just(derivatives);
    }

    @Override
    public Mono<Boolean> fetchHaltStatus(String symbol) {
        haltCalls.add(symbol);
        return Mono.just(halted.contains(symbol));
    }
}
