package com.marketalert.marketdata.client;

import com.marketalert.common.model.DerivativeEvent;
import com.marketalert.common.model.InsiderTrade;
import com.marketalert.common.model.InstrumentSnapshot;
import com.marketalert.common.provider.MarketDataProvider;
import com.marketalert.marketdata.parser.MboumResponseParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * {@link MarketDataProvider} backed by the MBOUM REST API.
 *
 * <p>Every call is a single best-effort GET bounded by {@code requestTimeout} on top of the
 * connector's own connect/read timeouts. Transport errors, non-2xx statuses, timeouts and
 * malformed payloads are logged at WARN and absorbed into an empty result, so callers never
 * see an error signal from this class.
 */
public class MboumMarketDataClient implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(MboumMarketDataClient.class);

    private final WebClient webClient;
    private final MboumResponseParser parser;
    private final MboumEndpoints endpoints;
    private final String apiKey;
    private final Duration requestTimeout;

    public MboumMarketDataClient(WebClient webClient,
                                 MboumResponseParser parser,
                                 MboumEndpoints endpoints,
                                 String apiKey,
                                 Duration requestTimeout) {
        this.webClient      = webClient;
        this.parser         = parser;
        this.endpoints      = endpoints;
        this.apiKey         = apiKey;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Mono<List<InstrumentSnapshot>> fetchTopMovers(int limit) {
        return get(uri -> uri.path(endpoints.screenerPath())
                .queryParam("metricType", "overview")
                .queryParam("filter", endpoints.screenerFilter())
                .queryParam("limit", limit)
                .build())
            .map(parser::parseSnapshots)
            .defaultIfEmpty(List.of())
            .doOnSuccess(list -> log.info("Top movers fetched. provider=MBOUM count={}", list.size()))
            .onErrorResume(e -> {
                log.warn("Top movers fetch failed, treating as no data. reason={}", e.toString());
                return Mono.just(List.of());
            });
    }

    @Override
    public Mono<List<InsiderTrade>> fetchInsiderTrades(String symbol) {
        return get(uri -> {
                UriBuilder builder = uri.path(endpoints.insiderTradesPath());
                if (symbol != null && !symbol.isBlank()) {
                    builder.queryParam("ticker", symbol);
                }
                return builder.build();
            })
            .map(parser::parseInsiderTrades)
            .map(trades -> symbol == null ? trades : onlySymbol(trades, symbol))
            .defaultIfEmpty(List.of())
            .doOnSuccess(list -> log.debug("Insider trades fetched. symbol={} count={}", symbol, list.size()))
            .onErrorResume(e -> {
                log.warn("Insider trades fetch failed, treating as no data. symbol={} reason={}", symbol, e.toString());
                return Mono.just(List.of());
            });
    }

    @Override
    public Mono<List<DerivativeEvent>> fetchUnusualDerivativeActivity() {
        return get(uri -> uri.path(endpoints.unusualOptionsPath())
                .queryParam("type", "STOCKS")
                .build())
            .map(parser::parseUnusualOptions)
            .defaultIfEmpty(List.of())
            .doOnSuccess(list -> log.info("Unusual options fetched. count={}", list.size()))
            .onErrorResume(e -> {
                log.warn("Unusual options fetch failed, treating as no data. reason={}", e.toString());
                return Mono.just(List.of());
            });
    }

    @Override
    public Mono<Boolean> fetchHaltStatus(String symbol) {
        return get(uri -> uri.path(endpoints.quotePath())
                .queryParam("ticker", symbol)
                .build())
            .map(json -> parser.parseHaltStatus(json, symbol))
            .defaultIfEmpty(false)
            .doOnSuccess(halted -> log.info("Halt status fetched. symbol={} halted={}", symbol, halted))
            .onErrorResume(e -> {
                log.warn("Halt status fetch failed, assuming not halted. symbol={} reason={}", symbol, e.toString());
                return Mono.just(false);
            });
    }

    // ── transport ─────────────────────────────────────────────────────────────

    private Mono<String> get(Function<UriBuilder, URI> uriFunction) {
        return webClient.get()
            .uri(uriFunction)
            .header(HttpHeaders.AUTHORIZATION, apiKey)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(requestTimeout);
    }

    private static List<InsiderTrade> onlySymbol(List<InsiderTrade> trades, String symbol) {
        return trades.stream()
            .filter(t -> symbol.equalsIgnoreCase(t.symbol()))
            .toList();
    }
}
