package com.marketalert.scheduler.task;

import com.marketalert.common.format.AlertMessageFormatter;
import com.marketalert.common.model.AlertKind;
import com.marketalert.common.model.InsiderTrade;
import com.marketalert.common.model.InstrumentSnapshot;
import com.marketalert.common.provider.MarketDataProvider;
import com.marketalert.common.rule.InsiderActivityRule;
import com.marketalert.common.rule.PrimaryEvaluation;
import com.marketalert.common.rule.RuleEvaluator;
import com.marketalert.scheduler.dispatch.AlertDispatcher;
import com.marketalert.scheduler.state.AlertState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Primary scan: top movers → volume baseline → rule evaluator → ledger → notifier.
 *
 * <p>Per instrument, in order:
 * <ol>
 *   <li>Read the baseline from earlier samples, then record this sample.</li>
 *   <li>Volume spike, if fired and allowed by the ledger.</li>
 *   <li>Bid match, if fired and allowed: add to the watchlist, notify, then check halt status
 *       and raise a ledger-gated halt alert when halted.</li>
 *   <li>Insider activity, only when the move gate passed and no bid match fired.</li>
 * </ol>
 *
 * <p>A ledger rejection short-circuits everything that depends on that alert: no watchlist
 * insertion, no halt check, no notification. Instruments are processed sequentially so
 * ledger decisions within one scan follow snapshot order.
 */
public class PrimaryScanTask implements AlertTask {

    private static final Logger log = LoggerFactory.getLogger(PrimaryScanTask.class);

    private final MarketDataProvider dataProvider;
    private final RuleEvaluator evaluator;
    private final AlertState state;
    private final AlertDispatcher dispatcher;
    private final int topMoversLimit;

    public PrimaryScanTask(MarketDataProvider dataProvider,
                           RuleEvaluator evaluator,
                           AlertState state,
                           AlertDispatcher dispatcher,
                           int topMoversLimit) {
        this.dataProvider   = dataProvider;
        this.evaluator      = evaluator;
        this.state          = state;
        this.dispatcher     = dispatcher;
        this.topMoversLimit = topMoversLimit;
    }

    @Override
    public String name() {
        return "primary-scan";
    }

    @Override
    public Mono<Integer> run(Instant now) {
        return dataProvider.fetchTopMovers(topMoversLimit)
            .defaultIfEmpty(List.of())
            .flatMap(snapshots -> {
                long scan = state.recordPrimaryScan();
                return Flux.fromIterable(snapshots)
                    .concatMap(snapshot -> evaluate(snapshot, now))
                    .reduce(0, Integer::sum)
                    .doOnNext(alerts -> log.info("PRIMARY_SCAN_COMPLETE scan={} instruments={} alerts={}",
                                                 scan, snapshots.size(), alerts));
            });
    }

    Mono<Integer> evaluate(InstrumentSnapshot snapshot, Instant now) {
        return Mono.defer(() -> {
            String symbol = snapshot.symbol();
            OptionalDouble baseline = state.baselines().average(symbol);
            state.baselines().observe(symbol, snapshot.volume());

            PrimaryEvaluation evaluation = evaluator.evaluate(snapshot, baseline);
            log.debug("RULES_EVALUATED symbol={} pct={} spike={} bidMatch={} insiderCheck={}",
                      symbol, snapshot.changePercent(), evaluation.volumeSpike(),
                      evaluation.bidMatch(), evaluation.insiderCheckRequired());

            return volumeSpike(evaluation, now)
                .concatWith(bidMatch(evaluation, now))
                .concatWith(insiderActivity(evaluation, now))
                .reduce(0, Integer::sum);
        });
    }

    private Mono<Integer> volumeSpike(PrimaryEvaluation evaluation, Instant now) {
        return Mono.defer(() -> {
            if (!evaluation.volumeSpike()
                || !state.ledger().allow(evaluation.symbol(), AlertKind.VOLUME_SPIKE, now)) {
                return Mono.just(0);
            }
            return send(AlertKind.VOLUME_SPIKE, evaluation.symbol(), AlertMessageFormatter.volumeSpike(evaluation));
        });
    }

    private Mono<Integer> bidMatch(PrimaryEvaluation evaluation, Instant now) {
        return Mono.defer(() -> {
            AlertKind kind = evaluation.bidMatch();
            String symbol = evaluation.symbol();
            if (kind == null || !state.ledger().allow(symbol, kind, now)) {
                return Mono.just(0);
            }
            if (state.watchlist().add(symbol, now)) {
                log.info("WATCHLIST_ADDED symbol={} kind={} size={}", symbol, kind, state.watchlist().size());
            }
            return send(kind, symbol, AlertMessageFormatter.bidMatch(evaluation.snapshot(), kind))
                .flatMap(sent -> haltCheck(evaluation.snapshot(), now).map(halt -> sent + halt));
        });
    }

    private Mono<Integer> haltCheck(InstrumentSnapshot snapshot, Instant now) {
        String symbol = snapshot.symbol();
        return dataProvider.fetchHaltStatus(symbol)
            .defaultIfEmpty(false)
            .flatMap(halted -> {
                if (!halted || !state.ledger().allow(symbol, AlertKind.HALT, now)) {
                    return Mono.just(0);
                }
                return send(AlertKind.HALT, symbol, AlertMessageFormatter.halt(snapshot));
            });
    }

    private Mono<Integer> insiderActivity(PrimaryEvaluation evaluation, Instant now) {
        return Mono.defer(() -> {
            if (!evaluation.insiderCheckRequired()) {
                return Mono.just(0);
            }
            String symbol = evaluation.symbol();
            long floor = evaluator.thresholds().insiderShareFloor();
            return dataProvider.fetchInsiderTrades(symbol)
                .defaultIfEmpty(List.of())
                .flatMap(trades -> {
                    Optional<InsiderTrade> trade = InsiderActivityRule.firstUnusual(trades, floor);
                    if (trade.isEmpty() || !state.ledger().allow(symbol, AlertKind.UNUSUAL_INSIDER_ACTIVITY, now)) {
                        return Mono.just(0);
                    }
                    return send(AlertKind.UNUSUAL_INSIDER_ACTIVITY, symbol,
                                AlertMessageFormatter.insiderActivity(evaluation.snapshot(), trade.get()));
                });
        });
    }

    private Mono<Integer> send(AlertKind kind, String symbol, String text) {
        return dispatcher.dispatch(kind, symbol, text).thenReturn(1);
    }
}
