package com.marketalert.scheduler.task;

import com.marketalert.common.format.AlertMessageFormatter;
import com.marketalert.common.model.AlertKind;
import com.marketalert.common.model.DerivativeEvent;
import com.marketalert.common.provider.MarketDataProvider;
import com.marketalert.common.rule.DerivativeActivityRule;
import com.marketalert.common.rule.RuleThresholds;
import com.marketalert.scheduler.dispatch.AlertDispatcher;
import com.marketalert.scheduler.state.AlertState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Unusual options activity scan. The ledger key is the underlying symbol, so several
 * qualifying contracts on one underlying produce a single alert per cooldown window.
 */
public class DerivativeScanTask implements AlertTask {

    private static final Logger log = LoggerFactory.getLogger(DerivativeScanTask.class);

    private final MarketDataProvider dataProvider;
    private final RuleThresholds thresholds;
    private final AlertState state;
    private final AlertDispatcher dispatcher;

    public DerivativeScanTask(MarketDataProvider dataProvider, RuleThresholds thresholds,
                              AlertState state, AlertDispatcher dispatcher) {
        this.dataProvider = dataProvider;
        this.thresholds   = thresholds;
        this.state        = state;
        this.dispatcher   = dispatcher;
    }

    @Override
    public String name() {
        return "derivative-scan";
    }

    @Override
    public Mono<Integer> run(Instant now) {
        return dataProvider.fetchUnusualDerivativeActivity()
            .defaultIfEmpty(List.of())
            .flatMap(events -> Flux.fromIterable(events)
                .filter(event -> DerivativeActivityRule.isUnusual(event, thresholds))
                .concatMap(event -> alert(event, now))
                .reduce(0, Integer::sum)
                .doOnNext(alerts -> log.info("DERIVATIVE_SCAN_COMPLETE contracts={} alerts={}",
                                             events.size(), alerts)));
    }

    private Mono<Integer> alert(DerivativeEvent event, Instant now) {
        return Mono.defer(() -> {
            if (!state.ledger().allow(event.underlying(), AlertKind.UNUSUAL_OPTIONS_ACTIVITY, now)) {
                return Mono.just(0);
            }
            return dispatcher.dispatch(AlertKind.UNUSUAL_OPTIONS_ACTIVITY, event.underlying(),
                                       AlertMessageFormatter.unusualOptions(event))
                .thenReturn(1);
        });
    }
}
