package com.marketalert.scheduler.task;

import com.marketalert.common.format.AlertMessageFormatter;
import com.marketalert.common.model.AlertKind;
import com.marketalert.common.model.InstrumentSnapshot;
import com.marketalert.common.provider.MarketDataProvider;
import com.marketalert.scheduler.state.AlertState;
import com.marketalert.scheduler.dispatch.AlertDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;

/**
 * Periodic top-K movers list, ranked by percent change descending.
 *
 * <p>Deduplicated through the ledger with a per-minute bucket key in place of a symbol, so at
 * most one summary goes out per minute bucket however many ticks land in it.
 */
public class SummaryTask implements AlertTask {

    private static final Logger log = LoggerFactory.getLogger(SummaryTask.class);

    private static final DateTimeFormatter BUCKET = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm");

    private final MarketDataProvider dataProvider;
    private final AlertState state;
    private final AlertDispatcher dispatcher;
    private final int topK;
    private final ZoneId zone;

    public SummaryTask(MarketDataProvider dataProvider, AlertState state, AlertDispatcher dispatcher,
                       int topK, ZoneId zone) {
        this.dataProvider = dataProvider;
        this.state        = state;
        this.dispatcher   = dispatcher;
        this.topK         = topK;
        this.zone         = zone;
    }

    @Override
    public String name() {
        return "summary";
    }

    @Override
    public Mono<Integer> run(Instant now) {
        return dataProvider.fetchTopMovers(topK)
            .defaultIfEmpty(List.of())
            .flatMap(movers -> {
                if (movers.isEmpty()) {
                    log.info("SUMMARY_SKIPPED reason=no-data");
                    return Mono.just(0);
                }
                String bucket = bucketKey(now, zone);
                if (!state.ledger().allow(bucket, AlertKind.PERIODIC_SUMMARY, now)) {
                    log.debug("SUMMARY_SKIPPED reason=bucket-already-sent bucket={}", bucket);
                    return Mono.just(0);
                }
                return dispatcher.dispatch(AlertKind.PERIODIC_SUMMARY, bucket, AlertMessageFormatter.summary(rank(movers, topK)))
                    .thenReturn(1);
            });
    }

    static List<InstrumentSnapshot> rank(List<InstrumentSnapshot> movers, int topK) {
        return movers.stream()
            .sorted(Comparator.comparingDouble(InstrumentSnapshot::changePercent).reversed()
                              .thenComparing(InstrumentSnapshot::symbol))
            .limit(topK)
            .toList();
    }

    static String bucketKey(Instant now, ZoneId zone) {
        return "summary@" + BUCKET.format(now.atZone(zone).truncatedTo(ChronoUnit.MINUTES));
    }
}
