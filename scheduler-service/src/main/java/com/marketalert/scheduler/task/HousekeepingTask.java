package com.marketalert.scheduler.task;

import com.marketalert.scheduler.state.AlertState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Bounds in-memory growth: drops ledger entries past their cooldown and watchlist entries
 * past their TTL.
 */
public class HousekeepingTask implements AlertTask {

    private static final Logger log = LoggerFactory.getLogger(HousekeepingTask.class);

    private final AlertState state;

    public HousekeepingTask(AlertState state) {
        this.state = state;
    }

    @Override
    public String name() {
        return "housekeeping";
    }

    @Override
    public Mono<Integer> run(Instant now) {
        return Mono.fromCallable(() -> {
            int ledgerPruned    = state.ledger().pruneExpired(now);
            int watchlistPruned = state.watchlist().pruneExpired(now);
            log.info("HOUSEKEEPING ledgerPruned={} ledgerSize={} watchlistPruned={} watchlistSize={} baselines={}",
                     ledgerPruned, state.ledger().size(), watchlistPruned, state.watchlist().size(),
                     state.baselines().trackedSymbols());
            return 0;
        });
    }
}
