package com.marketalert.scheduler.state;

import com.marketalert.common.baseline.VolumeBaselineTracker;
import com.marketalert.common.clock.MarketSession;
import com.marketalert.common.ledger.CooldownLedger;
import com.marketalert.common.ledger.Watchlist;

import java.util.concurrent.atomic.AtomicLong;

/**
 * All mutable alerting state for one process, owned by the scheduler and handed to each
 * task. Nothing here is static; a second instance is a completely independent bot.
 */
public class AlertState {

    private final VolumeBaselineTracker baselines;
    private final CooldownLedger ledger;
    private final Watchlist watchlist;
    private final MarketSession session;
    private final AtomicLong primaryScans = new AtomicLong();
    private final AtomicLong loopTicks = new AtomicLong();

    public AlertState(VolumeBaselineTracker baselines, CooldownLedger ledger, Watchlist watchlist, MarketSession session) {
        this.baselines = baselines;
        this.ledger    = ledger;
        this.watchlist = watchlist;
        this.session   = session;
    }

    public VolumeBaselineTracker baselines() {
        return baselines;
    }

    public CooldownLedger ledger() {
        return ledger;
    }

    public Watchlist watchlist() {
        return watchlist;
    }

    public MarketSession session() {
        return session;
    }

    public long recordPrimaryScan() {
        return primaryScans.incrementAndGet();
    }

    public long primaryScans() {
        return primaryScans.get();
    }

    /** Counts every scheduling-loop iteration, whatever the market state. */
    public long recordLoopTick() {
        return loopTicks.incrementAndGet();
    }

    public long loopTicks() {
        return loopTicks.get();
    }
}
