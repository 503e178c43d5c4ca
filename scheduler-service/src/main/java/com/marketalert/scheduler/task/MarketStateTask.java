package com.marketalert.scheduler.task;

import com.marketalert.common.clock.MarketClock;
import com.marketalert.common.clock.MarketSession;
import com.marketalert.common.clock.MarketTransition;
import com.marketalert.common.format.AlertMessageFormatter;
import com.marketalert.common.model.AlertKind;
import com.marketalert.scheduler.dispatch.AlertDispatcher;
import com.marketalert.scheduler.state.AlertState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Re-reads the market clock and advances the OPEN/CLOSED state. Runs regardless of state.
 *
 * <p>While OPEN and the startup notice has not gone out since the last opening, sends it and
 * sets the flag. OPEN → CLOSED clears the flag (inside {@code MarketSession}) so the notice
 * fires again at the next opening.
 */
public class MarketStateTask implements AlertTask {

    private static final Logger log = LoggerFactory.getLogger(MarketStateTask.class);

    private final MarketClock clock;
    private final AlertState state;
    private final AlertDispatcher dispatcher;

    public MarketStateTask(MarketClock clock, AlertState state, AlertDispatcher dispatcher) {
        this.clock      = clock;
        this.state      = state;
        this.dispatcher = dispatcher;
    }

    @Override
    public String name() {
        return "market-state-recheck";
    }

    @Override
    public Mono<Integer> run(Instant now) {
        return Mono.defer(() -> {
            MarketSession session = state.session();
            MarketTransition transition = session.update(clock.isActive(now));
            if (transition != MarketTransition.NONE) {
                log.info("MARKET_STATE_CHANGED transition={} state={} zone={}", transition, session.state(), clock.zone());
            }
            if (!session.isOpen() || session.startupNoticeSent()) {
                return Mono.just(0);
            }
            session.markStartupNoticeSent();
            String text = AlertMessageFormatter.marketOpen(clock.zone().getId(), clock.openHour(), clock.closeHour());
            return dispatcher.dispatch(AlertKind.STARTUP, "-", text).thenReturn(1);
        });
    }
}
