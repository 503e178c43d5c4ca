package com.marketalert.scheduler.task;

import com.marketalert.common.model.AlertKind;
import com.marketalert.scheduler.dispatch.AlertDispatcher;
import com.marketalert.scheduler.state.AlertState;
import com.marketalert.scheduler.support.RecordingNotifier;
import com.marketalert.scheduler.support.TestState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Heartbeat and housekeeping: the two tasks that act on the bot itself rather than on market data.
 */
class OperationalTasksTest {

    private static final Instant NOW = Instant.parse("2024-03-05T02:00:00Z");

    private final RecordingNotifier notifier = new RecordingNotifier();
    private final AlertState state = TestState.fresh();

    @Test
    @DisplayName("heartbeat reports the loop tick count")
    void heartbeatCarriesLoopTickCount() {
        state.recordLoopTick();
        state.recordLoopTick();
        state.recordPrimaryScan();
        HeartbeatTask task = new HeartbeatTask(state, new AlertDispatcher(notifier));

        StepVerifier.create(task.run(NOW)).expectNext(1).verifyComplete();

        assertEquals(AlertKind.HEARTBEAT, notifier.sent().get(0).kind());
        assertTrue(notifier.sent().get(0).text().endsWith("Scans: 2"));
    }

    @Test
    @DisplayName("housekeeping drops expired ledger and watchlist entries only")
    void housekeepingPrunes() {
        state.ledger().allow("OLD", AlertKind.VOLUME_SPIKE, NOW.minusSeconds(301));
        state.ledger().allow("NEW", AlertKind.VOLUME_SPIKE, NOW.minusSeconds(10));
        state.watchlist().add("OLD", NOW.minus(Duration.ofHours(25)));
        state.watchlist().add("NEW", NOW.minusSeconds(10));

        StepVerifier.create(new HousekeepingTask(state).run(NOW)).expectNext(0).verifyComplete();

        assertEquals(1, state.ledger().size());
        assertEquals(1, state.watchlist().size());
        assertFalse(state.ledger().allow("NEW", AlertKind.VOLUME_SPIKE, NOW));
        assertTrue(state.watchlist().contains("NEW", NOW));
        assertTrue(notifier.sent().isEmpty());
    }
}
