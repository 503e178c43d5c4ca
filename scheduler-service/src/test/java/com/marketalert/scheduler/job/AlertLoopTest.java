package com.marketalert.scheduler.job;

import com.marketalert.common.clock.MarketClock;
import com.marketalert.common.model.AlertKind;
import com.marketalert.scheduler.dispatch.AlertDispatcher;
import com.marketalert.scheduler.state.AlertState;
import com.marketalert.scheduler.support.RecordingNotifier;
import com.marketalert.scheduler.support.TestState;
import com.marketalert.scheduler.task.AlertTask;
import com.marketalert.scheduler.task.HeartbeatTask;
import com.marketalert.scheduler.task.MarketStateTask;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class AlertLoopTest {

    private static final Instant OPEN_TIME = Instant.parse("2024-03-05T15:00:00Z");
    private static final Instant CLOSED_TIME = Instant.parse("2024-03-09T15:00:00Z");

    private final RecordingNotifier notifier = new RecordingNotifier();
    private final AlertDispatcher dispatcher = new AlertDispatcher(notifier);
    private final AlertState state = TestState.fresh();
    private final List<String> executions = new ArrayList<>();

    /** Task that records its runs and returns whatever the supplier builds. */
    private final class ProbeTask implements AlertTask {
        private final String name;
        private final Supplier<Mono<Integer>> body;

        ProbeTask(String name, Supplier<Mono<Integer>> body) {
            this.name = name;
            this.body = body;
        }

        ProbeTask(String name) {
            this(name, () -> Mono.just(0));
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Mono<Integer> run(Instant now) {
            executions.add(name);
            return body.get();
        }
    }

    private AlertLoop loop(TaskTable table, Duration taskTimeout) {
        return new AlertLoop(table, state, dispatcher, Clock.fixed(OPEN_TIME, ZoneOffset.UTC),
                             Duration.ofMillis(10), taskTimeout);
    }

    private static ScheduledTask row(AlertTask task, long intervalSeconds, TaskGate gate, Instant firstDue) {
        return new ScheduledTask(task, Duration.ofSeconds(intervalSeconds), gate, firstDue);
    }

    @Nested
    @DisplayName("gating")
    class Gating {

        @Test
        @DisplayName("open-gated tasks are skipped while closed, closed-gated tasks run")
        void closedMarket() {
            TaskTable table = new TaskTable()
                .register(row(new ProbeTask("scan"), 30, TaskGate.MARKET_OPEN, CLOSED_TIME))
                .register(row(new ProbeTask("heartbeat"), 300, TaskGate.MARKET_CLOSED, CLOSED_TIME))
                .register(row(new ProbeTask("housekeeping"), 600, TaskGate.ALWAYS, CLOSED_TIME));

            int executed = loop(table, Duration.ofSeconds(1)).tick(CLOSED_TIME);

            assertEquals(2, executed);
            assertEquals(List.of("heartbeat", "housekeeping"), executions);
        }

        @Test
        @DisplayName("the market recheck runs first so gated tasks see fresh state in the same tick")
        void recheckFirst() {
            MarketClock clock = new MarketClock(ZoneId.of("America/New_York"), 6, 18);
            TaskTable table = new TaskTable()
                .register(row(new MarketStateTask(clock, state, dispatcher), 60, TaskGate.ALWAYS, OPEN_TIME))
                .register(row(new ProbeTask("scan"), 30, TaskGate.MARKET_OPEN, OPEN_TIME))
                .register(row(new ProbeTask("heartbeat"), 300, TaskGate.MARKET_CLOSED, OPEN_TIME));

            loop(table, Duration.ofSeconds(1)).tick(OPEN_TIME);

            assertEquals(List.of("scan"), executions);
            assertEquals(List.of(AlertKind.STARTUP), notifier.kinds());
        }
    }

    @Nested
    @DisplayName("cadence")
    class Cadence {

        @Test
        void runsOnlyWhenDue() {
            TaskTable table = new TaskTable()
                .register(row(new ProbeTask("fast"), 30, TaskGate.ALWAYS, OPEN_TIME))
                .register(row(new ProbeTask("slow"), 180, TaskGate.ALWAYS, OPEN_TIME));
            AlertLoop loop = loop(table, Duration.ofSeconds(1));

            loop.tick(OPEN_TIME);
            loop.tick(OPEN_TIME.plusSeconds(1));
            loop.tick(OPEN_TIME.plusSeconds(30));
            loop.tick(OPEN_TIME.plusSeconds(180));

            assertEquals(List.of("fast", "slow", "fast", "fast", "slow"), executions);
            assertEquals(OPEN_TIME.plusSeconds(210), table.rows().get(0).nextDue());
        }

        @Test
        @DisplayName("an overrun restarts the cadence instead of firing back-to-back")
        void overrunDoesNotBurst() {
            TaskTable table = new TaskTable().register(row(new ProbeTask("fast"), 30, TaskGate.ALWAYS, OPEN_TIME));
            AlertLoop loop = loop(table, Duration.ofSeconds(1));

            loop.tick(OPEN_TIME.plusSeconds(95));
            loop.tick(OPEN_TIME.plusSeconds(96));

            assertEquals(List.of("fast"), executions);
            assertEquals(OPEN_TIME.plusSeconds(125), table.rows().get(0).nextDue());
        }

        @Test
        void gatedTasksStillAdvance() {
            TaskTable table = new TaskTable().register(row(new ProbeTask("scan"), 30, TaskGate.MARKET_OPEN, CLOSED_TIME));

            loop(table, Duration.ofSeconds(1)).tick(CLOSED_TIME);

            assertTrue(executions.isEmpty());
            assertEquals(CLOSED_TIME.plusSeconds(30), table.nextDeadline().orElseThrow());
        }
    }

    @Nested
    @DisplayName("failure isolation")
    class FailureIsolation {

        @Test
        @DisplayName("a failing task is reported and later tasks in the same tick still run")
        void errorSignal() {
            TaskTable table = new TaskTable()
                .register(row(new ProbeTask("broken", () -> Mono.error(new IllegalStateException("feed exploded"))),
                              30, TaskGate.ALWAYS, OPEN_TIME))
                .register(row(new ProbeTask("healthy"), 30, TaskGate.ALWAYS, OPEN_TIME));

            int executed = loop(table, Duration.ofSeconds(1)).tick(OPEN_TIME);

            assertEquals(2, executed);
            assertEquals(List.of("broken", "healthy"), executions);
            assertEquals(List.of(AlertKind.ERROR), notifier.kinds());
            assertEquals("💥 Task broken failed: feed exploded", notifier.sent().get(0).text());
        }

        @Test
        @DisplayName("a task throwing before it returns a Mono is contained too")
        void synchronousThrow() {
            TaskTable table = new TaskTable()
                .register(row(new ProbeTask("thrower", () -> { throw new IllegalArgumentException("bad row"); }),
                              30, TaskGate.ALWAYS, OPEN_TIME))
                .register(row(new ProbeTask("healthy"), 30, TaskGate.ALWAYS, OPEN_TIME));

            loop(table, Duration.ofSeconds(1)).tick(OPEN_TIME);

            assertEquals(List.of("thrower", "healthy"), executions);
            assertEquals(1, notifier.count(AlertKind.ERROR));
        }

        @Test
        @DisplayName("a hung task is cut off by the task timeout")
        void timeout() {
            TaskTable table = new TaskTable()
                .register(row(new ProbeTask("hung", Mono::never), 30, TaskGate.ALWAYS, OPEN_TIME))
                .register(row(new ProbeTask("healthy"), 30, TaskGate.ALWAYS, OPEN_TIME));

            assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> loop(table, Duration.ofMillis(100)).tick(OPEN_TIME));

            assertEquals(List.of("hung", "healthy"), executions);
            assertEquals(List.of(AlertKind.ERROR), notifier.kinds());
            assertTrue(notifier.sent().get(0).text().startsWith("💥 Task hung failed: "));
        }

        @Test
        @DisplayName("a dead notifier does not break the loop")
        void notifierDown() {
            AlertDispatcher failingDispatcher = new AlertDispatcher((text, kind) -> Mono.error(new RuntimeException("down")));
            TaskTable table = new TaskTable()
                .register(row(new ProbeTask("broken", () -> Mono.error(new IllegalStateException("x"))),
                              30, TaskGate.ALWAYS, OPEN_TIME));
            AlertLoop loop = new AlertLoop(table, TestState.fresh(), failingDispatcher,
                                           Clock.fixed(OPEN_TIME, ZoneOffset.UTC), Duration.ofMillis(10), Duration.ofSeconds(1));

            assertDoesNotThrow(() -> loop.tick(OPEN_TIME));
        }
    }

    @Test
    @DisplayName("a weekend heartbeat reports every loop tick, not only open-market scans")
    void closedMarketHeartbeatCountsTicks() {
        TaskTable table = new TaskTable()
            .register(row(new HeartbeatTask(state, dispatcher), 300, TaskGate.MARKET_CLOSED, CLOSED_TIME.plusSeconds(300)));
        AlertLoop loop = loop(table, Duration.ofSeconds(1));

        for (int second = 0; second <= 300; second++) {
            loop.tick(CLOSED_TIME.plusSeconds(second));
        }

        assertEquals(301, state.loopTicks());
        assertEquals(0, state.primaryScans());
        assertEquals(List.of(AlertKind.HEARTBEAT), notifier.kinds());
        assertTrue(notifier.sent().get(0).text().endsWith("Scans: 301"));
    }

    @Test
    void duplicateTaskNamesAreRejected() {
        TaskTable table = new TaskTable().register(row(new ProbeTask("scan"), 30, TaskGate.ALWAYS, OPEN_TIME));
        assertThrows(IllegalArgumentException.class,
            () -> table.register(row(new ProbeTask("scan"), 60, TaskGate.ALWAYS, OPEN_TIME)));
    }

    @Test
    void nonPositiveIntervalIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new ScheduledTask(new ProbeTask("zero"), Duration.ZERO, TaskGate.ALWAYS, OPEN_TIME));
    }
}
