package com.marketalert.scheduler.job;

import com.marketalert.common.exception.AlertException;
import com.marketalert.common.format.AlertMessageFormatter;
import com.marketalert.common.model.AlertKind;
import com.marketalert.common.model.MarketState;
import com.marketalert.scheduler.dispatch.AlertDispatcher;
import com.marketalert.scheduler.state.AlertState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * The cooperative scheduling loop: wake, run every due task in table order, sleep until the
 * next deadline (never longer than one tick), repeat.
 *
 * <p>Each task body is bounded by the task timeout and isolated: a failure or timeout is
 * logged, reported as a best-effort {@link AlertKind#ERROR} notice, and the remaining due
 * tasks of the same tick still run. An error escaping the loop body itself is reported the
 * same way and the loop continues.
 */
public class AlertLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(AlertLoop.class);

    private final TaskTable table;
    private final AlertState state;
    private final AlertDispatcher dispatcher;
    private final Clock clock;
    private final Duration tick;
    private final Duration taskTimeout;

    private volatile boolean running;
    private volatile boolean stopRequested;

    public AlertLoop(TaskTable table, AlertState state, AlertDispatcher dispatcher,
                     Clock clock, Duration tick, Duration taskTimeout) {
        this.table       = table;
        this.state       = state;
        this.dispatcher  = dispatcher;
        this.clock       = clock;
        this.tick        = tick;
        this.taskTimeout = taskTimeout;
    }

    @Override
    public void run() {
        running = true;
        log.info("ALERT_LOOP_STARTED tasks={} tickMillis={} taskTimeoutSeconds={}",
                 table.size(), tick.toMillis(), taskTimeout.toSeconds());
        while (!stopRequested) {
            try {
                tick(clock.instant());
                sleepUntilNextDeadline();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("ALERT_LOOP_INTERRUPTED");
                break;
            } catch (RuntimeException e) {
                log.error("Alert loop iteration crashed. Continuing with next tick.", e);
                notifyFailure("alert-loop", e);
            }
        }
        running = false;
        log.info("ALERT_LOOP_STOPPED");
    }

    /** Requests termination; the loop exits after the current task. A stopped loop cannot be restarted. */
    public void stop() {
        stopRequested = true;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Counts one loop tick, then runs every task due at {@code now} whose gate admits the
     * current market state.
     *
     * @return number of task bodies executed, failed ones included
     */
    public int tick(Instant now) {
        state.recordLoopTick();
        int executed = 0;
        for (ScheduledTask row : table.rows()) {
            if (!row.isDue(now)) {
                continue;
            }
            row.advance(now);
            MarketState marketState = state.session().state();
            if (!row.gate().permits(marketState)) {
                log.debug("TASK_GATED task={} gate={} state={}", row.name(), row.gate(), marketState);
                continue;
            }
            execute(row, now);
            executed++;
        }
        return executed;
    }

    private void execute(ScheduledTask row, Instant now) {
        long started = System.nanoTime();
        try {
            Integer alerts = row.task().run(now).block(taskTimeout);
            log.debug("TASK_COMPLETE task={} alerts={} elapsedMillis={}",
                      row.name(), alerts == null ? 0 : alerts, (System.nanoTime() - started) / 1_000_000);
        } catch (RuntimeException e) {
            AlertException failure = new AlertException(row.name(), describe(e), e);
            log.error("TASK_FAILED task={} elapsedMillis={}", row.name(),
                      (System.nanoTime() - started) / 1_000_000, failure);
            if (!stopRequested) {
                notifyFailure(row.name(), e);
            }
        }
    }

    private void notifyFailure(String taskName, Throwable error) {
        try {
            dispatcher.dispatch(AlertKind.ERROR, taskName, AlertMessageFormatter.error(taskName, error))
                .block(taskTimeout);
        } catch (RuntimeException e) {
            log.warn("Error notice could not be sent. task={} reason={}", taskName, e.toString());
        }
    }

    private void sleepUntilNextDeadline() throws InterruptedException {
        Instant now = clock.instant();
        Duration wait = table.nextDeadline()
            .map(deadline -> Duration.between(now, deadline))
            .filter(d -> d.compareTo(tick) < 0)
            .orElse(tick);
        long millis = wait.toMillis();
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : message;
    }
}
