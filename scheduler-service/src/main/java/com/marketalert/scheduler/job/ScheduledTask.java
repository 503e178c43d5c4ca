package com.marketalert.scheduler.job;

import com.marketalert.scheduler.task.AlertTask;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One row of the task table. Only the loop thread touches {@code nextDue}.
 */
public final class ScheduledTask {

    private final AlertTask task;
    private final Duration interval;
    private final TaskGate gate;
    private Instant nextDue;

    public ScheduledTask(AlertTask task, Duration interval, TaskGate gate, Instant firstDue) {
        this.task     = Objects.requireNonNull(task, "task");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.gate     = Objects.requireNonNull(gate, "gate");
        this.nextDue  = Objects.requireNonNull(firstDue, "firstDue");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive for task " + task.name() + ": " + interval);
        }
    }

    public String name() {
        return task.name();
    }

    public AlertTask task() {
        return task;
    }

    public Duration interval() {
        return interval;
    }

    public TaskGate gate() {
        return gate;
    }

    public Instant nextDue() {
        return nextDue;
    }

    public boolean isDue(Instant now) {
        return !now.isBefore(nextDue);
    }

    /**
     * Advances to the next slot on the original cadence. A task that overran a whole interval
     * restarts its cadence from {@code now} instead of firing back-to-back to catch up.
     */
    void advance(Instant now) {
        Instant candidate = nextDue.plus(interval);
        nextDue = candidate.isAfter(now) ? candidate : now.plus(interval);
    }
}
