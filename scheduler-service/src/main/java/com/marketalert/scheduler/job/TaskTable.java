package com.marketalert.scheduler.job;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered task rows. Registration order is execution order within a tick, so the
 * market-state recheck goes first and gated tasks see the state it just computed.
 */
public final class TaskTable {

    private final List<ScheduledTask> rows = new ArrayList<>();

    public TaskTable register(ScheduledTask row) {
        boolean duplicate = rows.stream().anyMatch(r -> r.name().equals(row.name()));
        if (duplicate) {
            throw new IllegalArgumentException("Task already registered: " + row.name());
        }
        rows.add(row);
        return this;
    }

    public List<ScheduledTask> rows() {
        return Collections.unmodifiableList(rows);
    }

    public Optional<Instant> nextDeadline() {
        return rows.stream().map(ScheduledTask::nextDue).min(Instant::compareTo);
    }

    public int size() {
        return rows.size();
    }
}
