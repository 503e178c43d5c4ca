package com.marketalert.common.ledger;

import com.marketalert.common.model.AlertKey;
import com.marketalert.common.model.AlertKind;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Per (symbol, kind) last-fired timestamps enforcing a minimum re-alert interval.
 *
 * <p>{@link #allow} is a side-effecting gate: a {@code true} result has already recorded
 * {@code now} and authorises exactly one dispatch; a {@code false} result leaves the ledger
 * untouched. Callers must invoke it once per candidate firing and do nothing else on
 * {@code false}.
 *
 * <p>Guarded by a single coarse lock. Alert volumes are human-scale so contention is
 * negligible.
 */
public class CooldownLedger {

    private final Duration cooldown;
    private final Map<AlertKey, Instant> lastFired = new HashMap<>();

    public CooldownLedger(Duration cooldown) {
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative: " + cooldown);
        }
        this.cooldown = cooldown;
    }

    /**
     * @return {@code true} and records {@code now} when no firing of this key lies within the
     *         cooldown window; {@code false} without mutation otherwise
     */
    public synchronized boolean allow(String symbol, AlertKind kind, Instant now) {
        AlertKey key = new AlertKey(symbol, kind);
        Instant prior = lastFired.get(key);
        if (prior != null && Duration.between(prior, now).compareTo(cooldown) < 0) {
            return false;
        }
        lastFired.put(key, now);
        return true;
    }

    /**
     * Drops entries whose cooldown has fully elapsed. Such entries can no longer suppress
     * anything, so pruning never changes an {@link #allow} outcome.
     *
     * @return number of entries removed
     */
    public synchronized int pruneExpired(Instant now) {
        int before = lastFired.size();
        lastFired.values().removeIf(fired -> Duration.between(fired, now).compareTo(cooldown) >= 0);
        return before - lastFired.size();
    }

    public synchronized int size() {
        return lastFired.size();
    }

    public Duration cooldown() {
        return cooldown;
    }
}
