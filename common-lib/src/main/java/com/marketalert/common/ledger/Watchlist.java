package com.marketalert.common.ledger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Symbols that matched a primary bid-match rule and now get large-sale follow-up.
 *
 * <p>Entries expire {@code ttl} after their most recent insertion; expired entries are
 * hidden from {@link #snapshot} immediately and physically removed by {@link #pruneExpired}.
 * Concurrent adds and snapshot iteration are safe: the snapshot is an immutable copy.
 */
public class Watchlist {

    private final Duration ttl;
    private final ConcurrentHashMap<String, Instant> addedAt = new ConcurrentHashMap<>();

    public Watchlist(Duration ttl) {
        this.ttl = ttl;
    }

    /**
     * Adds or refreshes {@code symbol}.
     *
     * @return {@code true} if the symbol was not already being watched
     */
    public boolean add(String symbol, Instant now) {
        Instant previous = addedAt.put(symbol, now);
        return previous == null || isExpired(previous, now);
    }

    public boolean contains(String symbol, Instant now) {
        Instant added = addedAt.get(symbol);
        return added != null && !isExpired(added, now);
    }

    /** Live symbols in alphabetical order. */
    public List<String> snapshot(Instant now) {
        return addedAt.entrySet().stream()
            .filter(e -> !isExpired(e.getValue(), now))
            .map(Map.Entry::getKey)
            .sorted()
            .toList();
    }

    /** @return number of entries removed */
    public int pruneExpired(Instant now) {
        int before = addedAt.size();
        addedAt.entrySet().removeIf(e -> isExpired(e.getValue(), now));
        return before - addedAt.size();
    }

    public int size() {
        return addedAt.size();
    }

    private boolean isExpired(Instant added, Instant now) {
        return !ttl.isZero() && !ttl.isNegative() && Duration.between(added, now).compareTo(ttl) >= 0;
    }
}
