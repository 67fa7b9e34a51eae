package com.patina.orchestrator.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BinaryOperator;

/**
 * Concurrent key/value store with a time-to-live and an entry cap.
 *
 * Expired entries are dropped when read. Once the cap is passed the oldest
 * writes are evicted first. A rewrite of a key refreshes its age.
 */
public final class BoundedStore<V> {

    private record Stamped<V>(V value, Instant storedAt, long seq) {}

    private final Map<String, Stamped<V>> entries = new ConcurrentHashMap<>();
    private final AtomicLong              seqs    = new AtomicLong();
    private final int                     maxEntries;
    private final Duration                ttl;
    private final Clock                   clock;

    public BoundedStore(int maxEntries, Duration ttl, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.maxEntries = maxEntries;
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<V> get(String key) {
        Stamped<V> stamped = entries.get(key);
        if (stamped == null) {
            return Optional.empty();
        }
        if (expired(stamped)) {
            entries.remove(key, stamped);
            return Optional.empty();
        }
        return Optional.of(stamped.value());
    }

    /** Store {@code value}, combining with a live entry through {@code merger}. */
    public void merge(String key, V value, BinaryOperator<V> merger) {
        long seq = seqs.incrementAndGet();
        Instant now = clock.instant();
        entries.compute(key, (k, previous) -> previous == null || expired(previous)
                ? new Stamped<>(value, now, seq)
                : new Stamped<>(merger.apply(previous.value(), value), now, seq));
        evictOverflow();
    }

    public void remove(String key, V value) {
        entries.computeIfPresent(key, (k, stamped) -> stamped.value() == value ? null : stamped);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    private void evictOverflow() {
        while (entries.size() > maxEntries) {
            Map.Entry<String, Stamped<V>> oldest = null;
            for (Map.Entry<String, Stamped<V>> entry : entries.entrySet()) {
                if (oldest == null || entry.getValue().seq() < oldest.getValue().seq()) {
                    oldest = entry;
                }
            }
            if (oldest == null) {
                return;
            }
            entries.remove(oldest.getKey(), oldest.getValue());
        }
    }

    private boolean expired(Stamped<V> stamped) {
        return ttl != null && !ttl.isZero() && stamped.storedAt().plus(ttl).isBefore(clock.instant());
    }
}
