package com.patina.orchestrator.policy;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Sliding-window call counters, one per manifest pattern.
 * Created fresh for every run so limits reset between runs.
 */
public class RunRateWindow {

    private final Clock clock;
    private final Map<String, Deque<Long>> calls = new HashMap<>();

    public RunRateWindow() {
        this(Clock.systemUTC());
    }

    public RunRateWindow(Clock clock) {
        this.clock = clock;
    }

    /**
     * Record one call against every pattern in {@code limits}, or against none.
     *
     * @return the first pattern whose limit is reached; empty when the call was recorded everywhere
     */
    public synchronized Optional<String> tryAcquireAll(Map<String, RateLimit> limits) {
        long now = clock.millis();
        for (Map.Entry<String, RateLimit> entry : limits.entrySet()) {
            Deque<Long> window = prune(entry.getKey(), entry.getValue(), now);
            if (window.size() >= entry.getValue().maxCalls()) {
                return Optional.of(entry.getKey());
            }
        }
        limits.keySet().forEach(pattern -> calls.get(pattern).addLast(now));
        return Optional.empty();
    }

    public synchronized int callsInWindow(String pattern) {
        Deque<Long> window = calls.get(pattern);
        return window == null ? 0 : window.size();
    }

    private Deque<Long> prune(String pattern, RateLimit limit, long now) {
        Deque<Long> window = calls.computeIfAbsent(pattern, k -> new ArrayDeque<>());
        while (!window.isEmpty() && now - window.peekFirst() >= limit.windowMs()) {
            window.pollFirst();
        }
        return window;
    }
}
