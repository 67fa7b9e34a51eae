package com.patina.orchestrator.tool;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Run-wide tool call counter shared by every node of one run.
 */
public class ToolCallQuota {

    private final int           max;
    private final AtomicInteger used = new AtomicInteger();

    public ToolCallQuota(int max) {
        this.max = max;
    }

    public static ToolCallQuota unlimited() {
        return new ToolCallQuota(Integer.MAX_VALUE);
    }

    /** Take one call; false (and nothing taken) when the quota is spent. */
    public boolean tryAcquire() {
        while (true) {
            int current = used.get();
            if (current >= max) {
                return false;
            }
            if (used.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public int used() { return used.get(); }

    public int max() { return max; }

    public boolean exhausted() { return used.get() >= max; }
}
