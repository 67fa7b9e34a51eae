package com.patina.orchestrator.sandbox;

import java.util.concurrent.CompletableFuture;

/**
 * One-shot cancellation message. Whoever owns a resource subscribes with
 * {@link #onCancel}; cancelling never touches the resource directly.
 */
public class CancellationSignal {

    private final CompletableFuture<Void> fired = new CompletableFuture<>();

    public void cancel() {
        fired.complete(null);
    }

    public boolean isCancelled() {
        return fired.isDone();
    }

    /** Run {@code action} once on cancellation; immediately if already cancelled. */
    public void onCancel(Runnable action) {
        fired.thenRun(action);
    }
}
