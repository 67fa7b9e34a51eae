package com.patina.orchestrator.executor;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator decisions for the APPROVAL nodes of one run.
 *
 * A decision may arrive before the executor reaches the node; it is kept
 * until the node waits for it. Only the first decision per node counts.
 */
public class ApprovalGate {

    private final Map<String, CompletableFuture<Boolean>> decisions = new ConcurrentHashMap<>();

    /** Declare an approval node so decisions for it are accepted. */
    public void expect(String nodeId) {
        decisions.putIfAbsent(nodeId, new CompletableFuture<>());
    }

    public boolean isExpected(String nodeId) {
        return decisions.containsKey(nodeId);
    }

    /**
     * @return false when {@code nodeId} is not an approval node of this run
     */
    public boolean decide(String nodeId, boolean approved) {
        CompletableFuture<Boolean> decision = decisions.get(nodeId);
        if (decision == null) {
            return false;
        }
        decision.complete(approved);
        return true;
    }

    /** Completes with true (approved) or false (rejected). */
    CompletableFuture<Boolean> awaiting(String nodeId) {
        return decisions.computeIfAbsent(nodeId, k -> new CompletableFuture<>());
    }

    /** Reject everything still undecided; used when the run ends. */
    void closeAll() {
        decisions.values().forEach(d -> d.complete(false));
    }
}
