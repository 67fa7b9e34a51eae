package com.patina.orchestrator.tool;

import com.patina.orchestrator.policy.CapabilityManifest;
import com.patina.orchestrator.policy.RunRateWindow;

import java.util.List;

/**
 * Everything a tool invocation is checked against: the calling unit's
 * allowed tools, the run's manifest, rate window and call quota.
 */
public record ToolScope(
        String             runId,
        String             nodeId,
        List<String>       allowedTools,
        CapabilityManifest manifest,
        RunRateWindow      rateWindow,
        ToolCallQuota      quota) {

    public ToolScope {
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        quota        = quota == null ? ToolCallQuota.unlimited() : quota;
    }
}
