package com.patina.orchestrator.policy;

import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.model.ExecutionUnit;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fail-closed capability check for every tool call and write.
 *
 * <p>Decision order:
 * <ol>
 *   <li>A deny entry without qualifiers matching the URI denies outright.</li>
 *   <li>No matching allow entry denies.</li>
 *   <li>Every write field must be granted by a {@code write:<field>} qualifier
 *       of a matching allow entry and not named by a matching deny entry.</li>
 *   <li>If the request consumes rate budget, every matching allow entry's
 *       rate limit must have room in the run's window.</li>
 * </ol>
 *
 * Stateless apart from metrics; the rate window belongs to the run.
 */
@Component
public class PolicyGate {

    private static final Logger log = LoggerFactory.getLogger(PolicyGate.class);

    private final MeterRegistry meterRegistry;

    public PolicyGate(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public PolicyDecision decide(CapabilityRequest request, CapabilityManifest manifest, RunRateWindow window) {
        PolicyDecision decision = evaluate(request, manifest, window);
        meterRegistry.counter("patina.policy.decisions",
                "decision", decision.allowed() ? "allow" : "deny").increment();
        if (!decision.allowed()) {
            log.info("Policy denied {}: {}", request.toolUri(), decision.reason());
        }
        return decision;
    }

    /** Like {@link #decide}, but a denial is thrown as POLICY/&lt;code&gt;. */
    public void require(CapabilityRequest request, CapabilityManifest manifest, RunRateWindow window) {
        PolicyDecision decision = decide(request, manifest, window);
        if (!decision.allowed()) {
            throw OrchestratorException.policy(decision.code(), decision.reason());
        }
    }

    /**
     * Static check of a unit before dispatch: every entry of its
     * {@code allowedTools} must be allowed by the manifest. Spends no rate budget.
     */
    public void checkUnit(ExecutionUnit unit, CapabilityManifest manifest) {
        for (String tool : unit.allowedTools()) {
            require(CapabilityRequest.staticCheck(tool), manifest, null);
        }
    }

    /**
     * Runtime check of one call made by a unit: the URI must be among the
     * unit's {@code allowedTools} and the manifest must allow it.
     */
    public void checkCall(String toolUri, Collection<String> unitAllowedTools,
                          CapabilityManifest manifest, RunRateWindow window) {
        if (!ToolPatterns.matchesAny(unitAllowedTools, toolUri)) {
            meterRegistry.counter("patina.policy.decisions", "decision", "deny").increment();
            throw OrchestratorException.policy(ErrorCodes.CAPABILITY_DENIED,
                    toolUri + " is not in the unit's allowed tools");
        }
        require(CapabilityRequest.call(toolUri), manifest, window);
    }

    // ------------------------------------------------------------------
    // Evaluation
    // ------------------------------------------------------------------

    private PolicyDecision evaluate(CapabilityRequest request, CapabilityManifest manifest, RunRateWindow window) {
        String uri = request.toolUri();
        if (manifest == null) {
            return PolicyDecision.deny("no capability manifest loaded");
        }
        var fullDeny = manifest.fullDeny(uri);
        if (fullDeny.isPresent()) {
            return PolicyDecision.deny(uri + " denied by '" + fullDeny.get().pattern() + "'");
        }
        List<ManifestEntry> allows = manifest.allowEntries(uri);
        if (allows.isEmpty()) {
            return PolicyDecision.deny("no allow entry matches " + uri);
        }

        List<ManifestEntry> denies = manifest.denyEntries(uri);
        for (String field : request.writeFields()) {
            if (denies.stream().anyMatch(d -> d.grantsWrite(field))) {
                return PolicyDecision.deny("write to '" + field + "' on " + uri + " is denied");
            }
            if (allows.stream().noneMatch(a -> a.grantsWrite(field))) {
                return PolicyDecision.deny("write to '" + field + "' on " + uri + " is not granted");
            }
        }

        if (request.consumeRate() && window != null) {
            Map<String, RateLimit> limits = new LinkedHashMap<>();
            for (ManifestEntry entry : allows) {
                if (entry.rateLimit() != null) {
                    limits.putIfAbsent(entry.pattern(), entry.rateLimit());
                }
            }
            Optional<String> full = window.tryAcquireAll(limits);
            if (full.isPresent()) {
                RateLimit limit = limits.get(full.get());
                return PolicyDecision.rateLimited("rate limit of %d calls per %d ms exceeded for '%s'"
                        .formatted(limit.maxCalls(), limit.windowMs(), full.get()));
            }
        }
        return PolicyDecision.allow("allowed by '" + allows.get(0).pattern() + "'");
    }
}
