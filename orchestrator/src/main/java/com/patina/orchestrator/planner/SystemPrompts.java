package com.patina.orchestrator.planner;

import com.patina.orchestrator.policy.CapabilityManifest;
import com.patina.orchestrator.policy.ManifestEntry;
import com.patina.orchestrator.sandbox.SandboxEngineRegistry;
import com.patina.orchestrator.tool.ToolServerRegistry;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Prompts sent to the completion client.
 *
 * The tool catalogue is generated from the live engine and tool server
 * registries plus the run's manifest, so the model only ever sees tools
 * the run could actually use.
 */
@Component
public class SystemPrompts {

    private final SandboxEngineRegistry engines;
    private final ToolServerRegistry    servers;

    public SystemPrompts(SandboxEngineRegistry engines, ToolServerRegistry servers) {
        this.engines = engines;
        this.servers = servers;
    }

    public String planner(CapabilityManifest manifest) {
        return PLANNER_PROMPT.replace("{{CATALOGUE}}", catalogue(manifest));
    }

    public String replanner(CapabilityManifest manifest) {
        return REPLANNER_PROMPT.replace("{{CATALOGUE}}", catalogue(manifest));
    }

    String catalogue(CapabilityManifest manifest) {
        StringBuilder sb = new StringBuilder(engines.describeCapabilities());
        sb.append("TOOL SERVERS:\n");
        servers.servers().forEach(s -> sb.append("  ").append(s.uriPrefix()).append("* (")
                .append(s.versionLabel()).append(")\n"));
        sb.append("ALLOWED TOOLS: ")
                .append(manifest.allow().stream().map(ManifestEntry::pattern).collect(Collectors.joining(", ")))
                .append("\n");
        if (!manifest.deny().isEmpty()) {
            sb.append("DENIED TOOLS: ")
                    .append(manifest.deny().stream().map(ManifestEntry::pattern).collect(Collectors.joining(", ")))
                    .append("\n");
        }
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Prompts  ({{CATALOGUE}} is replaced per run)
    // ------------------------------------------------------------------

    private static final String STEP_FORMAT = """
            Each step is one of:
              tool step:   {"id": "fetch", "tool": "mcp://fs.read", "args": {"path": "a.txt"},
                            "state_key": "file", "depends_on": [], "idempotent": true}
              script step: {"id": "count", "code": "<JavaScript function body>", "params": {},
                            "tools": [], "depends_on": ["fetch"], "mutating": false}

            A script is the body of function (input, tools, log). input.params holds the
            step's params; input.deps[id] holds {summary, state_updates} of each dependency.
            Call tools only with tools.call(uri, args) and only for URIs listed in "tools".
            Return a string, or {summary, state_updates, artifacts: [{content_type, content}]}.
            Mark a step "mutating" when its state_updates change anything outside the run;
            it will wait for operator approval. No imports, no eval, no Function constructor.
            """;

    private static final String PLANNER_PROMPT = """
            You are the planner of a sandboxed task orchestrator.

            YOUR GOAL: turn the operator's goal into a small DAG of steps.

            {{CATALOGUE}}
            """ + STEP_FORMAT + """

            Use the fewest steps that satisfy the goal. Use only allowed tools.
            Write the plan as JSON inside <plan>...</plan>:
              <plan>{"steps": [ ... ]}</plan>
            """;

    private static final String REPLANNER_PROMPT = """
            You are the planner of a sandboxed task orchestrator. A step of the current
            plan failed. Propose replacement steps for the remaining work only.

            {{CATALOGUE}}
            """ + STEP_FORMAT + """

            Completed steps may be used as dependencies by their ids; do not repeat them.
            Use new ids. If the goal cannot be reached another way, return no steps.
            Write the plan as JSON inside <plan>...</plan>:
              <plan>{"steps": [ ... ]}</plan>
            """;
}
