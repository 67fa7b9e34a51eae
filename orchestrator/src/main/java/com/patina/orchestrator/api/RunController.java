package com.patina.orchestrator.api;

import com.patina.orchestrator.api.dto.ApprovalRequest;
import com.patina.orchestrator.api.dto.RunResponse;
import com.patina.orchestrator.api.dto.StartRunRequest;
import com.patina.orchestrator.model.RunSummary;
import com.patina.orchestrator.service.Orchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for run lifecycle.
 *
 * POST /runs                            : start a run for a goal
 * GET  /runs/{id}                       : final summary (200) or live view (202)
 * POST /runs/{id}/cancel                : cancel a run in flight
 * POST /runs/{id}/approvals/{nodeId}    : approve or reject a write
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final Orchestrator orchestrator;

    public RunController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Start a run.
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"goal":"count the lines of a.txt","constraints":{"run_budget":{"max_nodes":8,
     *          "wall_clock_ms":60000,"max_tool_calls":16,"max_concurrency":2}}}'
     */
    @PostMapping
    public ResponseEntity<RunResponse> start(@RequestBody StartRunRequest req) {
        if (req.goal() == null || req.goal().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "goal is required");
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(RunResponse.from(orchestrator.start(req.goal(), req.constraints())));
    }

    /**
     * HTTP 200 : run finished; body is the RunSummary
     * HTTP 202 : run still planning or running; body is the live view
     * HTTP 404 : run ID not found
     */
    @GetMapping("/{id}")
    public ResponseEntity<RunSummary> get(@PathVariable String id) {
        RunSummary summary = orchestrator.status(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id));
        return summary.status().isTerminal()
                ? ResponseEntity.ok(summary)
                : ResponseEntity.accepted().body(summary);
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable String id) {
        if (!orchestrator.cancel(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No run in flight: " + id);
        }
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{id}/approvals/{nodeId}")
    public ResponseEntity<Void> decide(@PathVariable String id,
                                       @PathVariable String nodeId,
                                       @RequestBody ApprovalRequest req) {
        if (!orchestrator.decide(id, nodeId, req.approved())) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND,
                    "No pending approval " + nodeId + " in run " + id);
        }
        return ResponseEntity.accepted().build();
    }
}
