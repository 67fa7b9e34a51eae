package com.patina.orchestrator.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.patina.orchestrator.artifact.ArtifactStore;
import com.patina.orchestrator.artifact.EnvelopeSizer;
import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.error.Redactor;
import com.patina.orchestrator.model.ArtifactHandle;
import com.patina.orchestrator.model.Budget;
import com.patina.orchestrator.model.EngineKind;
import com.patina.orchestrator.model.ErrorKind;
import com.patina.orchestrator.model.ExecutionMetrics;
import com.patina.orchestrator.model.ExecutionUnit;
import com.patina.orchestrator.model.OrchestratorError;
import com.patina.orchestrator.model.ResultEnvelope;
import com.patina.orchestrator.sandbox.worker.WorkerMessage;
import com.patina.orchestrator.tool.ToolResult;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Runs SCRIPT units in short-lived worker JVMs.
 *
 * <p>Per execution:
 * <ol>
 *   <li>static pre-check of the source;</li>
 *   <li>a worker slot from the global {@code patina.sandbox.max-workers} semaphore;</li>
 *   <li>a fresh worker process in a private temp dir, handed to the watchdog;</li>
 *   <li>the {@code run} message, then a loop answering {@code tool_call}s until
 *       {@code result} or {@code error} arrives;</li>
 *   <li>artifacts stored, envelope sized, worker reaped, temp dir removed.</li>
 * </ol>
 *
 * Tool calls from the script go through the invocation's bound ToolInvoker,
 * which applies the PolicyGate before anything reaches a tool server.
 */
@Component
public class ScriptWorkerEngine implements SandboxEngine {

    private static final Logger log = LoggerFactory.getLogger(ScriptWorkerEngine.class);

    private static final int STDERR_TAIL_BYTES = 2048;

    private final WorkerLauncher launcher;
    private final StaticPrecheck precheck;
    private final ArtifactStore  artifactStore;
    private final EnvelopeSizer  envelopeSizer;
    private final ObjectMapper   json;
    private final Watchdog       watchdog = new Watchdog("patina-watchdog");
    private final Semaphore      slots;
    private final int            maxWorkers;
    private final int            maxMessageChars;
    private final Set<String>    capabilities;
    private final AtomicInteger  active = new AtomicInteger();

    public ScriptWorkerEngine(WorkerLauncher launcher,
                              StaticPrecheck precheck,
                              ArtifactStore artifactStore,
                              EnvelopeSizer envelopeSizer,
                              ObjectMapper objectMapper,
                              MeterRegistry meterRegistry,
                              @Value("${patina.sandbox.max-workers:4}") int maxWorkers,
                              @Value("${patina.sandbox.max-message-bytes:8388608}") int maxMessageChars,
                              @Value("${patina.sandbox.capabilities:mcp://*}") List<String> capabilities) {
        this.launcher        = launcher;
        this.precheck        = precheck;
        this.artifactStore   = artifactStore;
        this.envelopeSizer   = envelopeSizer;
        this.json            = objectMapper;
        this.maxWorkers      = maxWorkers;
        this.slots           = new Semaphore(maxWorkers, true);
        this.maxMessageChars = maxMessageChars;
        this.capabilities    = Set.copyOf(new LinkedHashSet<>(capabilities));
        Gauge.builder("patina.sandbox.workers.active", active, AtomicInteger::get)
                .register(meterRegistry);
    }

    @Override
    public EngineKind kind() {
        return EngineKind.SCRIPT;
    }

    @Override
    public Set<String> capabilities() {
        return capabilities;
    }

    @Override
    public SandboxHealth health() {
        boolean live = launcher.javaAvailable();
        return new SandboxHealth(EngineKind.SCRIPT, live, active.get(), slots.availablePermits(),
                live ? "worker JVM " + launcher.javaBinary() : "java binary not executable: " + launcher.javaBinary());
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    @Override
    public ResultEnvelope execute(ExecutionUnit unit, SandboxInvocation invocation) {
        precheck.require(unit.code());
        if (invocation.cancel().isCancelled()) {
            throw cancelled();
        }
        Budget budget = unit.budget();
        acquireSlot(budget, invocation);
        active.incrementAndGet();
        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("patina-worker-");
            return runWorker(unit, budget, invocation, workDir);
        } catch (IOException e) {
            throw OrchestratorException.of(ErrorKind.SANDBOX, ErrorCodes.SPAWN_FAILED,
                    "cannot start worker: " + e.getMessage(), e);
        } finally {
            active.decrementAndGet();
            slots.release();
            deleteQuietly(workDir);
        }
    }

    private ResultEnvelope runWorker(ExecutionUnit unit, Budget budget, SandboxInvocation invocation,
                                     Path workDir) throws IOException {
        Process process = launcher.launch(budget, workDir);
        log.debug("Started worker pid={} for node {}", process.pid(), invocation.nodeId());

        try (Watchdog.Watch watch = watchdog.watch(process, Duration.ofMillis(budget.wallClockMs()), invocation.cancel());
             OutputStream stdin = process.getOutputStream();
             InputStreamReader stdout = new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)) {

            BoundedLineReader reader = new BoundedLineReader(stdout, maxMessageChars);
            OrchestratorError policyFailure = null;
            try {
                write(stdin, WorkerMessage.run(unit.code(), invocation.input(), budget));
                String line;
                while ((line = reader.readLine()) != null) {
                    WorkerMessage message = parse(line, watch);
                    switch (message.type()) {
                        case WorkerMessage.TOOL_CALL -> {
                            WorkerMessage reply = callTool(message, invocation);
                            if (reply.error() != null && reply.error().kind() == ErrorKind.POLICY && policyFailure == null) {
                                policyFailure = reply.error();
                            }
                            write(stdin, reply);
                        }
                        case WorkerMessage.RESULT -> {
                            if (policyFailure != null) {
                                throw new OrchestratorException(policyFailure);
                            }
                            return envelope(message, budget);
                        }
                        case WorkerMessage.ERROR -> {
                            if (policyFailure != null) {
                                throw new OrchestratorException(policyFailure);
                            }
                            if (message.error() == null) {
                                throw crash("worker reported an error without details", workDir);
                            }
                            throw new OrchestratorException(Redactor.defaultRules().redact(message.error()));
                        }
                        default -> {
                            watch.terminate(TerminationCause.PROTOCOL_VIOLATION);
                            throw crash("unexpected message type '" + message.type() + "'", workDir);
                        }
                    }
                }
            } catch (BoundedLineReader.LineTooLongException e) {
                watch.terminate(TerminationCause.OUTPUT_OVERFLOW);
                throw OrchestratorException.budget(ErrorCodes.OUTPUT_LIMIT,
                        "worker message exceeds " + maxMessageChars + " characters");
            } catch (IOException e) {
                // broken pipe: the worker is gone, the cause below explains why
                log.debug("Worker channel closed for node {}: {}", invocation.nodeId(), e.getMessage());
            }
            throw exitWithoutResult(process, watch, budget, workDir);
        }
    }

    private WorkerMessage callTool(WorkerMessage call, SandboxInvocation invocation) {
        try {
            ToolResult result = invocation.tools().call(call.tool(), call.args() == null ? Map.of() : call.args());
            return WorkerMessage.toolResult(call.id(), result.data());
        } catch (OrchestratorException e) {
            return WorkerMessage.toolError(call.id(), e.getError());
        }
    }

    @SuppressWarnings("unchecked")
    private ResultEnvelope envelope(WorkerMessage message, Budget budget) {
        Map<String, Object> result = message.result() == null ? Map.of() : message.result();
        List<ArtifactHandle> handles = new ArrayList<>();
        Object artifacts = result.get("artifacts");
        if (artifacts instanceof List<?> list) {
            for (Object a : list) {
                Map<String, Object> artifact = (Map<String, Object>) a;
                String contentType = artifact.get("content_type") instanceof String ct ? ct : "text/plain";
                handles.add(artifactStore.put(
                        ((String) artifact.get("content")).getBytes(StandardCharsets.UTF_8), contentType));
            }
        }
        Map<String, Object> state = result.get("state_updates") instanceof Map<?, ?> m
                ? new LinkedHashMap<>((Map<String, Object>) m) : Map.of();
        String summary = result.get("summary") instanceof String s ? s : "";
        ExecutionMetrics metrics = message.metrics() == null ? ExecutionMetrics.ZERO : message.metrics();
        return envelopeSizer.fit(new ResultEnvelope(summary, handles, state, metrics), budget.maxOutputBytes());
    }

    private OrchestratorException exitWithoutResult(Process process, Watchdog.Watch watch, Budget budget, Path workDir) {
        try {
            process.waitFor(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        TerminationCause cause = watch.cause();
        if (cause == TerminationCause.WALL_CLOCK) {
            return OrchestratorException.budget(ErrorCodes.CPU_LIMIT,
                    "wall-clock limit of " + budget.wallClockMs() + " ms exceeded");
        }
        if (cause == TerminationCause.CANCELLED) {
            return cancelled();
        }
        String tail = stderrTail(workDir);
        if (tail.contains("OutOfMemoryError")) {
            return OrchestratorException.budget(ErrorCodes.MEM_LIMIT,
                    "memory limit of " + budget.memMb() + " MB exceeded");
        }
        if (!process.isAlive() && process.exitValue() == 128 + 24) {
            // SIGXCPU from ulimit -t
            return OrchestratorException.budget(ErrorCodes.CPU_LIMIT, "CPU limit exceeded");
        }
        String exit = process.isAlive() ? "still running" : "exit " + process.exitValue();
        return crash("worker ended without a result (" + exit + ")", workDir);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void acquireSlot(Budget budget, SandboxInvocation invocation) {
        try {
            if (!slots.tryAcquire(budget.wallClockMs(), TimeUnit.MILLISECONDS)) {
                throw OrchestratorException.retriable(ErrorKind.SANDBOX, ErrorCodes.ENGINE_UNAVAILABLE,
                        "all " + maxWorkers + " worker slots busy");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled();
        }
        if (invocation.cancel().isCancelled()) {
            slots.release();
            throw cancelled();
        }
    }

    private WorkerMessage parse(String line, Watchdog.Watch watch) {
        try {
            WorkerMessage message = json.readValue(line, WorkerMessage.class);
            if (message.type() == null) {
                throw new IllegalArgumentException("message without type");
            }
            return message;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            watch.terminate(TerminationCause.PROTOCOL_VIOLATION);
            throw OrchestratorException.of(ErrorKind.SANDBOX, ErrorCodes.PROC_CRASH,
                    "worker sent an invalid protocol message");
        }
    }

    private void write(OutputStream stdin, WorkerMessage message) throws IOException {
        stdin.write(json.writeValueAsBytes(message));
        stdin.write('\n');
        stdin.flush();
    }

    private OrchestratorException crash(String message, Path workDir) {
        String tail = stderrTail(workDir);
        if (!tail.isBlank()) {
            log.warn("Worker crash: {} | stderr tail: {}", message, Redactor.defaultRules().redact(tail));
        }
        return OrchestratorException.of(ErrorKind.SANDBOX, ErrorCodes.PROC_CRASH, message);
    }

    private static OrchestratorException cancelled() {
        return OrchestratorException.of(ErrorKind.SANDBOX, ErrorCodes.CANCELLED, "run cancelled");
    }

    private static String stderrTail(Path workDir) {
        Path file = workDir.resolve(WorkerLauncher.STDERR_FILE);
        if (!Files.isRegularFile(file)) {
            return "";
        }
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
            long start = Math.max(0, raf.length() - STDERR_TAIL_BYTES);
            byte[] bytes = new byte[(int) (raf.length() - start)];
            raf.seek(start);
            raf.readFully(bytes);
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "";
        }
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            log.debug("Could not remove worker dir {}: {}", dir, e.getMessage());
        }
    }

    @PreDestroy
    void shutdown() {
        watchdog.close();
    }
}
