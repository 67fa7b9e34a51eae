package com.patina.orchestrator.sandbox.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.Redactor;
import com.patina.orchestrator.model.Budget;
import com.patina.orchestrator.model.ErrorKind;
import com.patina.orchestrator.model.ExecutionMetrics;
import com.patina.orchestrator.model.OrchestratorError;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.EnvironmentAccess;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.ResourceLimits;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;

import java.io.BufferedReader;
import java.io.PrintStream;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryPoolMXBean;
import java.lang.management.MemoryType;
import java.lang.management.ThreadMXBean;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one script inside a locked-down JavaScript context.
 *
 * <p>The context is built like a security-rule script context: only
 * {@code @HostAccess.Export} members are reachable, no host class lookup,
 * no I/O, no native access, no thread or process creation, no polyglot
 * access, and a statement limit of {@code maxOps}. A prelude removes
 * {@code eval} and every function constructor from the global scope.
 *
 * <p>The script is a function body called as {@code (input, tools, log)};
 * it returns a string or {@code {summary, state_updates, artifacts}}.
 *
 * <p>Call depth is bounded by the stack size of the thread the script runs on.
 * CPU time is sampled on that thread and the context is cancelled when
 * {@code cpuMs} is spent.
 */
public class ScriptRunner {

    private static final String PRELUDE = """
            (function () {
              const lock = (proto) => {
                if (proto) {
                  Object.defineProperty(proto, 'constructor',
                      { value: undefined, writable: false, configurable: false });
                }
              };
              lock(Object.getPrototypeOf(function () {}));
              lock(Object.getPrototypeOf(async function () {}));
              lock(Object.getPrototypeOf(function* () {}));
              lock(Object.getPrototypeOf(async function* () {}));
              for (const name of ['eval', 'Function', 'Java', 'Graal', 'Polyglot', 'load', 'print', 'console']) {
                delete globalThis[name];
              }
            })();
            """;

    private static final int  STACK_BYTES_PER_FRAME = 32 * 1024;
    private static final long MIN_STACK_BYTES       = 1024L * 1024;
    private static final long MAX_STACK_BYTES       = 512L * 1024 * 1024;
    private static final int  MAX_LOG_LINES         = 100;
    private static final int  MAX_LOG_LINE_CHARS    = 500;
    private static final long CPU_SAMPLE_MS         = 10;

    private final ObjectMapper json;

    public ScriptRunner(ObjectMapper json) {
        this.json = json;
    }

    /** Execute a {@code run} message; returns the {@code result} or {@code error} reply. */
    public WorkerMessage run(WorkerMessage run, BufferedReader in, PrintStream out) {
        Budget budget = run.budget() == null ? Budget.defaults() : run.budget();
        ValueGuard guard = new ValueGuard(budget);
        ToolBridge bridge = new ToolBridge(json, in, out, guard);
        List<String> logs = new ArrayList<>();

        AtomicReference<Context>       context  = new AtomicReference<>();
        AtomicReference<WorkerMessage> reply    = new AtomicReference<>();
        AtomicBoolean                  cpuSpent = new AtomicBoolean();
        long[]                         cpuNanos = new long[1];

        Runnable body = () -> {
            WorkerMessage outcome;
            try {
                Map<String, Object> result = execute(run, budget, guard, bridge, logs, context);
                outcome = WorkerMessage.result(result, null);
            } catch (PolyglotException e) {
                outcome = WorkerMessage.error(classify(e, cpuSpent.get()), null);
            } catch (ValueGuard.LimitExceeded e) {
                outcome = WorkerMessage.error(OrchestratorError.of(ErrorKind.BUDGET, e.code(), e.getMessage()), null);
            } catch (BadResult e) {
                outcome = WorkerMessage.error(OrchestratorError.of(ErrorKind.CODE, ErrorCodes.BAD_RESULT, e.getMessage()), null);
            } catch (StackOverflowError e) {
                outcome = WorkerMessage.error(OrchestratorError.of(ErrorKind.BUDGET, ErrorCodes.DEPTH_LIMIT,
                        "call depth limit of " + budget.maxCallDepth() + " exceeded"), null);
            } catch (OutOfMemoryError e) {
                outcome = WorkerMessage.error(OrchestratorError.of(ErrorKind.BUDGET, ErrorCodes.MEM_LIMIT,
                        "memory limit of " + budget.memMb() + " MB exceeded"), null);
            } catch (RuntimeException e) {
                outcome = WorkerMessage.error(OrchestratorError.of(ErrorKind.SANDBOX, ErrorCodes.PROC_CRASH,
                        "script context failed: " + e.getMessage()), null);
            } finally {
                cpuNanos[0] = ManagementFactory.getThreadMXBean().getCurrentThreadCpuTime();
                Context c = context.getAndSet(null);
                if (c != null) {
                    c.close(true);
                }
            }
            reply.set(outcome);
        };

        long stackBytes = Math.max(MIN_STACK_BYTES,
                Math.min(MAX_STACK_BYTES, (long) budget.maxCallDepth() * STACK_BYTES_PER_FRAME));
        Thread scriptThread = new Thread(null, body, "patina-script", stackBytes);
        scriptThread.setDaemon(true);
        scriptThread.start();
        watchCpu(scriptThread, budget.cpuMs(), context, cpuSpent);

        WorkerMessage outcome = reply.get();
        if (outcome == null) {
            outcome = WorkerMessage.error(OrchestratorError.of(ErrorKind.SANDBOX, ErrorCodes.PROC_CRASH,
                    "script thread ended without an outcome"), null);
        }
        if (bridge.fatalError() != null) {
            outcome = WorkerMessage.error(bridge.fatalError(), null);
        }
        ExecutionMetrics metrics = new ExecutionMetrics(
                cpuNanos[0] / 1_000_000, peakHeapMb(), bridge.calls() + logs.size(), bridge.calls());
        return outcome.is(WorkerMessage.RESULT)
                ? WorkerMessage.result(outcome.result(), metrics)
                : WorkerMessage.error(Redactor.defaultRules().redact(outcome.error()), metrics);
    }

    // ------------------------------------------------------------------
    // Script execution
    // ------------------------------------------------------------------

    private Map<String, Object> execute(WorkerMessage run, Budget budget, ValueGuard guard, ToolBridge bridge,
                                        List<String> logs, AtomicReference<Context> holder) {
        ResourceLimits limits = ResourceLimits.newBuilder()
                .statementLimit(budget.maxOps(), null)
                .build();
        Context context = Context.newBuilder("js")
                .allowAllAccess(false)
                .allowHostAccess(HostAccess.newBuilder()
                        .allowPublicAccess(false)
                        .allowAccessAnnotatedBy(HostAccess.Export.class)
                        .build())
                .allowHostClassLookup(s -> false)
                .allowIO(false)
                .allowNativeAccess(false)
                .allowCreateThread(false)
                .allowCreateProcess(false)
                .allowPolyglotAccess(PolyglotAccess.NONE)
                .allowEnvironmentAccess(EnvironmentAccess.NONE)
                .resourceLimits(limits)
                .allowExperimentalOptions(true)
                .option("engine.WarnInterpreterOnly", "false")
                .option("js.ecmascript-version", "2022")
                .option("js.load", "false")
                .option("js.print", "false")
                .option("js.console", "false")
                .build();
        holder.set(context);

        context.eval("js", PRELUDE);
        Value jsonParse = context.eval("js", "JSON.parse");
        bridge.bind(jsonParse);

        Value fn = context.eval(Source.create("js",
                "(function (input, tools, log) {\n" + run.code() + "\n})"));
        Value input = jsonParse.execute(toJson(guard.check(run.input() == null ? Map.of() : run.input())));
        ProxyExecutable log = args -> {
            if (logs.size() < MAX_LOG_LINES && args.length > 0) {
                String line = args[0].isString() ? args[0].asString() : args[0].toString();
                logs.add(line.length() > MAX_LOG_LINE_CHARS ? line.substring(0, MAX_LOG_LINE_CHARS) : line);
            }
            return null;
        };

        Value returned = fn.execute(input, bridge, log);
        return normalize(returned, guard);
    }

    /** Shape the returned value as {summary, state_updates, artifacts}. */
    @SuppressWarnings("unchecked")
    private Map<String, Object> normalize(Value returned, ValueGuard guard) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (returned == null || returned.isNull()) {
            result.put("summary", "");
            return result;
        }
        if (returned.isString()) {
            result.put("summary", guard.toJava(returned));
            return result;
        }
        Object value = guard.toJava(returned);
        if (!(value instanceof Map)) {
            result.put("summary", String.valueOf(value));
            return result;
        }
        Map<String, Object> map = (Map<String, Object>) value;
        Object summary = map.getOrDefault("summary", "");
        if (!(summary instanceof String)) {
            throw new BadResult("summary must be a string");
        }
        result.put("summary", summary);

        Object state = map.get("state_updates");
        if (state != null && !(state instanceof Map)) {
            throw new BadResult("state_updates must be an object");
        }
        if (state != null) {
            result.put("state_updates", state);
        }

        Object artifacts = map.get("artifacts");
        if (artifacts != null) {
            if (!(artifacts instanceof List<?> list)) {
                throw new BadResult("artifacts must be an array");
            }
            for (Object a : list) {
                if (!(a instanceof Map<?, ?> artifact) || !(artifact.get("content") instanceof String)) {
                    throw new BadResult("each artifact needs a string content");
                }
            }
            result.put("artifacts", artifacts);
        }
        return result;
    }

    private OrchestratorError classify(PolyglotException e, boolean cpuSpent) {
        String message = e.getMessage() == null ? "" : e.getMessage();
        if (cpuSpent) {
            return OrchestratorError.of(ErrorKind.BUDGET, ErrorCodes.CPU_LIMIT, "CPU time limit exceeded");
        }
        if (message.contains("Maximum call stack size exceeded")) {
            return OrchestratorError.of(ErrorKind.BUDGET, ErrorCodes.DEPTH_LIMIT, "call depth limit exceeded");
        }
        if (e.isResourceExhausted()) {
            String lower = message.toLowerCase();
            if (lower.contains("statement")) {
                return OrchestratorError.of(ErrorKind.BUDGET, ErrorCodes.OP_LIMIT, "operation limit exceeded");
            }
            if (lower.contains("stack")) {
                return OrchestratorError.of(ErrorKind.BUDGET, ErrorCodes.DEPTH_LIMIT, "call depth limit exceeded");
            }
            if (lower.contains("memory")) {
                return OrchestratorError.of(ErrorKind.BUDGET, ErrorCodes.MEM_LIMIT, "memory limit exceeded");
            }
            return OrchestratorError.of(ErrorKind.BUDGET, ErrorCodes.OP_LIMIT, message);
        }
        if (e.isSyntaxError()) {
            return OrchestratorError.of(ErrorKind.CODE, ErrorCodes.SYNTAX_ERROR, message);
        }
        if (e.isHostException()) {
            Throwable host = e.asHostException();
            if (host instanceof ToolBridge.ToolCallFailed failed) {
                return failed.error();
            }
            if (host instanceof ValueGuard.LimitExceeded limit) {
                return OrchestratorError.of(ErrorKind.BUDGET, limit.code(), limit.getMessage());
            }
            if (host instanceof ToolBridge.ProtocolBroken broken) {
                return OrchestratorError.of(ErrorKind.SANDBOX, ErrorCodes.PROC_CRASH, broken.getMessage());
            }
            if (host instanceof StackOverflowError) {
                return OrchestratorError.of(ErrorKind.BUDGET, ErrorCodes.DEPTH_LIMIT, "call depth limit exceeded");
            }
            return OrchestratorError.of(ErrorKind.CODE, ErrorCodes.RUNTIME_ERROR, String.valueOf(host.getMessage()));
        }
        if (e.isCancelled()) {
            return OrchestratorError.of(ErrorKind.SANDBOX, ErrorCodes.CANCELLED, "script cancelled");
        }
        return OrchestratorError.of(ErrorKind.CODE, ErrorCodes.RUNTIME_ERROR, message);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private static void watchCpu(Thread scriptThread, long cpuMs, AtomicReference<Context> context,
                                 AtomicBoolean cpuSpent) {
        ThreadMXBean threads = ManagementFactory.getThreadMXBean();
        long limitNanos = cpuMs * 1_000_000;
        while (scriptThread.isAlive()) {
            try {
                scriptThread.join(CPU_SAMPLE_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            long used = threads.getThreadCpuTime(scriptThread.getId());
            if (used > limitNanos && cpuSpent.compareAndSet(false, true)) {
                Context c = context.get();
                if (c != null) {
                    c.close(true);
                }
            }
        }
    }

    private static long peakHeapMb() {
        long peak = 0;
        for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
            if (pool.getType() == MemoryType.HEAP && pool.getPeakUsage() != null) {
                peak += pool.getPeakUsage().getUsed();
            }
        }
        return peak / (1024 * 1024);
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new BadResult("input is not JSON: " + e.getOriginalMessage());
        }
    }

    private static final class BadResult extends RuntimeException {
        BadResult(String message) {
            super(message);
        }
    }
}
