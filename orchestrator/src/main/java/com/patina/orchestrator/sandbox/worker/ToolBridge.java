package com.patina.orchestrator.sandbox.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.model.ErrorKind;
import com.patina.orchestrator.model.OrchestratorError;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.Value;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Map;

/**
 * The {@code tools} object seen by scripts. {@code tools.call(uri, args)}
 * is forwarded to the parent as a {@code tool_call} message and blocks
 * until the matching reply arrives.
 *
 * A policy denial is remembered even if the script catches the resulting
 * error: the run then ends with that denial.
 */
public class ToolBridge {

    /** A tool call failed; carries the parent's typed error into the script. */
    public static final class ToolCallFailed extends RuntimeException {
        private final OrchestratorError error;

        ToolCallFailed(OrchestratorError error) {
            super(error.label() + ": " + error.message());
            this.error = error;
        }

        public OrchestratorError error() { return error; }
    }

    /** The parent broke the protocol; the worker must stop. */
    public static final class ProtocolBroken extends RuntimeException {
        ProtocolBroken(String message) {
            super(message);
        }
    }

    private final ObjectMapper   json;
    private final BufferedReader in;
    private final PrintStream    out;
    private final ValueGuard     guard;
    private Value                jsonParse;
    private int                  nextId;
    private int                  calls;
    private OrchestratorError    fatalError;

    public ToolBridge(ObjectMapper json, BufferedReader in, PrintStream out, ValueGuard guard) {
        this.json  = json;
        this.in    = in;
        this.out   = out;
        this.guard = guard;
    }

    void bind(Value jsonParse) {
        this.jsonParse = jsonParse;
    }

    @HostAccess.Export
    public Value call(String uri, Value args) {
        calls++;
        Object javaArgs = args == null ? Map.of() : guard.toJava(args);
        if (javaArgs != null && !(javaArgs instanceof Map)) {
            throw new IllegalArgumentException("tool arguments must be an object");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> argMap = javaArgs == null ? Map.of() : (Map<String, Object>) javaArgs;

        String id = "t" + (++nextId);
        send(WorkerMessage.toolCall(id, uri, argMap));
        WorkerMessage reply = receive();
        if (!id.equals(reply.id())) {
            throw new ProtocolBroken("reply id " + reply.id() + " does not match " + id);
        }
        if (reply.is(WorkerMessage.TOOL_ERROR)) {
            OrchestratorError error = reply.error() != null ? reply.error()
                    : OrchestratorError.of(ErrorKind.TOOL, ErrorCodes.BAD_RESPONSE, "tool call failed");
            if (error.kind() == ErrorKind.POLICY && fatalError == null) {
                fatalError = error;
            }
            throw new ToolCallFailed(error);
        }
        if (!reply.is(WorkerMessage.TOOL_RESULT)) {
            throw new ProtocolBroken("unexpected message '" + reply.type() + "' while waiting for " + id);
        }
        guard.check(reply.data());
        try {
            return jsonParse.execute(json.writeValueAsString(reply.data()));
        } catch (JsonProcessingException e) {
            throw new ProtocolBroken("tool result is not JSON: " + e.getOriginalMessage());
        }
    }

    public int calls() {
        return calls;
    }

    /** First policy denial seen by this bridge, or null. */
    public OrchestratorError fatalError() {
        return fatalError;
    }

    private void send(WorkerMessage message) {
        try {
            out.println(json.writeValueAsString(message));
            out.flush();
        } catch (JsonProcessingException e) {
            throw new ProtocolBroken("cannot encode " + message.type());
        }
    }

    private WorkerMessage receive() {
        try {
            String line = in.readLine();
            if (line == null) {
                throw new ProtocolBroken("parent closed the channel");
            }
            return json.readValue(line, WorkerMessage.class);
        } catch (IOException e) {
            throw new ProtocolBroken("unreadable reply: " + e.getMessage());
        }
    }
}
