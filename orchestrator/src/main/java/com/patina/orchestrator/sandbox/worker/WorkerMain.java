package com.patina.orchestrator.sandbox.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.model.ErrorKind;
import com.patina.orchestrator.model.OrchestratorError;

import java.io.BufferedReader;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Entry point of a sandbox worker process.
 *
 * Reads exactly one {@code run} message from stdin, executes it and writes
 * one {@code result} or {@code error} message to stdout, exchanging
 * {@code tool_call}/{@code tool_result} messages in between. stdout belongs
 * to the protocol: {@link System#out} is pointed at stderr before anything
 * else runs. The worker opens no sockets and reads no files.
 */
public final class WorkerMain {

    static final int EXIT_OK       = 0;
    static final int EXIT_PROTOCOL = 2;

    private final ObjectMapper   json;
    private final BufferedReader in;
    private final PrintStream    out;

    WorkerMain(ObjectMapper json, BufferedReader in, PrintStream out) {
        this.json = json;
        this.in   = in;
        this.out  = out;
    }

    public static void main(String[] args) {
        PrintStream protocol = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
        System.setOut(System.err);
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        int status = new WorkerMain(new ObjectMapper(), in, protocol).serve();
        protocol.flush();
        System.exit(status);
    }

    int serve() {
        WorkerMessage run;
        try {
            String line = in.readLine();
            if (line == null) {
                return EXIT_PROTOCOL;
            }
            run = json.readValue(line, WorkerMessage.class);
        } catch (IOException e) {
            send(protocolError("unreadable run message: " + e.getMessage()));
            return EXIT_PROTOCOL;
        }
        if (!run.is(WorkerMessage.RUN) || run.code() == null) {
            send(protocolError("expected a run message, got '" + run.type() + "'"));
            return EXIT_PROTOCOL;
        }

        WorkerMessage reply = new ScriptRunner(json).run(run, in, out);
        send(reply);
        return EXIT_OK;
    }

    private void send(WorkerMessage message) {
        try {
            out.println(json.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            out.println("{\"type\":\"error\",\"error\":{\"kind\":\"SANDBOX\",\"code\":\"PROC_CRASH\","
                    + "\"retriable\":false,\"message\":\"unencodable reply\"}}");
        }
        out.flush();
    }

    private static WorkerMessage protocolError(String message) {
        return WorkerMessage.error(OrchestratorError.of(ErrorKind.SANDBOX, ErrorCodes.PROC_CRASH, message), null);
    }
}
