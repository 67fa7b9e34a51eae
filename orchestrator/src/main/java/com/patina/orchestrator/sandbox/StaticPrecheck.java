package com.patina.orchestrator.sandbox;

import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.model.ErrorKind;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cheap source checks run before any worker is spawned.
 *
 * These are not the isolation boundary (the worker's context is); they
 * reject obviously forbidden scripts early and with a clear message.
 */
@Component
public class StaticPrecheck {

    private static final Map<String, Pattern> FORBIDDEN = forbidden();

    private final int maxSourceBytes;

    public StaticPrecheck(@Value("${patina.sandbox.max-source-bytes:65536}") int maxSourceBytes) {
        this.maxSourceBytes = maxSourceBytes;
    }

    public record Result(boolean passed, String message, Map<String, Object> report) {}

    public Result check(String code) {
        List<String> issues = new ArrayList<>();
        Map<String, Object> report = new LinkedHashMap<>();
        String normalized = code == null ? "" : code;
        int bytes = normalized.getBytes(StandardCharsets.UTF_8).length;

        if (normalized.isBlank()) {
            issues.add("script is empty");
        }
        if (bytes > maxSourceBytes) {
            issues.add("script is " + bytes + " bytes, limit is " + maxSourceBytes);
        }
        FORBIDDEN.forEach((name, pattern) -> {
            if (pattern.matcher(normalized).find()) {
                issues.add("forbidden construct: " + name);
            }
        });

        report.put("code_bytes", bytes);
        report.put("issues", issues);
        return new Result(issues.isEmpty(), String.join("; ", issues), report);
    }

    /** Throws CODE/STATIC_REJECTED when {@link #check} fails. */
    public void require(String code) {
        Result result = check(code);
        if (!result.passed()) {
            throw OrchestratorException.of(ErrorKind.CODE, ErrorCodes.STATIC_REJECTED, result.message());
        }
    }

    private static Map<String, Pattern> forbidden() {
        Map<String, Pattern> m = new LinkedHashMap<>();
        m.put("import",        Pattern.compile("(^|[;\\s])import\\s*[({'\"\\w*]"));
        m.put("require()",     Pattern.compile("\\brequire\\s*\\("));
        m.put("eval()",        Pattern.compile("\\beval\\s*\\("));
        m.put("Function()",    Pattern.compile("\\bFunction\\s*\\("));
        m.put("Java.*",        Pattern.compile("\\bJava\\s*\\."));
        m.put("Polyglot.*",    Pattern.compile("\\bPolyglot\\s*\\."));
        m.put("load()",        Pattern.compile("(^|[^.\\w])load\\s*\\("));
        m.put("globalThis[]",  Pattern.compile("\\bglobalThis\\s*\\["));
        m.put(".constructor",  Pattern.compile("\\.\\s*constructor\\b|\\[\\s*['\"`]constructor['\"`]\\s*]"));
        return m;
    }
}
