package com.patina.orchestrator.policy;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Glob matching for tool URIs and write scopes.
 */
public final class ToolPatterns {

    private static final Map<String, Pattern> COMPILED = new ConcurrentHashMap<>();

    private ToolPatterns() {}

    public static boolean matches(String glob, String value) {
        if (glob == null || value == null) {
            return false;
        }
        if (glob.indexOf('*') < 0 && glob.indexOf('?') < 0) {
            return glob.equals(value);
        }
        return COMPILED.computeIfAbsent(glob, ToolPatterns::compile).matcher(value).matches();
    }

    public static boolean matchesAny(Collection<String> globs, String value) {
        return globs.stream().anyMatch(g -> matches(g, value));
    }

    private static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (!literal.isEmpty()) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (!literal.isEmpty()) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
