package com.patina.orchestrator.error;

import com.patina.orchestrator.model.OrchestratorError;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks secrets in text and maps before they reach a trace, a log line or
 * the REST surface, and cuts long payloads down to a preview.
 */
public final class Redactor {

    private static final int    PREVIEW_LIMIT = 240;
    private static final String MASK_TOKEN    = "****";
    private static final Set<String> DEFAULT_SENSITIVE_KEYS =
            Set.of("api_key", "apikey", "token", "access_token", "refresh_token",
                    "secret", "authorization", "password");

    private static final Pattern KEY_VALUE = Pattern.compile(
            "(?i)\\b(api[_-]?key|access[_-]?token|refresh[_-]?token|token|secret|password|authorization)"
                    + "(\"?\\s*[:=]\\s*\"?)([^\\s\",;&}]+)");
    private static final Pattern BEARER  = Pattern.compile("(?i)\\bbearer\\s+[A-Za-z0-9._~+/=-]+");
    private static final Pattern SK_KEY  = Pattern.compile("\\bsk-[A-Za-z0-9_-]{8,}");

    private static final Redactor DEFAULT = new Redactor(DEFAULT_SENSITIVE_KEYS);

    private final Set<String> sensitiveKeys;

    public Redactor(Set<String> sensitiveKeys) {
        this.sensitiveKeys = Objects.requireNonNull(sensitiveKeys, "sensitiveKeys");
    }

    public static Redactor defaultRules() {
        return DEFAULT;
    }

    /** Mask secrets and truncate to a preview. Null becomes the empty string. */
    public String redact(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String masked = KEY_VALUE.matcher(text.trim()).replaceAll("$1$2" + MASK_TOKEN);
        masked = BEARER.matcher(masked).replaceAll("Bearer " + MASK_TOKEN);
        masked = SK_KEY.matcher(masked).replaceAll("sk-" + MASK_TOKEN);
        if (masked.length() <= PREVIEW_LIMIT) {
            return masked;
        }
        return masked.substring(0, PREVIEW_LIMIT) + "...";
    }

    /** Same error with its message masked and cut to a preview. */
    public OrchestratorError redact(OrchestratorError error) {
        return new OrchestratorError(error.kind(), error.code(), error.retriable(), redact(error.message()));
    }

    public Map<String, Object> redactMap(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> masked = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            masked.put(entry.getKey(), maskValue(entry.getKey(), entry.getValue()));
        }
        return masked;
    }

    private Object maskValue(String key, Object value) {
        if (sensitiveKeys.contains(key.toLowerCase(Locale.ROOT))) {
            return MASK_TOKEN;
        }
        if (value instanceof Map<?, ?> nested) {
            Map<String, Object> nestedMap = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : nested.entrySet()) {
                if (entry.getKey() instanceof String nestedKey) {
                    nestedMap.put(nestedKey, maskValue(nestedKey, entry.getValue()));
                }
            }
            return nestedMap;
        }
        if (value instanceof String s) {
            return redact(s);
        }
        return value;
    }
}
