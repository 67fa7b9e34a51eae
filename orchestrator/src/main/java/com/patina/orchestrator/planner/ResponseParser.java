package com.patina.orchestrator.planner;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the plan draft from a completion reply.
 *
 * The planner prompt asks for JSON inside {@code <plan>...</plan>}; a
 * fenced {@code ```json} block is accepted as a fallback because models
 * sometimes ignore the tag instruction.
 */
public final class ResponseParser {

    private static final Pattern PLAN_TAG = Pattern.compile(
            "<plan>(.*?)</plan>",
            Pattern.DOTALL
    );

    private static final Pattern JSON_BLOCK = Pattern.compile(
            "```(?:json)?\\s*\\n(.*?)\\n```",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /** JSON text of the first plan in {@code response}, or empty if there is none. */
    public static Optional<String> extractPlan(String response) {
        if (response == null) {
            return Optional.empty();
        }
        Matcher tag = PLAN_TAG.matcher(response);
        if (tag.find()) {
            return Optional.of(tag.group(1).strip()).filter(s -> !s.isEmpty());
        }
        Matcher block = JSON_BLOCK.matcher(response);
        return block.find() ? Optional.of(block.group(1).strip()) : Optional.empty();
    }
}
