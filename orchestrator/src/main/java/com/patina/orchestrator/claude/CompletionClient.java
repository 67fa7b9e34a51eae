package com.patina.orchestrator.claude;

import com.patina.orchestrator.model.Constraints;

/**
 * The single LLM capability the planner needs: one prompt in, one text reply out.
 */
public interface CompletionClient {

    /**
     * @param systemPrompt instructions, including the tool and engine catalogue
     * @param userPrompt   the goal (or re-plan request)
     * @param constraints  the run's constraints; {@code budget.tokenCap} bounds the reply
     */
    String complete(String systemPrompt, String userPrompt, Constraints constraints);
}
