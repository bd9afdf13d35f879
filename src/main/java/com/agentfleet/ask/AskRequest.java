package com.agentfleet.ask;

import java.util.List;

/**
 * Input to {@link AskManager#open(AskRequest)}. Everything but the question is optional.
 *
 * @param question  what the human is asked, required
 * @param options   finite choices, answerable by 1-based index or label
 * @param context   free text shown alongside the question
 * @param agentId   scope: asking agent
 * @param sessionId scope: session
 * @param workflowId scope: workflow
 * @param epicId    scope: epic
 * @param timeoutMs per-request timeout, null for the configured default
 */
public record AskRequest(
    String question,
    List<String> options,
    String context,
    String agentId,
    String sessionId,
    String workflowId,
    String epicId,
    Long timeoutMs
) {
    public static AskRequest of(String question) {
        return new AskRequest(question, null, null, null, null, null, null, null);
    }

    public AskRequest withOptions(List<String> newOptions) {
        return new AskRequest(question, newOptions, context, agentId, sessionId, workflowId, epicId, timeoutMs);
    }

    public AskRequest withContext(String newContext) {
        return new AskRequest(question, options, newContext, agentId, sessionId, workflowId, epicId, timeoutMs);
    }

    public AskRequest withScope(String newAgentId, String newSessionId, String newWorkflowId, String newEpicId) {
        return new AskRequest(question, options, context, newAgentId, newSessionId, newWorkflowId, newEpicId, timeoutMs);
    }

    public AskRequest withTimeoutMs(long newTimeoutMs) {
        return new AskRequest(question, options, context, agentId, sessionId, workflowId, epicId, newTimeoutMs);
    }
}
