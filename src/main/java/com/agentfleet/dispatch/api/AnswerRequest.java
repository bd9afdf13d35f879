package com.agentfleet.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for answering asks. Scope fields are used only when answering
 * the oldest ask in a scope.
 */
public record AnswerRequest(
    String answer,
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("workflow_id") String workflowId,
    @JsonProperty("epic_id") String epicId
) {}
