package com.agentfleet.ask;

import java.time.Instant;
import java.util.List;

/**
 * An open ask, as listed to whoever can answer it. Absent optional fields are null;
 * {@code options} is empty when the question is free-form.
 */
public record PendingAsk(
    String requestId,
    String question,
    List<String> options,
    String context,
    String agentId,
    String sessionId,
    String workflowId,
    String epicId,
    Instant createdAt,
    Instant expiresAt
) {
    public PendingAsk {
        options = options == null ? List.of() : List.copyOf(options);
    }
}
