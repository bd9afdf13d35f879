package com.agentfleet.core.model;

/**
 * One scheduler decision. A null {@code agentId} means no suitable agent was idle;
 * the task is simply retried on the next tick.
 */
public record SchedulingResult(
    String taskId,
    String agentId,
    String reason
) {
    public boolean assigned() {
        return agentId != null;
    }
}
