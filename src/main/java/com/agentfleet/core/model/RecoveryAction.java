package com.agentfleet.core.model;

/**
 * Outcome of classifying a failed task.
 *
 * @param taskId  the task being classified
 * @param type    what to do next
 * @param reason  human-readable explanation
 * @param delayMs advisory backoff before a retry, null for other types
 */
public record RecoveryAction(
    String taskId,
    Type type,
    String reason,
    Long delayMs
) {
    public enum Type { RETRY, ESCALATE, WAIT, SKIP }
}
