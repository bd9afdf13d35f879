package com.agentfleet.core.engine;

/**
 * What happened to one scheduler decision during {@link DispatchCoordinator#dispatch}.
 *
 * @param taskId     the task
 * @param agentId    the chosen agent, null when none was free
 * @param instanceId runtime instance carrying the task, null when none was created
 * @param status     dispatch stage reached
 * @param reason     explanation for logs and UI
 */
public record DispatchOutcome(
    String taskId,
    String agentId,
    String instanceId,
    Status status,
    String reason
) {
    public enum Status {
        /** Instance running, task IN_PROGRESS on the agent. */
        STARTED,
        /** Instance waiting in its runtime queue. */
        QUEUED,
        /** Admission refused by the concurrency governor; retried next tick. */
        DEFERRED,
        /** No agent was free. */
        UNASSIGNED
    }
}
