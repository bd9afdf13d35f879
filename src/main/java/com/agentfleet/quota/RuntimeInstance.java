package com.agentfleet.quota;

import java.time.Instant;

/**
 * A physical execution slot bound to an {@link AgentRuntimeConfig}. Immutable;
 * the queue replaces instances as they move through their lifecycle.
 *
 * @param instanceId    unique instance id
 * @param agentConfigId bound config id
 * @param status        current status
 * @param workflowId    owning workflow, nullable
 * @param taskId        task being executed, nullable
 * @param queuePosition 1-based position while queued, null otherwise
 * @param queuedCount   queue length at the last recompute, null when not queued
 * @param startedAt     when the instance left the queue
 * @param endedAt       when the instance completed
 * @param pid           OS process id of the backing agent, nullable
 * @param summary       latest progress summary
 * @param finalStatus   terminal outcome, set on completion
 * @param errorReason   failure reason, nullable
 */
public record RuntimeInstance(
    String instanceId,
    String agentConfigId,
    RuntimeStatus status,
    String workflowId,
    String taskId,
    Integer queuePosition,
    Integer queuedCount,
    Instant startedAt,
    Instant endedAt,
    Long pid,
    String summary,
    FinalStatus finalStatus,
    String errorReason
) {

    public static RuntimeInstance create(String instanceId, String agentConfigId, String workflowId, String taskId) {
        return new RuntimeInstance(instanceId, agentConfigId, RuntimeStatus.QUEUED, workflowId, taskId,
                null, null, null, null, null, null, null, null);
    }

    RuntimeInstance queuedAt(int position, int count) {
        return new RuntimeInstance(instanceId, agentConfigId, RuntimeStatus.QUEUED, workflowId, taskId,
                position, count, startedAt, endedAt, pid, summary, finalStatus, errorReason);
    }

    RuntimeInstance running(Instant at) {
        return new RuntimeInstance(instanceId, agentConfigId, RuntimeStatus.RUNNING, workflowId, taskId,
                null, null, at, endedAt, pid, summary, finalStatus, errorReason);
    }

    RuntimeInstance finished(FinalStatus outcome, String reason, Instant at) {
        return new RuntimeInstance(instanceId, agentConfigId, outcome.runtimeStatus(), workflowId, taskId,
                null, null, startedAt, at, pid, summary, outcome, reason);
    }

    RuntimeInstance withStatus(RuntimeStatus newStatus, String newSummary) {
        return new RuntimeInstance(instanceId, agentConfigId, newStatus, workflowId, taskId,
                queuePosition, queuedCount, startedAt, endedAt, pid,
                newSummary != null ? newSummary : summary, finalStatus, errorReason);
    }

    public RuntimeInstance withPid(Long newPid) {
        return new RuntimeInstance(instanceId, agentConfigId, status, workflowId, taskId,
                queuePosition, queuedCount, startedAt, endedAt, newPid, summary, finalStatus, errorReason);
    }
}
