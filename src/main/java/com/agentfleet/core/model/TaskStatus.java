package com.agentfleet.core.model;

/**
 * Lifecycle status of a task. Transitions are owned by
 * {@link com.agentfleet.core.state.TaskStateMachine}.
 */
public enum TaskStatus {
    OPEN,
    IN_PROGRESS,
    BLOCKED,
    FAILED,
    REVIEW,
    ESCALATED,
    CLOSED
}
