package com.agentfleet.core.state;

import com.agentfleet.core.model.TaskStatus;

/**
 * Thrown when a requested task transition is rejected by the state machine.
 */
public class InvalidTransitionException extends RuntimeException {

    private final String taskId;
    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidTransitionException(String taskId, TaskStatus from, TaskStatus to, String message) {
        super(message);
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String getTaskId() { return taskId; }
    public TaskStatus getFrom() { return from; }
    public TaskStatus getTo() { return to; }
}
