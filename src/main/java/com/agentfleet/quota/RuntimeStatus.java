package com.agentfleet.quota;

public enum RuntimeStatus {
    QUEUED,
    RUNNING,
    WAITING_INPUT,
    COMPLETED,
    FAILED,
    INTERRUPTED
}
