package com.agentfleet.core.model;

public enum AgentStatus {
    IDLE,
    BUSY,
    ERROR,
    OFFLINE
}
