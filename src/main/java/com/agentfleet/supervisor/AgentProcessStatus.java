package com.agentfleet.supervisor;

public enum AgentProcessStatus {
    STARTING,
    RUNNING,
    STOPPED,
    CRASHED,
    RESTARTING
}
