package com.agentfleet.core.model;

/**
 * Primary role of a logical agent.
 */
public enum AgentRole {
    ORCHESTRATOR,
    EXECUTOR,
    REVIEWER,
    SPECIALIST
}
