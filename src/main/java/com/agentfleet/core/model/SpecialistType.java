package com.agentfleet.core.model;

/**
 * Subtype of a {@link AgentRole#SPECIALIST} agent.
 */
public enum SpecialistType {
    ARCHITECT,
    TESTER,
    DOCWRITER,
    SECURITY
}
