package com.agentfleet.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Logical identity of a worker agent. Distinct from the physical
 * {@link com.agentfleet.quota.RuntimeInstance} slots it may occupy.
 *
 * @param id             unique agent identifier
 * @param name           display name
 * @param role           primary role
 * @param specialistType subtype for specialists, nullable
 * @param status         availability
 * @param capabilities   declared capabilities
 * @param currentTask    task that exclusively owns this agent, nullable
 * @param lastHeartbeat  last liveness signal seen, nullable
 */
public record Agent(
    String id,
    String name,
    AgentRole role,
    SpecialistType specialistType,
    AgentStatus status,
    List<String> capabilities,
    String currentTask,
    Instant lastHeartbeat
) implements Serializable {

    public Agent {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    public static Agent idle(String id, AgentRole role) {
        return new Agent(id, id, role, null, AgentStatus.IDLE, List.of(), null, null);
    }

    public static Agent idleSpecialist(String id, SpecialistType type) {
        return new Agent(id, id, AgentRole.SPECIALIST, type, AgentStatus.IDLE, List.of(), null, null);
    }

    /**
     * True when the role name or the specialist subtype equals {@code roleName}, ignoring case.
     */
    public boolean serves(String roleName) {
        if (roleName == null) return false;
        if (role != null && role.name().equalsIgnoreCase(roleName)) return true;
        return specialistType != null && specialistType.name().equalsIgnoreCase(roleName);
    }

    public boolean isIdle() {
        return status == AgentStatus.IDLE;
    }

    public Agent busyWith(String taskId) {
        return new Agent(id, name, role, specialistType, AgentStatus.BUSY, capabilities, taskId, lastHeartbeat);
    }

    public Agent released() {
        return new Agent(id, name, role, specialistType, AgentStatus.IDLE, capabilities, null, lastHeartbeat);
    }
}
