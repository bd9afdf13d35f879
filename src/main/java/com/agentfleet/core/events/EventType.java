package com.agentfleet.core.events;

/**
 * Event types published on the {@link EventBus}. The wire name is what SSE
 * clients and log lines see.
 */
public enum EventType {
    TASK_COMPLETED("task_completed"),
    TASK_FAILED("task_failed"),
    TASK_BLOCKED("task_blocked"),
    AGENT_AVAILABLE("agent_available"),
    DEPENDENCY_RESOLVED("dependency_resolved"),

    RUNTIME_SPAWNED("runtime_spawned"),
    RUNTIME_STATUS_CHANGED("runtime_status_changed"),
    RUNTIME_FINISHED("runtime_finished"),

    AGENT_PROCESS_STARTED("agent_process_started"),
    AGENT_PROCESS_EXITED("agent_process_exited"),

    ASK_OPENED("ask_opened"),
    ASK_RESOLVED("ask_resolved");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
