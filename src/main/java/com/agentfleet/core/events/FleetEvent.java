package com.agentfleet.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle notification.
 *
 * @param type       what happened
 * @param workflowId the workflow (or project) this event belongs to, nullable for process-level events
 * @param subjectId  task, agent, runtime instance or ask id the event is about
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record FleetEvent(
    EventType type,
    String workflowId,
    String subjectId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public FleetEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static FleetEvent of(EventType type, String workflowId, String subjectId, Map<String, Object> payload) {
        return new FleetEvent(type, workflowId, subjectId, payload, Instant.now());
    }
}
