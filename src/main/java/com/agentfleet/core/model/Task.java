package com.agentfleet.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A unit of work supplied by the planner. Immutable: status changes go through
 * {@link com.agentfleet.core.state.TaskStateMachine} which returns a new instance.
 *
 * @param id            unique identifier (e.g. "TASK-001")
 * @param title         short title, also used to infer the preferred agent role
 * @param description   what the task should accomplish
 * @param priority      higher values are dispatched first within the same path group
 * @param status        current lifecycle status
 * @param mainPath      true for critical-path tasks, which are scheduled after supporting work
 * @param dependencies  IDs of tasks that must be closed first
 * @param assignedAgent agent currently owning the task, nullable
 * @param requiredRole  explicit role requirement, nullable; when absent the role is inferred from the title
 * @param retryCount    accepted failed-to-open retries so far
 * @param createdAt     creation time
 * @param updatedAt     time of the last transition
 * @param artifacts     artifacts produced so far
 */
public record Task(
    String id,
    String title,
    String description,
    int priority,
    TaskStatus status,
    boolean mainPath,
    List<String> dependencies,
    String assignedAgent,
    String requiredRole,
    int retryCount,
    Instant createdAt,
    Instant updatedAt,
    List<Artifact> artifacts
) implements Serializable {

    public Task {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    /**
     * Convenience factory for a freshly planned task in {@link TaskStatus#OPEN}.
     */
    public static Task open(String id, String title, int priority, boolean mainPath, List<String> dependencies) {
        Instant now = Instant.now();
        return new Task(id, title, "", priority, TaskStatus.OPEN, mainPath, dependencies,
                null, null, 0, now, now, List.of());
    }

    public Task withStatus(TaskStatus newStatus, int newRetryCount, Instant at) {
        return new Task(id, title, description, priority, newStatus, mainPath, dependencies,
                assignedAgent, requiredRole, newRetryCount, createdAt, at, artifacts);
    }

    public Task withAssignedAgent(String agentId) {
        return new Task(id, title, description, priority, status, mainPath, dependencies,
                agentId, requiredRole, retryCount, createdAt, Instant.now(), artifacts);
    }

    public Task withRequiredRole(String role) {
        return new Task(id, title, description, priority, status, mainPath, dependencies,
                assignedAgent, role, retryCount, createdAt, updatedAt, artifacts);
    }
}
