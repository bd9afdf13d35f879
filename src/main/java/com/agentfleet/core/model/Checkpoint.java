package com.agentfleet.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time snapshot of a task's progress.
 *
 * @param progress heuristic percentage derived from status, not a measured value
 */
public record Checkpoint(
    String taskId,
    TaskStatus status,
    int progress,
    List<Artifact> artifacts,
    Instant timestamp
) {
    public Checkpoint {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }
}
