package com.agentfleet.core.recovery;

import com.agentfleet.core.model.Checkpoint;
import com.agentfleet.core.model.RecoveryAction;
import com.agentfleet.core.model.Task;
import com.agentfleet.core.model.TaskStatus;
import com.agentfleet.core.state.TaskStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Classifies failed tasks and keeps the latest progress checkpoint per task.
 *
 * <p>Retries back off exponentially from {@link #BASE_DELAY_MS}, capped at
 * {@code maxBackoffMs}.
 */
@Service
public class RecoveryManager {

    private static final Logger log = LoggerFactory.getLogger(RecoveryManager.class);

    static final long BASE_DELAY_MS = 1000;
    static final long DEFAULT_MAX_BACKOFF_MS = 30_000;

    private final TaskStateMachine stateMachine;
    private final long maxBackoffMs;
    private final ConcurrentHashMap<String, Checkpoint> checkpoints = new ConcurrentHashMap<>();

    @Autowired
    public RecoveryManager(TaskStateMachine stateMachine) {
        this(stateMachine, DEFAULT_MAX_BACKOFF_MS);
    }

    public RecoveryManager(TaskStateMachine stateMachine, long maxBackoffMs) {
        this.stateMachine = stateMachine;
        this.maxBackoffMs = maxBackoffMs;
    }

    public RecoveryAction analyzeFailure(Task task) {
        if (stateMachine.shouldEscalate(task)) {
            return new RecoveryAction(task.id(), RecoveryAction.Type.ESCALATE,
                    "Task failed " + task.retryCount() + " times, exceeding retry limit", null);
        }

        if (task.status() == TaskStatus.FAILED && task.retryCount() < TaskStateMachine.MAX_RETRIES) {
            long delay = backoff(task.retryCount());
            return new RecoveryAction(task.id(), RecoveryAction.Type.RETRY,
                    "Transient error, will retry with exponential backoff", delay);
        }

        if (task.status() == TaskStatus.BLOCKED) {
            return new RecoveryAction(task.id(), RecoveryAction.Type.WAIT,
                    "Waiting for dependency to resolve", null);
        }

        log.debug("Task {} in status {} has no recovery path, skipping", task.id(), task.status());
        return new RecoveryAction(task.id(), RecoveryAction.Type.SKIP, "Unknown error, skipping task", null);
    }

    public Checkpoint saveCheckpoint(Task task) {
        var checkpoint = new Checkpoint(task.id(), task.status(), progressOf(task.status()),
                task.artifacts(), Instant.now());
        checkpoints.put(task.id(), checkpoint);
        return checkpoint;
    }

    public Optional<Checkpoint> restoreCheckpoint(String taskId) {
        return Optional.ofNullable(checkpoints.get(taskId));
    }

    public void clearCheckpoint(String taskId) {
        checkpoints.remove(taskId);
    }

    long backoff(int retryCount) {
        // 2^30 already exceeds any sane cap; clamp the shift to stay in range
        long delay = BASE_DELAY_MS << Math.min(Math.max(retryCount, 0), 30);
        return Math.min(delay, maxBackoffMs);
    }

    static int progressOf(TaskStatus status) {
        return switch (status) {
            case CLOSED -> 100;
            case REVIEW -> 90;
            case IN_PROGRESS -> 50;
            case BLOCKED, FAILED -> 25;
            default -> 0;
        };
    }
}
