package com.agentfleet.core.state;

import com.agentfleet.core.model.Task;
import com.agentfleet.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.agentfleet.core.model.TaskStatus.*;

/**
 * Owns the allowed task status transitions and the retry bookkeeping.
 *
 * <p>Beyond the transition table two gates apply in {@link #transition}:
 * <ul>
 *   <li>a task may only be closed from {@code REVIEW}, even though the table lists {@code OPEN -> CLOSED}</li>
 *   <li>{@code FAILED -> OPEN} is rejected once {@code retryCount >= MAX_RETRIES}; accepted retries increment the count</li>
 * </ul>
 */
@Service
public class TaskStateMachine {

    private static final Logger log = LoggerFactory.getLogger(TaskStateMachine.class);

    public static final int MAX_RETRIES = 3;

    private static final Map<TaskStatus, Set<TaskStatus>> TRANSITIONS = new EnumMap<>(TaskStatus.class);

    static {
        TRANSITIONS.put(OPEN, EnumSet.of(IN_PROGRESS, CLOSED));
        TRANSITIONS.put(IN_PROGRESS, EnumSet.of(BLOCKED, FAILED, REVIEW));
        TRANSITIONS.put(BLOCKED, EnumSet.of(IN_PROGRESS, OPEN, CLOSED));
        TRANSITIONS.put(FAILED, EnumSet.of(OPEN, ESCALATED));
        TRANSITIONS.put(REVIEW, EnumSet.of(CLOSED, OPEN));
        TRANSITIONS.put(ESCALATED, EnumSet.of(CLOSED, OPEN));
        TRANSITIONS.put(CLOSED, EnumSet.of(OPEN));
    }

    /**
     * Looks the pair up in the transition table only; the close and retry gates are not applied here.
     */
    public TransitionCheck canTransition(TaskStatus from, TaskStatus to) {
        Set<TaskStatus> allowed = TRANSITIONS.getOrDefault(from, Set.of());
        if (allowed.contains(to)) {
            return TransitionCheck.allow();
        }
        return TransitionCheck.deny("Invalid transition from " + from + " to " + to
                + ". Allowed: " + allowed);
    }

    /**
     * Applies a transition and returns the updated task.
     *
     * @throws InvalidTransitionException when the table or one of the gates rejects the request
     */
    public Task transition(Task task, TaskStatus to) {
        TaskStatus from = task.status();
        TransitionCheck check = canTransition(from, to);
        if (!check.allowed()) {
            throw new InvalidTransitionException(task.id(), from, to, check.reason());
        }

        if (to == CLOSED && from != REVIEW) {
            throw new InvalidTransitionException(task.id(), from, to,
                    "Invalid transition from " + from + " to CLOSED: tasks must pass REVIEW before closing");
        }

        int retryCount = task.retryCount();
        if (from == FAILED && to == OPEN) {
            if (retryCount >= MAX_RETRIES) {
                throw new InvalidTransitionException(task.id(), from, to,
                        "Retry limit (" + MAX_RETRIES + ") reached for task " + task.id() + ", escalate instead");
            }
            retryCount++;
        }

        log.debug("Task {} {} -> {} (retryCount={})", task.id(), from, to, retryCount);
        return task.withStatus(to, retryCount, Instant.now());
    }

    public boolean shouldEscalate(Task task) {
        return task.status() == FAILED && task.retryCount() >= MAX_RETRIES;
    }
}
