package com.agentfleet.core.engine;

import com.agentfleet.core.events.EventBus;
import com.agentfleet.core.events.EventType;
import com.agentfleet.core.events.FleetEvent;
import com.agentfleet.core.logging.MdcContext;
import com.agentfleet.core.metrics.FleetMetrics;
import com.agentfleet.core.model.Agent;
import com.agentfleet.core.model.RecoveryAction;
import com.agentfleet.core.model.SchedulingResult;
import com.agentfleet.core.model.Task;
import com.agentfleet.core.model.TaskStatus;
import com.agentfleet.core.recovery.RecoveryManager;
import com.agentfleet.core.scheduler.TaskScheduler;
import com.agentfleet.core.state.InvalidTransitionException;
import com.agentfleet.core.state.TaskStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives a workflow one tick at a time.
 * <p>
 * Each tick unblocks BLOCKED tasks whose dependencies closed, moves retry-classified
 * FAILED tasks back to OPEN, and asks the {@link TaskScheduler} for assignments.
 * The engine only computes decisions; executing a dispatched task is the caller's job.
 * Transition errors are caught per task so one malformed task never stalls a tick.
 * Ticks are not re-entrant within a workflow; different workflows may tick concurrently.
 */
@Service
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final TaskStateMachine stateMachine;
    private final TaskScheduler scheduler;
    private final RecoveryManager recoveryManager;
    private final EventBus eventBus;
    private final FleetMetrics metrics;

    private volatile boolean running;
    /** Workflow ids with a tick in progress. */
    private final Set<String> ticking = ConcurrentHashMap.newKeySet();

    @Autowired
    public WorkflowEngine(TaskStateMachine stateMachine, TaskScheduler scheduler,
                          RecoveryManager recoveryManager, EventBus eventBus,
                          @Autowired(required = false) FleetMetrics metrics) {
        this.stateMachine = stateMachine;
        this.scheduler = scheduler;
        this.recoveryManager = recoveryManager;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    WorkflowEngine(EventBus eventBus) {
        this(new TaskStateMachine(), new TaskScheduler(),
                new RecoveryManager(new TaskStateMachine()), eventBus, null);
    }

    public void start() {
        running = true;
        log.info("Workflow engine started");
    }

    public void stop() {
        running = false;
        log.info("Workflow engine stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Advances the workflow by one step.
     *
     * @return scheduling decisions for the ready tasks; empty when the engine is stopped
     */
    public List<SchedulingResult> tick(WorkflowContext context) {
        if (!running) return List.of();
        String tickKey = String.valueOf(context.workflowId());
        if (!ticking.add(tickKey)) {
            log.warn("tick() re-entered for workflow {}, ignoring nested call", context.workflowId());
            return List.of();
        }

        long startMs = System.currentTimeMillis();
        MdcContext.setWorkflow(context.workflowId());
        try {
            processBlockedTasks(context);
            processFailedTasks(context);

            List<SchedulingResult> results = scheduler.schedule(context.tasks(), context.agents());
            if (metrics != null) {
                results.forEach(r -> metrics.recordSchedulingDecision(r.assigned()));
                metrics.recordTickDuration(System.currentTimeMillis() - startMs);
            }
            return results;
        } finally {
            MdcContext.clear();
            ticking.remove(tickKey);
        }
    }

    /**
     * Moves an IN_PROGRESS task to REVIEW and emits {@code task_completed}. Tasks in any
     * other status are left untouched.
     */
    public void handleTaskCompletion(String taskId, WorkflowContext context) {
        Task task = context.getTask(taskId);
        if (task == null) {
            log.warn("Completion reported for unknown task {}", taskId);
            return;
        }
        if (task.status() != TaskStatus.IN_PROGRESS) {
            log.debug("Ignoring completion of task {} in status {}", taskId, task.status());
            return;
        }

        try {
            context.putTask(stateMachine.transition(task, TaskStatus.REVIEW));
            emit(EventType.TASK_COMPLETED, context, taskId, Map.of());
        } catch (InvalidTransitionException e) {
            log.error("Failed to complete task {}: {}", taskId, e.getMessage());
        }
    }

    /**
     * Marks a task FAILED, checkpoints it, classifies the failure and escalates it when
     * the retry budget is spent.
     *
     * @return the recovery action; SKIP when the task is unknown
     */
    public RecoveryAction handleTaskFailure(String taskId, WorkflowContext context) {
        Task task = context.getTask(taskId);
        if (task == null) {
            return new RecoveryAction(taskId, RecoveryAction.Type.SKIP, "Task not found", null);
        }

        MdcContext.setTask(context.workflowId(), taskId);
        try {
            try {
                task = stateMachine.transition(task, TaskStatus.FAILED);
                context.putTask(task);
            } catch (InvalidTransitionException e) {
                log.error("Failed to mark task {} as failed: {}", taskId, e.getMessage());
            }

            recoveryManager.saveCheckpoint(task);
            RecoveryAction action = recoveryManager.analyzeFailure(task);

            if (action.type() == RecoveryAction.Type.ESCALATE) {
                try {
                    context.putTask(stateMachine.transition(task, TaskStatus.ESCALATED));
                    if (metrics != null) metrics.incrementEscalations();
                    log.warn("Task {} escalated: {}", taskId, action.reason());
                } catch (InvalidTransitionException e) {
                    log.error("Failed to escalate task {}: {}", taskId, e.getMessage());
                }
            }

            if (metrics != null) metrics.recordRecoveryAction(action.type().name().toLowerCase(Locale.ROOT));
            var payload = new HashMap<String, Object>();
            payload.put("action", action.type().name());
            payload.put("reason", action.reason());
            if (action.delayMs() != null) payload.put("delayMs", action.delayMs());
            emit(EventType.TASK_FAILED, context, taskId, payload);
            return action;
        } finally {
            MdcContext.clearTask();
        }
    }

    /**
     * Applies a reviewer's verdict: approved closes the task, rejected reopens it.
     *
     * @return true when the transition was applied
     */
    public boolean handleReviewDecision(String taskId, boolean approved, WorkflowContext context) {
        Task task = context.getTask(taskId);
        if (task == null || task.status() != TaskStatus.REVIEW) {
            log.warn("Review decision for task {} ignored (status {})",
                    taskId, task == null ? "unknown" : task.status());
            return false;
        }
        try {
            context.putTask(stateMachine.transition(task, approved ? TaskStatus.CLOSED : TaskStatus.OPEN));
            log.info("Task {} review {}", taskId, approved ? "approved" : "rejected");
            return true;
        } catch (InvalidTransitionException e) {
            log.error("Failed to apply review decision for task {}: {}", taskId, e.getMessage());
            return false;
        }
    }

    /**
     * Parks an IN_PROGRESS task as BLOCKED until its dependencies close again.
     */
    public boolean handleTaskBlocked(String taskId, WorkflowContext context) {
        Task task = context.getTask(taskId);
        if (task == null) return false;
        try {
            context.putTask(stateMachine.transition(task, TaskStatus.BLOCKED));
            emit(EventType.TASK_BLOCKED, context, taskId, Map.of());
            return true;
        } catch (InvalidTransitionException e) {
            log.error("Failed to block task {}: {}", taskId, e.getMessage());
            return false;
        }
    }

    /**
     * Commits a scheduler decision: the task moves to IN_PROGRESS (when OPEN) and the
     * agent becomes exclusively owned by it.
     *
     * @return false when the decision is stale (agent no longer idle or task gone)
     */
    public boolean applyAssignment(SchedulingResult result, WorkflowContext context) {
        if (!result.assigned()) return false;
        Task task = context.getTask(result.taskId());
        Agent agent = context.getAgent(result.agentId());
        if (task == null || agent == null || !agent.isIdle()) {
            log.debug("Stale assignment {} -> {}", result.taskId(), result.agentId());
            return false;
        }
        try {
            if (task.status() == TaskStatus.OPEN) {
                task = stateMachine.transition(task, TaskStatus.IN_PROGRESS);
            }
            context.putTask(task.withAssignedAgent(agent.id()));
            context.putAgent(agent.busyWith(task.id()));
            return true;
        } catch (InvalidTransitionException e) {
            log.error("Failed to assign task {} to {}: {}", task.id(), agent.id(), e.getMessage());
            return false;
        }
    }

    /**
     * Returns an agent to the idle pool and emits {@code agent_available}.
     */
    public void releaseAgent(String agentId, WorkflowContext context) {
        Agent agent = context.getAgent(agentId);
        if (agent == null) return;
        context.putAgent(agent.released());
        emit(EventType.AGENT_AVAILABLE, context, agentId, Map.of());
    }

    private void processBlockedTasks(WorkflowContext context) {
        for (Task task : context.tasks()) {
            if (task.status() != TaskStatus.BLOCKED) continue;

            boolean depsResolved = task.dependencies().stream().allMatch(depId -> {
                Task dep = context.getTask(depId);
                return dep != null && dep.status() == TaskStatus.CLOSED;
            });
            if (!depsResolved) continue;

            try {
                context.putTask(stateMachine.transition(task, TaskStatus.IN_PROGRESS));
                emit(EventType.DEPENDENCY_RESOLVED, context, task.id(), Map.of());
            } catch (RuntimeException e) {
                log.error("Failed to unblock task {}: {}", task.id(), e.getMessage());
            }
        }
    }

    private void processFailedTasks(WorkflowContext context) {
        for (Task task : context.tasks()) {
            if (task.status() != TaskStatus.FAILED) continue;

            try {
                RecoveryAction action = recoveryManager.analyzeFailure(task);
                if (action.type() == RecoveryAction.Type.RETRY) {
                    context.putTask(stateMachine.transition(task, TaskStatus.OPEN));
                    log.info("Retrying task {} (advisory delay {}ms)", task.id(), action.delayMs());
                }
            } catch (RuntimeException e) {
                log.error("Failed to retry task {}: {}", task.id(), e.getMessage());
            }
        }
    }

    private void emit(EventType type, WorkflowContext context, String subjectId, Map<String, Object> payload) {
        eventBus.publish(FleetEvent.of(type, context.workflowId(), subjectId, payload));
    }
}
