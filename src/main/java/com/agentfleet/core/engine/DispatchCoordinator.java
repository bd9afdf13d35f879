package com.agentfleet.core.engine;

import com.agentfleet.concurrency.ConcurrencyGovernor;
import com.agentfleet.concurrency.ConcurrencyPolicies;
import com.agentfleet.concurrency.SchedulingDecision;
import com.agentfleet.core.logging.MdcContext;
import com.agentfleet.core.model.Agent;
import com.agentfleet.core.model.RecoveryAction;
import com.agentfleet.core.model.SchedulingResult;
import com.agentfleet.core.model.Task;
import com.agentfleet.core.model.TaskStatus;
import com.agentfleet.quota.AgentRuntimeConfig;
import com.agentfleet.quota.FinalStatus;
import com.agentfleet.quota.RuntimeInstance;
import com.agentfleet.quota.RuntimeProperties;
import com.agentfleet.quota.RuntimeQueue;
import com.agentfleet.quota.RuntimeQueueRegistry;
import com.agentfleet.quota.RuntimeStatus;
import com.agentfleet.supervisor.AgentProcessConfig;
import com.agentfleet.supervisor.AgentProcessInfo;
import com.agentfleet.supervisor.AgentProcessSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns scheduler decisions into running work.
 *
 * <p>Per tick: the engine picks task/agent pairs, the {@link ConcurrencyGovernor} admits them,
 * each admitted task gets a {@link RuntimeInstance} in the runtime queue of its agent config and workflow,
 * and every instance the queue lets through gets a live agent process before the assignment
 * is committed to the engine. Runtime queues stay strict FIFO: when the head's task has no
 * agent this tick, nothing behind it starts either.
 *
 * <p>A governor slot is reserved at admission and released when the task completes, fails
 * or its dispatch is abandoned.
 */
@Service
public class DispatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DispatchCoordinator.class);

    private final WorkflowEngine engine;
    private final ConcurrencyGovernor governor;
    private final RuntimeQueueRegistry queues;
    private final RuntimeProperties runtimeProperties;
    private final AgentProcessSupervisor supervisor;

    private final Map<String, AgentRuntimeConfig> configs = new ConcurrentHashMap<>();
    /** Task id to the runtime instance carrying it, until the task completes or fails. */
    private final Map<String, Binding> bindings = new ConcurrentHashMap<>();

    private record Binding(String instanceId, String queueId, AgentRuntimeConfig config, boolean started) {
        Binding asStarted() {
            return new Binding(instanceId, queueId, config, true);
        }
    }

    @Autowired
    public DispatchCoordinator(WorkflowEngine engine, ConcurrencyGovernor governor, RuntimeQueueRegistry queues,
                               RuntimeProperties runtimeProperties,
                               @Autowired(required = false) AgentProcessSupervisor supervisor) {
        this.engine = engine;
        this.governor = governor;
        this.queues = queues;
        this.runtimeProperties = runtimeProperties;
        this.supervisor = supervisor;
        runtimeProperties.toConfigs().forEach(this::register);
    }

    /**
     * Registers a runtime config. Its id is matched against agent ids first, then against
     * specialist subtypes and role names in lower case.
     */
    public void register(AgentRuntimeConfig config) {
        configs.put(config.id(), config);
        log.debug("Registered runtime config {} (role {}, default quota {})",
                config.id(), config.role(), config.defaultQuota());
    }

    /**
     * Runs one engine tick and pushes its assignments through admission, the runtime queues
     * and the supervisor.
     */
    public List<DispatchOutcome> dispatch(WorkflowContext context) {
        String workflowId = context.workflowId();
        List<SchedulingResult> results = engine.tick(context);
        resumeUnblocked(context);

        List<DispatchOutcome> outcomes = new ArrayList<>();
        Map<String, SchedulingResult> candidates = new LinkedHashMap<>();
        Map<String, AgentRuntimeConfig> touched = new LinkedHashMap<>();

        for (SchedulingResult result : results) {
            if (!result.assigned()) {
                outcomes.add(new DispatchOutcome(result.taskId(), null, null,
                        DispatchOutcome.Status.UNASSIGNED, result.reason()));
                continue;
            }
            Binding binding = bindings.get(result.taskId());
            if (binding != null && binding.started()) {
                continue;
            }
            Task task = context.getTask(result.taskId());
            Agent agent = context.getAgent(result.agentId());
            if (task == null || agent == null) {
                continue;
            }

            if (binding == null) {
                AgentRuntimeConfig config = configFor(agent);
                SchedulingDecision decision = governor.evaluate(task.id(), describe(task), config.role());
                if (!decision.allowed()) {
                    log.debug("Task {} deferred: {}", task.id(), decision.reason());
                    outcomes.add(new DispatchOutcome(task.id(), agent.id(), null,
                            DispatchOutcome.Status.DEFERRED, decision.reason()));
                    continue;
                }
                governor.startTask(task.id(), describe(task), config.role());

                RuntimeQueue queue = queues.queueFor(config, workflowId);
                String instanceId = "rt-" + UUID.randomUUID().toString().substring(0, 8);
                queue.enqueue(RuntimeInstance.create(instanceId, config.id(), workflowId, task.id()), task.priority());
                binding = new Binding(instanceId, RuntimeQueueRegistry.queueId(config.id(), workflowId),
                        config, false);
                bindings.put(task.id(), binding);
            }
            candidates.put(task.id(), result);
            touched.putIfAbsent(binding.config().id(), binding.config());
        }

        for (AgentRuntimeConfig config : touched.values()) {
            drain(queues.queueFor(config, workflowId), candidates, context, outcomes);
        }

        for (SchedulingResult waiting : candidates.values()) {
            Binding binding = bindings.get(waiting.taskId());
            String position = queues.find(binding.queueId())
                    .flatMap(q -> q.getInstance(binding.instanceId()))
                    .map(i -> ConcurrencyPolicies.describeQueuePosition(
                            i.queuePosition() == null ? 0 : i.queuePosition(),
                            i.queuedCount() == null ? 0 : i.queuedCount()))
                    .orElse("Queued");
            outcomes.add(new DispatchOutcome(waiting.taskId(), waiting.agentId(), binding.instanceId(),
                    DispatchOutcome.Status.QUEUED, position));
        }
        return outcomes;
    }

    /**
     * Reports that the work for a task finished. The task moves to REVIEW and its agent is released.
     */
    public void reportCompletion(String taskId, WorkflowContext context) {
        Task task = context.getTask(taskId);
        Binding binding = bindings.remove(taskId);
        if (binding != null) {
            queues.find(binding.queueId()).ifPresent(q -> q.complete(binding.instanceId(), FinalStatus.COMPLETED));
            governor.completeTask(taskId, true);
        }
        engine.handleTaskCompletion(taskId, context);
        if (task != null && task.assignedAgent() != null) {
            engine.releaseAgent(task.assignedAgent(), context);
        }
    }

    /**
     * Reports that the work for a task failed.
     *
     * @return the engine's recovery action
     */
    public RecoveryAction reportFailure(String taskId, String errorReason, WorkflowContext context) {
        Task task = context.getTask(taskId);
        Binding binding = bindings.remove(taskId);
        if (binding != null) {
            queues.find(binding.queueId())
                    .ifPresent(q -> q.complete(binding.instanceId(), FinalStatus.FAILED, errorReason));
            governor.completeTask(taskId, false);
        }
        RecoveryAction action = engine.handleTaskFailure(taskId, context);
        if (task != null && task.assignedAgent() != null) {
            engine.releaseAgent(task.assignedAgent(), context);
        }
        return action;
    }

    /**
     * Parks a running task on a dependency. Its instance waits for input and keeps the agent.
     */
    public boolean reportBlocked(String taskId, WorkflowContext context) {
        boolean blocked = engine.handleTaskBlocked(taskId, context);
        Binding binding = bindings.get(taskId);
        if (blocked && binding != null) {
            queues.find(binding.queueId()).ifPresent(q ->
                    q.updateStatus(binding.instanceId(), RuntimeStatus.WAITING_INPUT, "Blocked on dependencies"));
        }
        return blocked;
    }

    /**
     * Records a progress summary on the task's running instance.
     */
    public boolean reportProgress(String taskId, String summary) {
        Binding binding = bindings.get(taskId);
        if (binding == null) return false;
        return queues.find(binding.queueId())
                .map(q -> q.updateStatus(binding.instanceId(), RuntimeStatus.RUNNING, summary))
                .orElse(false);
    }

    public Optional<String> instanceFor(String taskId) {
        return Optional.ofNullable(bindings.get(taskId)).map(Binding::instanceId);
    }

    AgentRuntimeConfig configFor(Agent agent) {
        AgentRuntimeConfig byId = configs.get(agent.id());
        if (byId != null) return byId;
        if (agent.specialistType() != null) {
            AgentRuntimeConfig bySpecialty = configs.get(agent.specialistType().name().toLowerCase(Locale.ROOT));
            if (bySpecialty != null) return bySpecialty;
        }
        String role = agent.role() == null ? "executor" : agent.role().name().toLowerCase(Locale.ROOT);
        return configs.computeIfAbsent(role,
                r -> AgentRuntimeConfig.of(r, r, runtimeProperties.getDefaultMaxConcurrent()));
    }

    private void drain(RuntimeQueue queue, Map<String, SchedulingResult> candidates, WorkflowContext context,
                       List<DispatchOutcome> outcomes) {
        while (true) {
            List<RuntimeInstance> waiting = queue.getQueued();
            if (waiting.isEmpty()) return;
            SchedulingResult result = candidates.get(waiting.get(0).taskId());
            if (result == null) return;
            Optional<RuntimeInstance> next = queue.tryDequeue();
            if (next.isEmpty()) return;
            candidates.remove(result.taskId());
            outcomes.add(start(queue, next.get(), result, context));
        }
    }

    private DispatchOutcome start(RuntimeQueue queue, RuntimeInstance instance, SchedulingResult result,
                                  WorkflowContext context) {
        String taskId = result.taskId();
        Binding binding = bindings.get(taskId);
        MdcContext.setTask(context.workflowId(), taskId);
        MdcContext.setAgent(result.agentId());
        try {
            Agent agent = context.getAgent(result.agentId());
            Optional<AgentProcessInfo> process;
            try {
                process = ensureProcess(agent, binding.config());
            } catch (UncheckedIOException | IllegalStateException e) {
                log.error("Agent process for {} failed to start: {}", result.agentId(), e.getMessage());
                abandon(queue, binding, taskId, "Agent process failed to start");
                return new DispatchOutcome(taskId, result.agentId(), instance.instanceId(),
                        DispatchOutcome.Status.DEFERRED, "Agent process failed to start: " + e.getMessage());
            }

            if (!engine.applyAssignment(result, context)) {
                abandon(queue, binding, taskId, "Assignment no longer valid");
                return new DispatchOutcome(taskId, result.agentId(), instance.instanceId(),
                        DispatchOutcome.Status.DEFERRED, "Assignment no longer valid");
            }

            process.ifPresent(p -> queue.attachPid(instance.instanceId(), p.pid()));
            bindings.put(taskId, binding.asStarted());
            log.info("Task {} started on {} as {}", taskId, result.agentId(), instance.instanceId());
            return new DispatchOutcome(taskId, result.agentId(), instance.instanceId(),
                    DispatchOutcome.Status.STARTED, result.reason());
        } finally {
            MdcContext.clear();
        }
    }

    private Optional<AgentProcessInfo> ensureProcess(Agent agent, AgentRuntimeConfig config) {
        if (supervisor == null || agent == null) {
            return Optional.empty();
        }
        List<String> command = !config.command().isEmpty()
                ? config.command()
                : supervisor.properties().getCommands().get(agent.id());
        if (command == null || command.isEmpty()) {
            return Optional.empty();
        }
        AgentProcessConfig processConfig = supervisor.properties()
                .toConfig(agent.id(), agent.name(), command)
                .withEnv(config.env());
        return Optional.of(supervisor.ensureRunning(processConfig));
    }

    private void abandon(RuntimeQueue queue, Binding binding, String taskId, String reason) {
        queue.complete(binding.instanceId(), FinalStatus.INTERRUPTED, reason);
        governor.releaseTask(taskId);
        bindings.remove(taskId);
    }

    private void resumeUnblocked(WorkflowContext context) {
        bindings.forEach((taskId, binding) -> {
            Task task = context.getTask(taskId);
            if (!binding.started() || task == null || task.status() != TaskStatus.IN_PROGRESS) return;
            queues.find(binding.queueId()).ifPresent(q -> q.getInstance(binding.instanceId())
                    .filter(i -> i.status() == RuntimeStatus.WAITING_INPUT)
                    .ifPresent(i -> q.updateStatus(i.instanceId(), RuntimeStatus.RUNNING, "Dependencies resolved")));
        });
    }

    private static String describe(Task task) {
        return task.description() == null ? task.title() : task.title() + " " + task.description();
    }
}
