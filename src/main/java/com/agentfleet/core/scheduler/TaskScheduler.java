package com.agentfleet.core.scheduler;

import com.agentfleet.core.model.Agent;
import com.agentfleet.core.model.SchedulingResult;
import com.agentfleet.core.model.Task;
import com.agentfleet.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pairs ready tasks with idle agents.
 *
 * <p>A task is ready when it is OPEN or IN_PROGRESS and every dependency is CLOSED.
 * Ready tasks are ordered non-main-path first, then by priority descending, so
 * supporting work is dispatched ahead of the critical path. Each task is offered
 * agents whose role matches its preferred role, expanded through
 * {@link #ROLE_SUBSTITUTES}. An agent is handed out at most once per call, and an
 * IN_PROGRESS task whose agent still holds it is reported against that agent.
 */
@Service
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    static final Map<String, List<String>> ROLE_SUBSTITUTES = Map.of(
            "executor", List.of("executor", "orchestrator"),
            "architect", List.of("architect", "orchestrator"),
            "tester", List.of("tester", "executor"),
            "docwriter", List.of("docwriter", "executor"),
            "reviewer", List.of("reviewer", "orchestrator"),
            "orchestrator", List.of("orchestrator")
    );

    static final Comparator<Task> DISPATCH_ORDER = Comparator
            .comparing(Task::mainPath)
            .thenComparing(Comparator.comparingInt((Task t) -> t.priority()).reversed());

    /**
     * Computes assignments for the given snapshot. Pure query: nothing passed in is mutated.
     *
     * @return one result per ready task, in dispatch order
     */
    public List<SchedulingResult> schedule(List<Task> tasks, List<Agent> agents) {
        List<Task> ready = readyTasks(tasks);
        var claimed = new HashSet<String>();
        var results = new ArrayList<SchedulingResult>(ready.size());

        for (Task task : ready) {
            Agent owner = currentOwner(task, agents);
            if (owner != null) {
                claimed.add(owner.id());
                results.add(new SchedulingResult(task.id(), owner.id(), "Already running on " + owner.id()));
                continue;
            }
            Agent agent = findAgent(task, agents, claimed);
            if (agent != null) {
                claimed.add(agent.id());
                results.add(new SchedulingResult(task.id(), agent.id(),
                        "Assigned to " + agent.role().name().toLowerCase(Locale.ROOT) + " agent"));
                log.debug("  {} -> {} ({})", task.id(), agent.id(), agent.role());
            } else {
                results.add(new SchedulingResult(task.id(), null, "No suitable agent available"));
                log.debug("  {} -> no suitable agent", task.id());
            }
        }

        log.info("schedule: {} tasks, {} ready, {} assigned", tasks.size(), ready.size(), claimed.size());
        return results;
    }

    /**
     * Ready tasks in dispatch order.
     */
    public List<Task> readyTasks(List<Task> tasks) {
        Set<String> closedIds = tasks.stream()
                .filter(t -> t.status() == TaskStatus.CLOSED)
                .map(Task::id)
                .collect(Collectors.toSet());

        return tasks.stream()
                .filter(t -> t.status() == TaskStatus.OPEN || t.status() == TaskStatus.IN_PROGRESS)
                .filter(t -> closedIds.containsAll(t.dependencies()))
                .sorted(DISPATCH_ORDER)
                .toList();
    }

    /**
     * Preferred role for a task: its explicit {@code requiredRole} when set,
     * otherwise a best-effort guess from the title.
     */
    public String preferredRole(Task task) {
        if (task.requiredRole() != null && !task.requiredRole().isBlank()) {
            return task.requiredRole().toLowerCase(Locale.ROOT);
        }
        return inferRoleFromTitle(task.title());
    }

    static String inferRoleFromTitle(String title) {
        String t = title == null ? "" : title.toLowerCase(Locale.ROOT);
        if (t.contains("review")) return "reviewer";
        if (t.contains("test")) return "tester";
        if (t.contains("design") || t.contains("architect")) return "architect";
        if (t.contains("doc")) return "docwriter";
        return "executor";
    }

    /**
     * The agent already working on an IN_PROGRESS task, if it is still bound to it.
     */
    private static Agent currentOwner(Task task, List<Agent> agents) {
        if (task.status() != TaskStatus.IN_PROGRESS || task.assignedAgent() == null) {
            return null;
        }
        for (Agent agent : agents) {
            if (agent.id().equals(task.assignedAgent()) && task.id().equals(agent.currentTask())) {
                return agent;
            }
        }
        return null;
    }

    private Agent findAgent(Task task, List<Agent> agents, Set<String> claimed) {
        String preferred = preferredRole(task);
        var candidates = new LinkedHashSet<>(ROLE_SUBSTITUTES.getOrDefault(preferred, List.of(preferred)));

        for (String role : candidates) {
            for (Agent agent : agents) {
                if (agent.isIdle() && !claimed.contains(agent.id()) && agent.serves(role)) {
                    return agent;
                }
            }
        }
        return null;
    }
}
