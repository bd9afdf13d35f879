package com.agentfleet.core.engine;

import com.agentfleet.core.model.Agent;
import com.agentfleet.core.model.Task;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable task and agent state for one workflow, fed into {@link WorkflowEngine#tick}.
 * Insertion order is preserved so scheduling is deterministic.
 *
 * <p>Single-writer: callers that share a context across threads must serialize access.
 */
public class WorkflowContext {

    private final String workflowId;
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<String, Agent> agents = new LinkedHashMap<>();

    public WorkflowContext(String workflowId) {
        this.workflowId = workflowId;
    }

    public WorkflowContext(String workflowId, Collection<Task> tasks, Collection<Agent> agents) {
        this(workflowId);
        tasks.forEach(this::putTask);
        agents.forEach(this::putAgent);
    }

    public String workflowId() { return workflowId; }

    public Task getTask(String taskId) { return tasks.get(taskId); }

    public void putTask(Task task) { tasks.put(task.id(), task); }

    public Agent getAgent(String agentId) { return agents.get(agentId); }

    public void putAgent(Agent agent) { agents.put(agent.id(), agent); }

    public List<Task> tasks() { return new ArrayList<>(tasks.values()); }

    public List<Agent> agents() { return new ArrayList<>(agents.values()); }
}
