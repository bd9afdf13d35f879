package com.agentfleet.dispatch.cli;

import com.agentfleet.core.engine.WorkflowContext;
import com.agentfleet.core.engine.WorkflowEngine;
import com.agentfleet.core.model.Agent;
import com.agentfleet.core.model.AgentRole;
import com.agentfleet.core.model.AgentStatus;
import com.agentfleet.core.model.SchedulingResult;
import com.agentfleet.core.model.SpecialistType;
import com.agentfleet.core.model.Task;
import com.agentfleet.core.model.TaskStatus;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI command: agentfleet schedule &lt;tasks.json&gt; --agents &lt;agents.json&gt;
 * <p>
 * Dry-runs the workflow engine over a plan. Each tick applies the scheduler's assignments;
 * with {@code --complete} (the default) every task started in a tick is completed and approved
 * before the next one, so dependency chains unfold tick by tick.
 */
@Command(name = "schedule", mixinStandardHelpOptions = true,
        description = "Simulate scheduling ticks over a task plan")
@Component
public class ScheduleCommand implements Callable<Integer> {

    /** Plan entry as read from the tasks file. */
    public record PlannedTask(String id, String title, String description, Integer priority,
                              Boolean mainPath, List<String> dependencies, String requiredRole) {
        Task toTask() {
            Instant now = Instant.now();
            return new Task(id, title, description == null ? "" : description,
                    priority == null ? 0 : priority, TaskStatus.OPEN, Boolean.TRUE.equals(mainPath),
                    dependencies, null, requiredRole, 0, now, now, List.of());
        }
    }

    /** Agent entry as read from the agents file. */
    public record PlannedAgent(String id, String name, String role, String specialistType) {
        Agent toAgent() {
            AgentRole agentRole = role == null ? AgentRole.EXECUTOR : AgentRole.valueOf(role.toUpperCase(Locale.ROOT));
            SpecialistType specialty = specialistType == null ? null
                    : SpecialistType.valueOf(specialistType.toUpperCase(Locale.ROOT));
            return new Agent(id, name == null ? id : name, agentRole, specialty, AgentStatus.IDLE,
                    List.of(), null, null);
        }
    }

    @Parameters(index = "0", description = "JSON array of tasks")
    private File tasksFile;

    @Option(names = {"--agents", "-a"}, required = true, description = "JSON array of agents")
    private File agentsFile;

    @Option(names = {"--ticks", "-t"}, defaultValue = "10", description = "Maximum ticks to run")
    private int ticks;

    @Option(names = "--complete", negatable = true, defaultValue = "true",
            description = "Complete and approve started tasks after each tick")
    private boolean complete;

    private final WorkflowEngine engine;
    private final ObjectMapper objectMapper;

    public ScheduleCommand(WorkflowEngine engine, ObjectMapper objectMapper) {
        this.engine = engine;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<Task> tasks;
        List<Agent> agents;
        try {
            tasks = objectMapper.readValue(tasksFile, new TypeReference<List<PlannedTask>>() {})
                    .stream().map(PlannedTask::toTask).toList();
            agents = objectMapper.readValue(agentsFile, new TypeReference<List<PlannedAgent>>() {})
                    .stream().map(PlannedAgent::toAgent).toList();
        } catch (IOException | IllegalArgumentException e) {
            ConsoleOutput.error("Could not read plan: " + e.getMessage());
            return 2;
        }

        WorkflowContext context = new WorkflowContext("cli-" + System.currentTimeMillis(), tasks, agents);
        ConsoleOutput.info(tasks.size() + " tasks, " + agents.size() + " agents");
        int closed = simulate(context, ticks, complete);

        System.out.println("──────────────────────────────────");
        if (closed == tasks.size()) {
            ConsoleOutput.success("All " + closed + " tasks closed");
            return 0;
        }
        ConsoleOutput.info(closed + "/" + tasks.size() + " tasks closed after " + ticks + " ticks");
        return 1;
    }

    /**
     * Runs up to {@code maxTicks} ticks.
     *
     * @return number of CLOSED tasks at the end
     */
    int simulate(WorkflowContext context, int maxTicks, boolean completeStarted) {
        boolean wasRunning = engine.isRunning();
        engine.start();
        try {
            for (int tick = 1; tick <= maxTicks; tick++) {
                if (context.tasks().stream().allMatch(t -> t.status() == TaskStatus.CLOSED)) {
                    break;
                }
                List<SchedulingResult> results = engine.tick(context);
                ConsoleOutput.tick(tick, results.size());

                List<SchedulingResult> started = new ArrayList<>();
                for (SchedulingResult result : results) {
                    ConsoleOutput.decision(result);
                    if (engine.applyAssignment(result, context)) {
                        started.add(result);
                    }
                }
                if (completeStarted) {
                    for (SchedulingResult result : started) {
                        engine.handleTaskCompletion(result.taskId(), context);
                        engine.handleReviewDecision(result.taskId(), true, context);
                        engine.releaseAgent(result.agentId(), context);
                    }
                }
            }
        } finally {
            if (!wasRunning) {
                engine.stop();
            }
        }
        return (int) context.tasks().stream().filter(t -> t.status() == TaskStatus.CLOSED).count();
    }
}
