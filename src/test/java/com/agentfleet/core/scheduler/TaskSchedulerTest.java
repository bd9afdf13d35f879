package com.agentfleet.core.scheduler;

import com.agentfleet.core.model.Agent;
import com.agentfleet.core.model.AgentRole;
import com.agentfleet.core.model.AgentStatus;
import com.agentfleet.core.model.SchedulingResult;
import com.agentfleet.core.model.SpecialistType;
import com.agentfleet.core.model.Task;
import com.agentfleet.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskSchedulerTest {

    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new TaskScheduler();
    }

    private static Task task(String id, String title, List<String> deps) {
        return Task.open(id, title, 0, false, deps);
    }

    private static Task closed(Task task) {
        return task.withStatus(TaskStatus.CLOSED, task.retryCount(), Instant.now());
    }

    @Test
    @DisplayName("A then B: only A is ready until A closes, then B goes to the same executor")
    void dependencyChainUnfolds() {
        Task a = task("A", "Implement parser", List.of());
        Task b = task("B", "Implement lexer", List.of("A"));
        Agent executor = Agent.idle("exec-1", AgentRole.EXECUTOR);

        List<SchedulingResult> first = scheduler.schedule(List.of(a, b), List.of(executor));
        assertEquals(1, first.size());
        assertEquals("A", first.get(0).taskId());
        assertEquals("exec-1", first.get(0).agentId());

        List<SchedulingResult> second = scheduler.schedule(List.of(closed(a), b), List.of(executor));
        assertEquals(1, second.size());
        assertEquals("B", second.get(0).taskId());
        assertEquals("exec-1", second.get(0).agentId());
    }

    @Test
    @DisplayName("Non-main-path tasks come first, then priority descending")
    void dispatchOrder() {
        Task main = Task.open("MAIN", "Implement core", 10, true, List.of());
        Task low = Task.open("LOW", "Implement helper", 1, false, List.of());
        Task high = Task.open("HIGH", "Implement util", 9, false, List.of());

        List<Task> ready = scheduler.readyTasks(List.of(main, low, high));

        assertEquals(List.of("HIGH", "LOW", "MAIN"), ready.stream().map(Task::id).toList());
    }

    @Test
    @DisplayName("Only OPEN and IN_PROGRESS tasks are ready")
    void readyStatuses() {
        Task open = task("OPEN", "Implement a", List.of());
        Task review = task("REVIEW", "Implement b", List.of()).withStatus(TaskStatus.REVIEW, 0, Instant.now());
        Task failed = task("FAILED", "Implement c", List.of()).withStatus(TaskStatus.FAILED, 0, Instant.now());
        Task running = task("RUN", "Implement d", List.of()).withStatus(TaskStatus.IN_PROGRESS, 0, Instant.now());

        var ids = scheduler.readyTasks(List.of(open, review, failed, running)).stream().map(Task::id).toList();
        assertEquals(2, ids.size());
        assertTrue(ids.containsAll(List.of("OPEN", "RUN")));
    }

    @Test
    @DisplayName("Dependencies on unknown ids keep a task waiting")
    void unknownDependencyNotReady() {
        assertTrue(scheduler.readyTasks(List.of(task("A", "Implement", List.of("GHOST")))).isEmpty());
    }

    @Test
    @DisplayName("One idle agent is never handed to two tasks in the same call")
    void noDoubleAssignment() {
        Task a = task("A", "Implement a", List.of());
        Task b = task("B", "Implement b", List.of());
        Agent executor = Agent.idle("exec-1", AgentRole.EXECUTOR);

        List<SchedulingResult> results = scheduler.schedule(List.of(a, b), List.of(executor));

        assertEquals(2, results.size());
        assertEquals(1, results.stream().filter(SchedulingResult::assigned).count());
        SchedulingResult unassigned = results.stream().filter(r -> !r.assigned()).findFirst().orElseThrow();
        assertEquals("No suitable agent available", unassigned.reason());
    }

    @Test
    @DisplayName("Busy agents are skipped")
    void busyAgentSkipped() {
        Agent busy = new Agent("exec-1", "exec-1", AgentRole.EXECUTOR, null, AgentStatus.BUSY,
                List.of(), "OTHER", null);
        List<SchedulingResult> results = scheduler.schedule(
                List.of(task("A", "Implement", List.of())), List.of(busy));
        assertFalse(results.get(0).assigned());
    }

    @Test
    @DisplayName("Tester work falls back to an executor when no tester is idle")
    void roleSubstitution() {
        Agent executor = Agent.idle("exec-1", AgentRole.EXECUTOR);
        List<SchedulingResult> results = scheduler.schedule(
                List.of(task("T", "Write test suite", List.of())), List.of(executor));

        assertEquals("exec-1", results.get(0).agentId());
    }

    @Test
    @DisplayName("A matching specialist wins over a substitute")
    void specialistPreferred() {
        Agent executor = Agent.idle("exec-1", AgentRole.EXECUTOR);
        Agent tester = Agent.idleSpecialist("tester-1", SpecialistType.TESTER);

        List<SchedulingResult> results = scheduler.schedule(
                List.of(task("T", "Write test suite", List.of())), List.of(executor, tester));

        assertEquals("tester-1", results.get(0).agentId());
    }

    @Test
    @DisplayName("Explicit requiredRole takes precedence over the title")
    void requiredRoleWins() {
        Task task = task("R", "Write test suite", List.of()).withRequiredRole("REVIEWER");
        Agent executor = Agent.idle("exec-1", AgentRole.EXECUTOR);
        Agent reviewer = Agent.idle("rev-1", AgentRole.REVIEWER);

        assertEquals("reviewer", scheduler.preferredRole(task));
        assertEquals("rev-1", scheduler.schedule(List.of(task), List.of(executor, reviewer)).get(0).agentId());
    }

    @Test
    @DisplayName("Title inference covers review, test, design, doc and the executor default")
    void titleInference() {
        assertEquals("reviewer", TaskScheduler.inferRoleFromTitle("Review the PR"));
        assertEquals("tester", TaskScheduler.inferRoleFromTitle("Add tests"));
        assertEquals("architect", TaskScheduler.inferRoleFromTitle("Design storage"));
        assertEquals("docwriter", TaskScheduler.inferRoleFromTitle("Update docs"));
        assertEquals("executor", TaskScheduler.inferRoleFromTitle("Implement parser"));
        assertEquals("executor", TaskScheduler.inferRoleFromTitle(null));
    }

    @Test
    @DisplayName("schedule does not mutate its inputs")
    void pureQuery() {
        Task a = task("A", "Implement", List.of());
        Agent executor = Agent.idle("exec-1", AgentRole.EXECUTOR);

        scheduler.schedule(List.of(a), List.of(executor));

        assertEquals(TaskStatus.OPEN, a.status());
        assertTrue(executor.isIdle());
    }

    @Test
    @DisplayName("A running task keeps its owner and does not take another idle agent")
    void runningTaskKeepsOwner() {
        Task running = task("A", "Implement a", List.of())
                .withStatus(TaskStatus.IN_PROGRESS, 0, Instant.now())
                .withAssignedAgent("exec-1");
        Task waiting = task("B", "Implement b", List.of());
        Agent owner = Agent.idle("exec-1", AgentRole.EXECUTOR).busyWith("A");
        Agent idle = Agent.idle("exec-2", AgentRole.EXECUTOR);

        List<SchedulingResult> results = scheduler.schedule(List.of(running, waiting), List.of(owner, idle));

        assertEquals("exec-1", results.stream().filter(r -> r.taskId().equals("A")).findFirst().orElseThrow().agentId());
        assertEquals("exec-2", results.stream().filter(r -> r.taskId().equals("B")).findFirst().orElseThrow().agentId());
    }
}
