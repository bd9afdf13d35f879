package com.agentfleet.core.health;

import com.agentfleet.ask.AskManager;
import com.agentfleet.concurrency.ConcurrencyGovernor;
import com.agentfleet.concurrency.ConcurrencyStats;
import com.agentfleet.core.engine.WorkflowEngine;
import com.agentfleet.quota.RuntimeQueueRegistry;
import com.agentfleet.quota.RuntimeQueueStats;
import com.agentfleet.supervisor.AgentProcessInfo;
import com.agentfleet.supervisor.AgentProcessStatus;
import com.agentfleet.supervisor.AgentProcessSupervisor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final WorkflowEngine engine;
    private final AgentProcessSupervisor supervisor;
    private final RuntimeQueueRegistry queues;
    private final ConcurrencyGovernor governor;
    private final AskManager askManager;

    public HealthCheckService(
            @Autowired(required = false) WorkflowEngine engine,
            @Autowired(required = false) AgentProcessSupervisor supervisor,
            @Autowired(required = false) RuntimeQueueRegistry queues,
            @Autowired(required = false) ConcurrencyGovernor governor,
            @Autowired(required = false) AskManager askManager) {
        this.engine = engine;
        this.supervisor = supervisor;
        this.queues = queues;
        this.governor = governor;
        this.askManager = askManager;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkEngine());
        results.add(checkProcesses());
        results.add(checkQueues());
        results.add(checkConcurrency());
        results.add(checkAsks());
        return results;
    }

    private HealthStatus checkEngine() {
        if (engine == null) {
            return new HealthStatus("engine", HealthStatus.Status.DOWN, "Workflow engine not available", Map.of());
        }
        return engine.isRunning()
                ? new HealthStatus("engine", HealthStatus.Status.UP, "Workflow engine running", Map.of())
                : new HealthStatus("engine", HealthStatus.Status.DEGRADED, "Workflow engine stopped", Map.of());
    }

    private HealthStatus checkProcesses() {
        if (supervisor == null) {
            return new HealthStatus("processes", HealthStatus.Status.DOWN, "No process supervisor configured", Map.of());
        }
        List<AgentProcessInfo> processes = supervisor.list();
        long crashed = processes.stream().filter(p -> p.status() == AgentProcessStatus.CRASHED).count();
        long running = processes.stream().filter(p -> p.status() == AgentProcessStatus.RUNNING).count();
        Map<String, String> metadata = Map.of(
                "total", String.valueOf(processes.size()),
                "running", String.valueOf(running),
                "crashed", String.valueOf(crashed));
        if (crashed > 0) {
            return new HealthStatus("processes", HealthStatus.Status.DEGRADED,
                    crashed + " agent process(es) crashed", metadata);
        }
        return new HealthStatus("processes", HealthStatus.Status.UP,
                running + " agent process(es) running", metadata);
    }

    private HealthStatus checkQueues() {
        if (queues == null) {
            return new HealthStatus("runtime-queues", HealthStatus.Status.DOWN, "No runtime queues", Map.of());
        }
        Map<String, RuntimeQueueStats> stats = queues.stats();
        int queued = stats.values().stream().mapToInt(RuntimeQueueStats::queued).sum();
        int active = stats.values().stream().mapToInt(RuntimeQueueStats::active).sum();
        return new HealthStatus("runtime-queues", HealthStatus.Status.UP,
                active + " active, " + queued + " queued across " + stats.size() + " queue(s)",
                Map.of("active", String.valueOf(active), "queued", String.valueOf(queued)));
    }

    private HealthStatus checkConcurrency() {
        if (governor == null) {
            return new HealthStatus("concurrency", HealthStatus.Status.DOWN, "No concurrency governor", Map.of());
        }
        ConcurrencyStats stats = governor.getStats();
        Map<String, String> metadata = Map.of(
                "active", String.valueOf(stats.activeTasks()),
                "degradations", String.valueOf(stats.degradationCount()));
        if (stats.degraded()) {
            return new HealthStatus("concurrency", HealthStatus.Status.DEGRADED,
                    "Degraded: concurrency ceiling lowered", metadata);
        }
        return new HealthStatus("concurrency", HealthStatus.Status.UP,
                stats.activeTasks() + "/" + governor.getPolicy().globalMaxConcurrency() + " slots in use", metadata);
    }

    private HealthStatus checkAsks() {
        if (askManager == null) {
            return new HealthStatus("asks", HealthStatus.Status.DOWN, "Ask manager not available", Map.of());
        }
        int pending = askManager.pendingCount();
        return new HealthStatus("asks", HealthStatus.Status.UP, pending + " pending ask(s)",
                Map.of("pending", String.valueOf(pending)));
    }
}
