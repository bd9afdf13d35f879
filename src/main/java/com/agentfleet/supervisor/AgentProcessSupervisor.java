package com.agentfleet.supervisor;

import com.agentfleet.core.events.EventBus;
import com.agentfleet.core.metrics.FleetMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry of supervised agent processes keyed by agent id.
 *
 * <p>Children are never detached: they are stopped when the Spring context closes, and a JVM
 * shutdown hook force-kills whatever is still alive (descendants included) if the context never
 * gets the chance.
 */
@Service
public class AgentProcessSupervisor {

    private static final Logger log = LoggerFactory.getLogger(AgentProcessSupervisor.class);

    private final SupervisorProperties properties;
    private final EventBus eventBus;
    private final FleetMetrics metrics;
    private final ProcessLauncher launcher;
    private final ConcurrentHashMap<String, AgentProcess> processes = new ConcurrentHashMap<>();

    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2, schedulerThreads());
    private final Thread shutdownHook = new Thread(this::destroyAllNow, "agent-supervisor-shutdown");

    @Autowired
    public AgentProcessSupervisor(SupervisorProperties properties, EventBus eventBus,
                                  @Autowired(required = false) FleetMetrics metrics) {
        this(properties, eventBus, metrics, ProcessLauncher.system());
    }

    AgentProcessSupervisor(SupervisorProperties properties, EventBus eventBus, FleetMetrics metrics,
                           ProcessLauncher launcher) {
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.launcher = launcher;
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    public SupervisorProperties properties() {
        return properties;
    }

    /**
     * Starts a process for the config's agent id.
     *
     * @throws IllegalStateException if that agent already has a live process or a pending restart
     */
    public synchronized AgentProcessInfo start(AgentProcessConfig config) {
        AgentProcess existing = processes.get(config.agentId());
        if (existing != null && existing.isActive()) {
            throw new IllegalStateException("Agent " + config.agentId() + " already running");
        }
        AgentProcess process = new AgentProcess(config, launcher, scheduler, eventBus, metrics, Clock.systemUTC());
        processes.put(config.agentId(), process);
        return process.start();
    }

    /**
     * Returns the live process for the agent, starting one when there is none. A crashed
     * process is relaunched in place so its restart budget carries over.
     *
     * @throws IllegalStateException if the agent crashed and its restart budget is spent
     */
    public synchronized AgentProcessInfo ensureRunning(AgentProcessConfig config) {
        AgentProcess existing = processes.get(config.agentId());
        if (existing != null) {
            if (existing.isActive()) {
                return existing.getInfo();
            }
            if (existing.getInfo().status() == AgentProcessStatus.CRASHED) {
                return existing.relaunch();
            }
        }
        return start(config);
    }

    /**
     * @throws IllegalArgumentException for an unknown agent id
     */
    public CompletableFuture<Void> stop(String agentId, StopSignal signal) {
        return require(agentId).stop(signal);
    }

    /**
     * @return false when no process is registered for the agent
     */
    public boolean updateHeartbeat(String agentId) {
        AgentProcess process = processes.get(agentId);
        if (process == null) {
            log.debug("Heartbeat for unknown agent {}", agentId);
            return false;
        }
        process.updateHeartbeat();
        return true;
    }

    public Optional<AgentProcessInfo> info(String agentId) {
        return Optional.ofNullable(processes.get(agentId)).map(AgentProcess::getInfo);
    }

    public List<AgentProcessInfo> list() {
        return processes.values().stream()
                .map(AgentProcess::getInfo)
                .sorted(Comparator.comparing(AgentProcessInfo::agentId))
                .toList();
    }

    /**
     * Gracefully stops every child, waiting at most the longest grace window plus a second.
     */
    @PreDestroy
    public void stopAll() {
        long grace = processes.values().stream()
                .mapToLong(p -> p.config().stopGraceMs())
                .max().orElse(0);
        CompletableFuture<?>[] stops = processes.values().stream()
                .map(p -> p.stop(StopSignal.GRACEFUL))
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(stops).get(grace + 1000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Agent processes did not all stop cleanly: {}", e.getMessage());
            destroyAllNow();
        }
        scheduler.shutdownNow();
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, hook stays registered");
        }
        log.info("Agent process supervisor stopped ({} processes)", stops.length);
    }

    /**
     * Daemon threads named {@code agent-supervisor-1}, {@code agent-supervisor-2} and so on.
     */
    static ThreadFactory schedulerThreads() {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "agent-supervisor-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private void destroyAllNow() {
        processes.values().forEach(AgentProcess::destroyNow);
    }

    private AgentProcess require(String agentId) {
        AgentProcess process = processes.get(agentId);
        if (process == null) {
            throw new IllegalArgumentException("Unknown agent process: " + agentId);
        }
        return process;
    }
}
