package com.agentfleet.supervisor;

import com.agentfleet.core.events.EventBus;
import com.agentfleet.core.events.EventType;
import com.agentfleet.core.events.FleetEvent;
import com.agentfleet.core.metrics.FleetMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One supervised agent child process.
 *
 * <p>While an incarnation is alive a watchdog runs every {@code heartbeatIntervalMs}. It kills the
 * child when no heartbeat arrived within {@code heartbeatTimeoutMs} of launch, or when the latest
 * heartbeat is older than that. Heartbeats arrive through {@link #updateHeartbeat()} or as the
 * marker line on the child's stdout.
 *
 * <p>A non-zero exit that was not requested through {@link #stop(StopSignal)} is a crash. Crashes
 * are restarted after {@code restartBackoffMs} until {@code maxRestarts} is used up.
 */
public class AgentProcess {

    private static final Logger log = LoggerFactory.getLogger(AgentProcess.class);

    static final String REASON_HEARTBEAT_MISSING = "heartbeat_missing";
    static final String REASON_HEARTBEAT_TIMEOUT = "heartbeat_timeout";
    static final String REASON_STOP_GRACE_EXPIRED = "stop_grace_expired";

    private final AgentProcessConfig config;
    private final ProcessLauncher launcher;
    private final ScheduledExecutorService scheduler;
    private final EventBus eventBus;
    private final FleetMetrics metrics;
    private final Clock clock;

    private Process process;
    private AgentProcessStatus status = AgentProcessStatus.STARTING;
    private long pid;
    private Instant startTime;
    private Instant lastHeartbeat;
    private int restartCount;
    private Integer exitCode;
    private String exitReason;
    private String pendingKillReason;
    private boolean shuttingDown;
    private ScheduledFuture<?> watchdog;
    private ScheduledFuture<?> pendingRestart;
    private CompletableFuture<Void> exited = CompletableFuture.completedFuture(null);

    public AgentProcess(AgentProcessConfig config, ProcessLauncher launcher, ScheduledExecutorService scheduler,
                        EventBus eventBus, FleetMetrics metrics, Clock clock) {
        this.config = config;
        this.launcher = launcher;
        this.scheduler = scheduler;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.startTime = clock.instant();
    }

    public AgentProcess(AgentProcessConfig config, ProcessLauncher launcher, ScheduledExecutorService scheduler) {
        this(config, launcher, scheduler, null, null, Clock.systemUTC());
    }

    public AgentProcessConfig config() {
        return config;
    }

    /**
     * Launches the child.
     *
     * @throws IllegalStateException if an incarnation is already alive
     * @throws UncheckedIOException  if the OS refuses to spawn the command
     */
    public AgentProcessInfo start() {
        AgentProcessInfo info;
        synchronized (this) {
            if (process != null) {
                throw new IllegalStateException("Agent " + config.agentId() + " already running");
            }
            shuttingDown = false;
            cancelPendingRestart();
            launch();
            info = snapshot();
        }
        publish(EventType.AGENT_PROCESS_STARTED, Map.of("pid", info.pid(), "restartCount", info.restartCount()));
        return info;
    }

    /**
     * Stops the child. The returned future completes once the process has actually exited.
     * A graceful stop escalates to a forced kill after {@code stopGraceMs}.
     */
    public CompletableFuture<Void> stop(StopSignal signal) {
        Process target;
        CompletableFuture<Void> done;
        synchronized (this) {
            shuttingDown = true;
            if (cancelPendingRestart()) {
                status = AgentProcessStatus.STOPPED;
            }
            if (process == null) {
                return CompletableFuture.completedFuture(null);
            }
            cancelWatchdog();
            target = process;
            done = exited;
        }

        log.info("Stopping agent process {} ({})", config.agentId(), signal);
        if (signal == StopSignal.FORCE) {
            destroyTree(target, true);
        } else {
            destroyTree(target, false);
            ScheduledFuture<?> escalation = scheduler.schedule(() -> {
                if (target.isAlive()) {
                    log.warn("Agent {} did not exit within {}ms, forcing kill", config.agentId(), config.stopGraceMs());
                    if (metrics != null) {
                        metrics.recordProcessKill(config.agentId(), REASON_STOP_GRACE_EXPIRED);
                    }
                    destroyTree(target, true);
                }
            }, config.stopGraceMs(), TimeUnit.MILLISECONDS);
            done.whenComplete((v, t) -> escalation.cancel(false));
        }
        return done;
    }

    /**
     * Records a liveness signal from the child.
     */
    public synchronized void updateHeartbeat() {
        lastHeartbeat = clock.instant();
        log.debug("Heartbeat received from {}", config.agentId());
    }

    public synchronized AgentProcessInfo getInfo() {
        return snapshot();
    }

    public synchronized boolean isRunning() {
        return process != null && status == AgentProcessStatus.RUNNING;
    }

    /**
     * True while a child is alive or a restart is scheduled.
     */
    public synchronized boolean isActive() {
        return process != null || pendingRestart != null;
    }

    /**
     * Launches a crashed process again on demand. The relaunch is charged to the same
     * restart budget as automatic restarts.
     *
     * @throws IllegalStateException if the process is not CRASHED or its budget is spent
     * @throws UncheckedIOException  if the OS refuses to spawn the command
     */
    public AgentProcessInfo relaunch() {
        AgentProcessInfo info;
        synchronized (this) {
            if (process != null || status != AgentProcessStatus.CRASHED) {
                throw new IllegalStateException("Agent " + config.agentId() + " is " + status + ", not crashed");
            }
            if (restartCount >= config.maxRestarts()) {
                throw new IllegalStateException("Agent " + config.agentId() + " exceeded max restarts ("
                        + config.maxRestarts() + ")");
            }
            restartCount++;
            shuttingDown = false;
            log.info("Relaunching crashed agent: {} (attempt {})", config.agentId(), restartCount);
            launch();
            info = snapshot();
        }
        publish(EventType.AGENT_PROCESS_STARTED, Map.of("pid", info.pid(), "restartCount", info.restartCount()));
        if (metrics != null) {
            metrics.recordProcessRestart(config.agentId());
        }
        return info;
    }

    /**
     * Destroys the current incarnation and its descendants without waiting. Used on JVM shutdown.
     */
    void destroyNow() {
        Process target;
        synchronized (this) {
            shuttingDown = true;
            cancelPendingRestart();
            cancelWatchdog();
            target = process;
        }
        if (target != null) {
            destroyTree(target, true);
        }
    }

    // Must hold the monitor.
    private void launch() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("AGENT_ID", config.agentId());
        env.put("AGENT_NAME", config.agentName());
        env.put("DAEMON_PID", String.valueOf(ProcessHandle.current().pid()));
        env.put("HEARTBEAT_INTERVAL_MS", String.valueOf(config.heartbeatIntervalMs()));
        env.putAll(config.env());

        log.info("Starting agent process: {}", config.agentId());
        Process launched;
        try {
            launched = launcher.launch(config.command(), env);
        } catch (IOException e) {
            status = AgentProcessStatus.CRASHED;
            throw new UncheckedIOException("Failed to spawn agent " + config.agentId(), e);
        }

        process = launched;
        pid = launched.pid();
        status = AgentProcessStatus.RUNNING;
        startTime = clock.instant();
        lastHeartbeat = null;
        exitCode = null;
        exitReason = null;
        pendingKillReason = null;
        exited = new CompletableFuture<>();

        pump(launched.getInputStream(), "stdout", true);
        pump(launched.getErrorStream(), "stderr", false);

        long interval = Math.max(1, config.heartbeatIntervalMs());
        watchdog = scheduler.scheduleAtFixedRate(this::checkHeartbeat, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Agent process started: {} (PID: {})", config.agentId(), pid);

        // Registered last: the callback may run inline when the child is already gone.
        launched.onExit().whenComplete((p, t) -> handleExit(launched));
    }

    private void checkHeartbeat() {
        Process target;
        String reason;
        long elapsed;
        synchronized (this) {
            if (process == null || pendingKillReason != null) {
                return;
            }
            Instant now = clock.instant();
            Instant reference = lastHeartbeat != null ? lastHeartbeat : startTime;
            elapsed = Duration.between(reference, now).toMillis();
            if (elapsed <= config.heartbeatTimeoutMs()) {
                return;
            }
            reason = lastHeartbeat == null ? REASON_HEARTBEAT_MISSING : REASON_HEARTBEAT_TIMEOUT;
            pendingKillReason = reason;
            cancelWatchdog();
            target = process;
        }

        if (REASON_HEARTBEAT_MISSING.equals(reason)) {
            log.error("Agent {} never sent heartbeat within {}ms, killing", config.agentId(), config.heartbeatTimeoutMs());
        } else {
            log.error("Agent {} heartbeat timeout ({}ms), killing", config.agentId(), elapsed);
        }
        if (metrics != null) {
            metrics.recordProcessKill(config.agentId(), reason);
        }
        destroyTree(target, true);
    }

    private void handleExit(Process exitedProcess) {
        AgentProcessInfo info;
        CompletableFuture<Void> done;
        boolean restart = false;
        synchronized (this) {
            if (exitedProcess != process) {
                return;
            }
            cancelWatchdog();
            process = null;
            exitCode = exitedProcess.exitValue();
            exitReason = pendingKillReason;

            boolean crash = exitCode != 0;
            status = crash && !shuttingDown ? AgentProcessStatus.CRASHED : AgentProcessStatus.STOPPED;
            log.info("Agent process exited: {} (code: {}, reason: {})", config.agentId(), exitCode, exitReason);

            if (!shuttingDown && config.autoRestart() && crash) {
                if (restartCount < config.maxRestarts()) {
                    restartCount++;
                    status = AgentProcessStatus.RESTARTING;
                    restart = true;
                    log.info("Auto-restarting agent: {} (attempt {})", config.agentId(), restartCount);
                    pendingRestart = scheduler.schedule(this::restart, config.restartBackoffMs(), TimeUnit.MILLISECONDS);
                } else {
                    log.error("Agent {} exceeded max restarts ({})", config.agentId(), config.maxRestarts());
                }
            }
            info = snapshot();
            done = exited;
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("exitCode", info.exitCode());
        payload.put("status", info.status().name().toLowerCase(Locale.ROOT));
        payload.put("restartCount", info.restartCount());
        if (info.exitReason() != null) {
            payload.put("reason", info.exitReason());
        }
        publish(EventType.AGENT_PROCESS_EXITED, payload);
        if (restart && metrics != null) {
            metrics.recordProcessRestart(config.agentId());
        }
        done.complete(null);
    }

    private void restart() {
        AgentProcessInfo info;
        synchronized (this) {
            pendingRestart = null;
            if (shuttingDown || status != AgentProcessStatus.RESTARTING || process != null) {
                return;
            }
            try {
                launch();
            } catch (UncheckedIOException e) {
                log.error("Restart of agent {} failed: {}", config.agentId(), e.getMessage(), e);
                return;
            }
            info = snapshot();
        }
        publish(EventType.AGENT_PROCESS_STARTED, Map.of("pid", info.pid(), "restartCount", info.restartCount()));
    }

    private void pump(InputStream stream, String name, boolean stdout) {
        Thread t = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    String trimmed = line.trim();
                    if (stdout && trimmed.equals(config.heartbeatMarker())) {
                        updateHeartbeat();
                    } else if (stdout) {
                        log.debug("[{}] stdout: {}", config.agentId(), trimmed);
                    } else {
                        log.warn("[{}] stderr: {}", config.agentId(), trimmed);
                    }
                }
            } catch (IOException e) {
                log.debug("[{}] {} closed: {}", config.agentId(), name, e.getMessage());
            }
        }, "agent-" + config.agentId() + "-" + name);
        t.setDaemon(true);
        t.start();
    }

    private static void destroyTree(Process target, boolean force) {
        if (force) {
            target.descendants().forEach(ProcessHandle::destroyForcibly);
            target.destroyForcibly();
        } else {
            target.descendants().forEach(ProcessHandle::destroy);
            target.destroy();
        }
    }

    private void cancelWatchdog() {
        if (watchdog != null) {
            watchdog.cancel(false);
            watchdog = null;
        }
    }

    private boolean cancelPendingRestart() {
        if (pendingRestart != null) {
            pendingRestart.cancel(false);
            pendingRestart = null;
            return true;
        }
        return false;
    }

    private AgentProcessInfo snapshot() {
        return new AgentProcessInfo(pid, config.agentId(), status, startTime, lastHeartbeat,
                restartCount, exitCode, exitReason);
    }

    private void publish(EventType type, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(FleetEvent.of(type, null, config.agentId(), payload));
        }
    }
}
