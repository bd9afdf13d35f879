package com.agentfleet.supervisor;

import java.util.List;
import java.util.Map;

/**
 * Launch and supervision settings for one agent process.
 *
 * @param agentId             identity injected as {@code AGENT_ID}
 * @param agentName           display name injected as {@code AGENT_NAME}
 * @param command             program and arguments
 * @param env                 extra environment, applied after the injected identity
 * @param heartbeatIntervalMs how often the watchdog checks liveness
 * @param heartbeatTimeoutMs  silence longer than this kills the process
 * @param autoRestart         restart after a crash
 * @param maxRestarts         restart budget for the lifetime of this config
 * @param restartBackoffMs    delay before a restart
 * @param stopGraceMs         wait after a graceful stop before forcing
 * @param heartbeatMarker     stdout line that counts as a heartbeat
 */
public record AgentProcessConfig(
    String agentId,
    String agentName,
    List<String> command,
    Map<String, String> env,
    long heartbeatIntervalMs,
    long heartbeatTimeoutMs,
    boolean autoRestart,
    int maxRestarts,
    long restartBackoffMs,
    long stopGraceMs,
    String heartbeatMarker
) {
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30_000;
    public static final long DEFAULT_HEARTBEAT_TIMEOUT_MS = 60_000;
    public static final int DEFAULT_MAX_RESTARTS = 3;
    public static final long DEFAULT_RESTART_BACKOFF_MS = 1000;
    public static final long DEFAULT_STOP_GRACE_MS = 5000;
    public static final String DEFAULT_HEARTBEAT_MARKER = "HEARTBEAT";

    public AgentProcessConfig {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command is required for agent " + agentId);
        }
        command = List.copyOf(command);
        env = env == null ? Map.of() : Map.copyOf(env);
        agentName = agentName == null ? agentId : agentName;
        heartbeatMarker = heartbeatMarker == null ? DEFAULT_HEARTBEAT_MARKER : heartbeatMarker;
    }

    public static AgentProcessConfig of(String agentId, String agentName, List<String> command) {
        return new AgentProcessConfig(agentId, agentName, command, Map.of(),
                DEFAULT_HEARTBEAT_INTERVAL_MS, DEFAULT_HEARTBEAT_TIMEOUT_MS, true,
                DEFAULT_MAX_RESTARTS, DEFAULT_RESTART_BACKOFF_MS, DEFAULT_STOP_GRACE_MS,
                DEFAULT_HEARTBEAT_MARKER);
    }

    public AgentProcessConfig withHeartbeat(long intervalMs, long timeoutMs) {
        return new AgentProcessConfig(agentId, agentName, command, env, intervalMs, timeoutMs,
                autoRestart, maxRestarts, restartBackoffMs, stopGraceMs, heartbeatMarker);
    }

    public AgentProcessConfig withRestart(boolean autoRestart, int maxRestarts, long backoffMs) {
        return new AgentProcessConfig(agentId, agentName, command, env, heartbeatIntervalMs,
                heartbeatTimeoutMs, autoRestart, maxRestarts, backoffMs, stopGraceMs, heartbeatMarker);
    }

    public AgentProcessConfig withStopGrace(long graceMs) {
        return new AgentProcessConfig(agentId, agentName, command, env, heartbeatIntervalMs,
                heartbeatTimeoutMs, autoRestart, maxRestarts, restartBackoffMs, graceMs, heartbeatMarker);
    }

    public AgentProcessConfig withEnv(Map<String, String> extraEnv) {
        return new AgentProcessConfig(agentId, agentName, command, extraEnv, heartbeatIntervalMs,
                heartbeatTimeoutMs, autoRestart, maxRestarts, restartBackoffMs, stopGraceMs, heartbeatMarker);
    }
}
