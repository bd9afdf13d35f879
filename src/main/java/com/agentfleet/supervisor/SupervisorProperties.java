package com.agentfleet.supervisor;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "agentfleet.supervisor")
public class SupervisorProperties {

    private long heartbeatIntervalMs = AgentProcessConfig.DEFAULT_HEARTBEAT_INTERVAL_MS;
    private long heartbeatTimeoutMs = AgentProcessConfig.DEFAULT_HEARTBEAT_TIMEOUT_MS;
    private boolean autoRestart = true;
    private int maxRestarts = AgentProcessConfig.DEFAULT_MAX_RESTARTS;
    private long restartBackoffMs = AgentProcessConfig.DEFAULT_RESTART_BACKOFF_MS;
    private long stopGraceMs = AgentProcessConfig.DEFAULT_STOP_GRACE_MS;
    private String heartbeatMarker = AgentProcessConfig.DEFAULT_HEARTBEAT_MARKER;
    /** Agent command lines keyed by agent id, used when the dispatcher has to bring an agent up. */
    private Map<String, List<String>> commands = new LinkedHashMap<>();

    public long getHeartbeatIntervalMs() { return heartbeatIntervalMs; }
    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) { this.heartbeatIntervalMs = heartbeatIntervalMs; }
    public long getHeartbeatTimeoutMs() { return heartbeatTimeoutMs; }
    public void setHeartbeatTimeoutMs(long heartbeatTimeoutMs) { this.heartbeatTimeoutMs = heartbeatTimeoutMs; }
    public boolean isAutoRestart() { return autoRestart; }
    public void setAutoRestart(boolean autoRestart) { this.autoRestart = autoRestart; }
    public int getMaxRestarts() { return maxRestarts; }
    public void setMaxRestarts(int maxRestarts) { this.maxRestarts = maxRestarts; }
    public long getRestartBackoffMs() { return restartBackoffMs; }
    public void setRestartBackoffMs(long restartBackoffMs) { this.restartBackoffMs = restartBackoffMs; }
    public long getStopGraceMs() { return stopGraceMs; }
    public void setStopGraceMs(long stopGraceMs) { this.stopGraceMs = stopGraceMs; }
    public String getHeartbeatMarker() { return heartbeatMarker; }
    public void setHeartbeatMarker(String heartbeatMarker) { this.heartbeatMarker = heartbeatMarker; }
    public Map<String, List<String>> getCommands() { return commands; }
    public void setCommands(Map<String, List<String>> commands) { this.commands = commands; }

    /**
     * Builds a process config for the agent from these defaults.
     */
    public AgentProcessConfig toConfig(String agentId, String agentName, List<String> command) {
        return new AgentProcessConfig(agentId, agentName, command, Map.of(),
                heartbeatIntervalMs, heartbeatTimeoutMs, autoRestart, maxRestarts,
                restartBackoffMs, stopGraceMs, heartbeatMarker);
    }
}
