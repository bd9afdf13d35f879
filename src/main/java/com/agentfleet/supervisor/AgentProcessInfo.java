package com.agentfleet.supervisor;

import java.time.Instant;

/**
 * Snapshot of a supervised process.
 *
 * @param pid           OS pid of the current (or last) incarnation, 0 before the first launch
 * @param agentId       agent identity
 * @param status        lifecycle status
 * @param startTime     when the current incarnation was launched
 * @param lastHeartbeat latest heartbeat, null until the first one arrives
 * @param restartCount  automatic restarts consumed so far
 * @param exitCode      exit code of the last incarnation, null while it runs
 * @param exitReason    why the last incarnation ended (e.g. heartbeat_timeout), null when it exited by itself
 */
public record AgentProcessInfo(
    long pid,
    String agentId,
    AgentProcessStatus status,
    Instant startTime,
    Instant lastHeartbeat,
    int restartCount,
    Integer exitCode,
    String exitReason
) {}
