package com.agentfleet.concurrency;

import java.util.Map;

public record ConcurrencyStats(
    int activeTasks,
    int queuedTasks,
    Map<String, Integer> activeByResource,
    double avgSchedulingLatencyMs,
    long avgExecutionTimeMs,
    double successRate,
    int degradationCount,
    boolean degraded
) {}
