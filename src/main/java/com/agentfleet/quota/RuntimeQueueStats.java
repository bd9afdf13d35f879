package com.agentfleet.quota;

public record RuntimeQueueStats(int queued, int active, int completed, int maxConcurrent) {}
