package com.agentfleet.concurrency;

/**
 * Admission verdict from the {@link ConcurrencyGovernor}.
 *
 * @param allowed              whether the task may start now
 * @param reason               explanation, suitable for logs and UI
 * @param estimatedStartTime   epoch millis; -1 when no start can be predicted
 * @param estimatedDurationMs  estimated execution time
 * @param benefitScore         0..1, how much parallel dispatch is worth for this task
 * @param suggestedConcurrency degradation hint, null when none
 */
public record SchedulingDecision(
    boolean allowed,
    String reason,
    long estimatedStartTime,
    long estimatedDurationMs,
    double benefitScore,
    Integer suggestedConcurrency
) {}
