package com.agentfleet.concurrency;

import java.util.List;
import java.util.Map;

/**
 * Tunable policy document for the {@link ConcurrencyGovernor}.
 *
 * @param globalMaxConcurrency          ceiling across all resource classes
 * @param perResourceConcurrency        ceiling per resource class
 * @param minSchedulingBenefitMs        tasks estimated below this are not run in parallel with others
 * @param estimatedSchedulingOverheadMs dispatch overhead used in the benefit score
 * @param estimator                     execution-time estimation mode
 * @param staticTimeEstimates           per task type estimates in ms
 * @param adaptiveHistoryWeight         0..1, weight of observed history in ADAPTIVE mode
 * @param queueStrategy                 wait-queue ordering
 * @param agingRateMs                   wait time that earns one priority point under AGING
 * @param resourceBlockTimeoutMs        queued longer than this is surfaced to a human
 * @param taskExecutionTimeoutMs        active longer than this is reported overdue
 * @param retryPolicy                   bounded retry settings
 * @param degradationPolicy             behaviour above the utilization threshold
 */
public record ConcurrencyPolicy(
    int globalMaxConcurrency,
    Map<String, Integer> perResourceConcurrency,
    long minSchedulingBenefitMs,
    long estimatedSchedulingOverheadMs,
    EstimatorMode estimator,
    Map<String, Long> staticTimeEstimates,
    double adaptiveHistoryWeight,
    QueueStrategy queueStrategy,
    long agingRateMs,
    long resourceBlockTimeoutMs,
    long taskExecutionTimeoutMs,
    RetryPolicy retryPolicy,
    DegradationPolicy degradationPolicy
) {
    public ConcurrencyPolicy {
        perResourceConcurrency = Map.copyOf(perResourceConcurrency);
        staticTimeEstimates = Map.copyOf(staticTimeEstimates);
    }

    public record RetryPolicy(int maxRetries, long backoffMs, long maxBackoffMs, List<String> retryableErrors) {
        public RetryPolicy {
            retryableErrors = retryableErrors == null ? List.of() : List.copyOf(retryableErrors);
        }
    }

    /**
     * @param resourceUsageThreshold utilization (0..1) above which degradation activates
     * @param degradedMaxConcurrency global ceiling while degraded
     * @param pauseNewDispatches     refuse all new admissions while degraded
     */
    public record DegradationPolicy(double resourceUsageThreshold, int degradedMaxConcurrency,
                                    boolean pauseNewDispatches) {}

    public ConcurrencyPolicy withQueueStrategy(QueueStrategy strategy) {
        return new ConcurrencyPolicy(globalMaxConcurrency, perResourceConcurrency, minSchedulingBenefitMs,
                estimatedSchedulingOverheadMs, estimator, staticTimeEstimates, adaptiveHistoryWeight,
                strategy, agingRateMs, resourceBlockTimeoutMs, taskExecutionTimeoutMs, retryPolicy,
                degradationPolicy);
    }

    public ConcurrencyPolicy withEstimator(EstimatorMode mode) {
        return new ConcurrencyPolicy(globalMaxConcurrency, perResourceConcurrency, minSchedulingBenefitMs,
                estimatedSchedulingOverheadMs, mode, staticTimeEstimates, adaptiveHistoryWeight,
                queueStrategy, agingRateMs, resourceBlockTimeoutMs, taskExecutionTimeoutMs, retryPolicy,
                degradationPolicy);
    }
}
