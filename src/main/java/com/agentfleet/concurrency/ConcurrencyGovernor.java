package com.agentfleet.concurrency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Policy-driven admission control across resource classes.
 *
 * <p>Admission rules, in order:
 * <ol>
 *   <li>global ceiling (the degraded ceiling while degradation is active)</li>
 *   <li>per-resource-class ceiling</li>
 *   <li>admission pause while degraded, when the policy asks for it</li>
 *   <li>tasks estimated below {@code minSchedulingBenefitMs} are not started next to other active tasks</li>
 * </ol>
 * Degradation activates when active / global ceiling exceeds the policy threshold and
 * clears once utilization drops back under it.
 */
public class ConcurrencyGovernor {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyGovernor.class);

    static final long FALLBACK_ESTIMATE_MS = 5000;
    static final long EXTERNAL_FALLBACK_ESTIMATE_MS = 10_000;
    static final int DEFAULT_RESOURCE_LIMIT = 5;
    static final int MIN_HISTORY_SAMPLES = 3;
    private static final int LATENCY_WINDOW = 100;

    /** A task waiting for admission. */
    public record QueuedTask(String taskKey, String description, String resourceClass,
                             int basePriority, int currentPriority, long enqueuedAt) {}

    private record ActiveTask(String taskKey, String description, String resourceClass,
                              long startedAt, long enqueuedAt) {}

    private record ExecutionHistory(long avgDurationMs, double successRate, int sampleCount) {}

    private final Clock clock;
    private ConcurrencyPolicy policy;
    private final List<QueuedTask> queue = new ArrayList<>();
    private final Map<String, ActiveTask> active = new LinkedHashMap<>();
    private final Map<String, ExecutionHistory> history = new HashMap<>();
    private final Map<String, Long> externalEstimates = new HashMap<>();
    private final Deque<Long> schedulingLatencies = new ArrayDeque<>();
    private boolean degraded;
    private int degradationCount;

    public ConcurrencyGovernor(ConcurrencyPolicy policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }

    public ConcurrencyGovernor(ConcurrencyPolicy policy) {
        this(policy, Clock.systemUTC());
    }

    public synchronized ConcurrencyPolicy getPolicy() {
        return policy;
    }

    public synchronized void updatePolicy(ConcurrencyPolicy newPolicy) {
        this.policy = newPolicy;
        log.info("Concurrency policy updated: global={}, strategy={}",
                newPolicy.globalMaxConcurrency(), newPolicy.queueStrategy());
    }

    /**
     * Supplies an externally produced duration estimate, used in {@link EstimatorMode#EXTERNAL} mode.
     */
    public synchronized void provideEstimate(String taskKey, long estimatedMs) {
        externalEstimates.put(taskKey, estimatedMs);
    }

    /**
     * Decides whether a task of the given resource class may start now.
     */
    public synchronized SchedulingDecision evaluate(String taskKey, String description, String resourceClass) {
        long now = clock.millis();
        long estimate = estimateExecutionTime(taskKey, description);
        double benefit = benefitScore(estimate);

        int ceiling = effectiveCeiling();
        if (active.size() >= ceiling) {
            return new SchedulingDecision(false,
                    "Global concurrency limit reached (" + active.size() + "/" + ceiling + ")",
                    now + estimateQueueWait(now), estimate, benefit, Math.max(1, ceiling - 1));
        }

        int limit = resourceLimit(resourceClass);
        int current = countActive(resourceClass);
        if (current >= limit) {
            return new SchedulingDecision(false,
                    "Resource " + resourceClass + " concurrency limit reached (" + current + "/" + limit + ")",
                    now + estimateQueueWait(now), estimate, benefit, null);
        }

        if (degraded && policy.degradationPolicy().pauseNewDispatches()) {
            return new SchedulingDecision(false,
                    "Degraded: new dispatches paused until utilization drops",
                    -1, estimate, 0, policy.degradationPolicy().degradedMaxConcurrency());
        }

        if (estimate < policy.minSchedulingBenefitMs() && !active.isEmpty()) {
            return new SchedulingDecision(false,
                    "Estimated " + estimate + "ms is below the scheduling benefit threshold ("
                            + policy.minSchedulingBenefitMs() + "ms); waiting for active tasks",
                    now + estimateQueueWait(now), estimate, benefit * 0.5, null);
        }

        return new SchedulingDecision(true, "All admission conditions met", now, estimate, benefit, null);
    }

    public synchronized void enqueue(String taskKey, String description, String resourceClass, int priority) {
        queue.add(new QueuedTask(taskKey, description, resourceClass, priority, priority, clock.millis()));
        reprioritize();
    }

    /**
     * Removes and returns the first queued task, in queue order, that would be admitted now.
     */
    public synchronized Optional<QueuedTask> dequeue() {
        reprioritize();
        for (int i = 0; i < queue.size(); i++) {
            QueuedTask candidate = queue.get(i);
            if (evaluate(candidate.taskKey(), candidate.description(), candidate.resourceClass()).allowed()) {
                queue.remove(i);
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Marks a task as running. A queued entry with the same key is consumed.
     */
    public synchronized void startTask(String taskKey, String description, String resourceClass) {
        long now = clock.millis();
        long enqueuedAt = now;
        for (int i = 0; i < queue.size(); i++) {
            if (queue.get(i).taskKey().equals(taskKey)) {
                enqueuedAt = queue.remove(i).enqueuedAt();
                break;
            }
        }
        active.put(taskKey, new ActiveTask(taskKey, description, resourceClass, now, enqueuedAt));
        recordLatency(now - enqueuedAt);
        checkDegradation();
    }

    public synchronized void completeTask(String taskKey, boolean success) {
        ActiveTask task = active.remove(taskKey);
        if (task == null) {
            log.debug("completeTask for unknown task {}", taskKey);
            return;
        }
        long duration = clock.millis() - task.startedAt();
        updateHistory(inferTaskType(task.description()), duration, success);
        externalEstimates.remove(taskKey);
        checkDegradation();
    }

    /**
     * Frees an admitted task's slot without recording an execution sample.
     */
    public synchronized void releaseTask(String taskKey) {
        if (active.remove(taskKey) != null) {
            externalEstimates.remove(taskKey);
            checkDegradation();
        }
    }

    public synchronized boolean isActive(String taskKey) {
        return active.containsKey(taskKey);
    }

    /**
     * Queued tasks that waited longer than the resource-block timeout. These should be
     * surfaced to a human rather than left waiting silently.
     */
    public synchronized List<QueuedTask> blockedTooLong() {
        long now = clock.millis();
        return queue.stream()
                .filter(q -> now - q.enqueuedAt() > policy.resourceBlockTimeoutMs())
                .toList();
    }

    /**
     * Keys of active tasks running longer than the task execution timeout.
     */
    public synchronized List<String> overdueTasks() {
        long now = clock.millis();
        return active.values().stream()
                .filter(a -> now - a.startedAt() > policy.taskExecutionTimeoutMs())
                .map(ActiveTask::taskKey)
                .toList();
    }

    public synchronized List<QueuedTask> queued() {
        reprioritize();
        return List.copyOf(queue);
    }

    public synchronized boolean isDegraded() {
        return degraded;
    }

    public synchronized ConcurrencyStats getStats() {
        var byResource = new TreeMap<String, Integer>();
        for (ActiveTask a : active.values()) {
            byResource.merge(a.resourceClass(), 1, Integer::sum);
        }
        double avgLatency = schedulingLatencies.stream().mapToLong(Long::longValue).average().orElse(0);

        long totalSamples = history.values().stream().mapToLong(ExecutionHistory::sampleCount).sum();
        long avgExec = totalSamples == 0 ? 0 : Math.round(history.values().stream()
                .mapToDouble(h -> (double) h.avgDurationMs() * h.sampleCount()).sum() / totalSamples);
        double successRate = totalSamples == 0 ? 1.0 : history.values().stream()
                .mapToDouble(h -> h.successRate() * h.sampleCount()).sum() / totalSamples;

        return new ConcurrencyStats(active.size(), queue.size(), byResource, avgLatency, avgExec,
                successRate, degradationCount, degraded);
    }

    long estimateExecutionTime(String taskKey, String description) {
        String type = inferTaskType(description);
        Long fromTable = policy.staticTimeEstimates().get(type);
        long staticEstimate = fromTable != null ? fromTable : FALLBACK_ESTIMATE_MS;

        return switch (policy.estimator()) {
            case STATIC -> staticEstimate;
            case ADAPTIVE -> {
                ExecutionHistory h = history.get(type);
                if (h == null || h.sampleCount() < MIN_HISTORY_SAMPLES) yield staticEstimate;
                double weight = policy.adaptiveHistoryWeight();
                yield Math.round(h.avgDurationMs() * weight + staticEstimate * (1 - weight));
            }
            case EXTERNAL -> externalEstimates.getOrDefault(taskKey, EXTERNAL_FALLBACK_ESTIMATE_MS);
        };
    }

    static String inferTaskType(String description) {
        String d = description == null ? "" : description.toLowerCase(Locale.ROOT);
        if (d.contains("search")) return "web_search";
        if (d.contains("file")) return "file_ops";
        if (d.contains("code")) return "code_generation";
        if (d.contains("exec")) return "shell_exec";
        if (d.contains("report")) return "report_generation";
        return "general";
    }

    private double benefitScore(long estimate) {
        long overhead = policy.estimatedSchedulingOverheadMs();
        if (estimate + overhead <= 0) return 0;
        return Math.min(1.0, (double) estimate / (estimate + overhead));
    }

    private int effectiveCeiling() {
        return degraded ? policy.degradationPolicy().degradedMaxConcurrency() : policy.globalMaxConcurrency();
    }

    private int resourceLimit(String resourceClass) {
        return policy.perResourceConcurrency().getOrDefault(resourceClass, DEFAULT_RESOURCE_LIMIT);
    }

    private int countActive(String resourceClass) {
        int count = 0;
        for (ActiveTask a : active.values()) {
            if (a.resourceClass() != null && a.resourceClass().equals(resourceClass)) count++;
        }
        return count;
    }

    private long estimateQueueWait(long now) {
        long min = Long.MAX_VALUE;
        for (ActiveTask a : active.values()) {
            long remaining = Math.max(0, estimateExecutionTime(a.taskKey(), a.description()) - (now - a.startedAt()));
            min = Math.min(min, remaining);
        }
        return min == Long.MAX_VALUE ? 0 : min;
    }

    private void reprioritize() {
        switch (policy.queueStrategy()) {
            case FIFO -> queue.sort(Comparator.comparingLong(QueuedTask::enqueuedAt));
            case PRIORITY -> queue.sort(Comparator.comparingInt(QueuedTask::basePriority).reversed()
                    .thenComparingLong(QueuedTask::enqueuedAt));
            case AGING -> {
                long now = clock.millis();
                long rate = Math.max(1, policy.agingRateMs());
                queue.replaceAll(q -> new QueuedTask(q.taskKey(), q.description(), q.resourceClass(),
                        q.basePriority(), q.basePriority() + (int) ((now - q.enqueuedAt()) / rate), q.enqueuedAt()));
                queue.sort(Comparator.comparingInt(QueuedTask::currentPriority).reversed()
                        .thenComparingLong(QueuedTask::enqueuedAt));
            }
        }
    }

    private void updateHistory(String type, long duration, boolean success) {
        ExecutionHistory existing = history.get(type);
        if (existing == null) {
            history.put(type, new ExecutionHistory(duration, success ? 1 : 0, 1));
            return;
        }
        int n = existing.sampleCount() + 1;
        long avg = Math.round((existing.avgDurationMs() * (double) existing.sampleCount() + duration) / n);
        double rate = (existing.successRate() * existing.sampleCount() + (success ? 1 : 0)) / n;
        history.put(type, new ExecutionHistory(avg, rate, n));
    }

    private void recordLatency(long latency) {
        schedulingLatencies.addLast(latency);
        if (schedulingLatencies.size() > LATENCY_WINDOW) {
            schedulingLatencies.removeFirst();
        }
    }

    private void checkDegradation() {
        int ceiling = Math.max(1, policy.globalMaxConcurrency());
        double usage = (double) active.size() / ceiling;
        if (usage > policy.degradationPolicy().resourceUsageThreshold()) {
            if (!degraded) {
                degraded = true;
                degradationCount++;
                log.warn("Degradation activated at {}% utilization, ceiling lowered to {}",
                        Math.round(usage * 100), policy.degradationPolicy().degradedMaxConcurrency());
            }
        } else if (degraded) {
            degraded = false;
            log.info("Degradation cleared at {}% utilization", Math.round(usage * 100));
        }
    }
}
