package com.agentfleet.concurrency;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Built-in policy presets.
 */
public final class ConcurrencyPolicies {

    private ConcurrencyPolicies() {}

    private static final Map<String, Long> STATIC_ESTIMATES = Map.of(
            "web_search", 5000L,
            "file_ops", 1000L,
            "code_generation", 10000L,
            "shell_exec", 3000L,
            "report_generation", 8000L
    );

    private static final ConcurrencyPolicy.RetryPolicy RETRY = new ConcurrencyPolicy.RetryPolicy(
            2, 1000, 30_000, List.of("timeout", "rate_limit", "temporary_failure"));

    public static final ConcurrencyPolicy DEFAULT = new ConcurrencyPolicy(
            5,
            Map.of("executor", 3, "orchestrator", 1, "reviewer", 2, "searcher", 2,
                    "tool", 5, "api", 10, "database", 3),
            2000, 500,
            EstimatorMode.ADAPTIVE, STATIC_ESTIMATES, 0.7,
            QueueStrategy.AGING, 5000,
            30_000, 120_000,
            RETRY,
            new ConcurrencyPolicy.DegradationPolicy(0.85, 2, false));

    public static final ConcurrencyPolicy HIGH_PERFORMANCE = new ConcurrencyPolicy(
            10,
            Map.of("executor", 6, "orchestrator", 2, "reviewer", 4, "searcher", 4,
                    "tool", 10, "api", 20, "database", 6),
            1000, 500,
            EstimatorMode.ADAPTIVE, STATIC_ESTIMATES, 0.7,
            QueueStrategy.AGING, 5000,
            30_000, 120_000,
            RETRY,
            new ConcurrencyPolicy.DegradationPolicy(0.90, 5, false));

    /** Resource-constrained environments: low ceilings, fifo, admission pauses at 70% utilization. */
    public static final ConcurrencyPolicy CONSERVATIVE = new ConcurrencyPolicy(
            2,
            Map.of("executor", 1, "orchestrator", 1, "reviewer", 1, "searcher", 1,
                    "tool", 2, "api", 3, "database", 1),
            5000, 500,
            EstimatorMode.ADAPTIVE, STATIC_ESTIMATES, 0.7,
            QueueStrategy.FIFO, 5000,
            30_000, 120_000,
            RETRY,
            new ConcurrencyPolicy.DegradationPolicy(0.70, 1, true));

    /** Fully serial execution, used to validate a workflow before enabling parallelism. */
    public static final ConcurrencyPolicy SERIAL = new ConcurrencyPolicy(
            1,
            Map.of("executor", 1, "orchestrator", 1, "reviewer", 1, "searcher", 1,
                    "tool", 1, "api", 1, "database", 1),
            2000, 500,
            EstimatorMode.STATIC, STATIC_ESTIMATES, 0.7,
            QueueStrategy.FIFO, 5000,
            30_000, 120_000,
            RETRY,
            new ConcurrencyPolicy.DegradationPolicy(1.0, 1, false));

    /**
     * Looks a preset up by name ("default", "high-performance", "conservative", "serial").
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static ConcurrencyPolicy byName(String name) {
        String key = name == null ? "default" : name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return switch (key) {
            case "", "default" -> DEFAULT;
            case "high-performance" -> HIGH_PERFORMANCE;
            case "conservative" -> CONSERVATIVE;
            case "serial" -> SERIAL;
            default -> throw new IllegalArgumentException("Unknown concurrency preset: " + name);
        };
    }

    public static Map<String, ConcurrencyPolicy> all() {
        Map<String, ConcurrencyPolicy> presets = new LinkedHashMap<>();
        presets.put("default", DEFAULT);
        presets.put("high-performance", HIGH_PERFORMANCE);
        presets.put("conservative", CONSERVATIVE);
        presets.put("serial", SERIAL);
        return Collections.unmodifiableMap(presets);
    }

    /**
     * True when the policy admits a single task at a time in arrival order.
     */
    public static boolean isSerialMode(ConcurrencyPolicy policy) {
        return policy.globalMaxConcurrency() == 1
                && policy.queueStrategy() == QueueStrategy.FIFO
                && policy.perResourceConcurrency().values().stream().allMatch(v -> v == 1);
    }

    /**
     * Human-readable queue position, e.g. "Queue position: 3/5".
     *
     * @param position 0 means the instance runs next
     */
    public static String describeQueuePosition(int position, int total) {
        if (position <= 0) return "Starting next";
        return "Queue position: " + position + "/" + total;
    }
}
