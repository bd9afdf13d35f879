package com.agentfleet.quota;

import java.util.Map;

/**
 * Optional overrides of an agent's default quota.
 * Resolution order: workflow &gt; project &gt; default.
 *
 * @param projectQuota   project-wide ceiling, nullable
 * @param workflowQuotas per-workflow ceilings keyed by workflowId
 */
public record QuotaPolicy(
    Integer projectQuota,
    Map<String, Integer> workflowQuotas
) {
    public QuotaPolicy {
        workflowQuotas = workflowQuotas == null ? Map.of() : Map.copyOf(workflowQuotas);
    }

    public static QuotaPolicy none() {
        return new QuotaPolicy(null, Map.of());
    }
}
