package com.agentfleet.quota;

import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Resolves the effective concurrency ceiling for an agent config.
 */
@Component
public class QuotaResolver {

    /**
     * Workflow override first, then the project override, then the config default.
     * Overrides that are missing or not positive are skipped; the default never
     * resolves below 1.
     *
     * @param workflowId nullable; without it the workflow layer is skipped
     */
    public QuotaResolution getEffectiveQuota(AgentRuntimeConfig config, String workflowId) {
        QuotaPolicy policy = config.quotaPolicy();

        if (workflowId != null) {
            Map<String, Integer> workflowQuotas = policy.workflowQuotas();
            Integer workflowQuota = workflowQuotas.get(workflowId);
            if (workflowQuota != null && workflowQuota > 0) {
                return new QuotaResolution(workflowQuota, QuotaResolution.Source.WORKFLOW);
            }
        }

        Integer projectQuota = policy.projectQuota();
        if (projectQuota != null && projectQuota > 0) {
            return new QuotaResolution(projectQuota, QuotaResolution.Source.PROJECT);
        }

        return new QuotaResolution(Math.max(1, config.defaultQuota()), QuotaResolution.Source.DEFAULT);
    }
}
