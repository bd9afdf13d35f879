package com.agentfleet.quota;

import com.agentfleet.core.events.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link RuntimeQueue} per agent config and workflow, sized by the quota effective for
 * that workflow. Workflows never share a queue, so neither a workflow quota override nor a
 * queue head waiting on its own workflow affects another workflow.
 * Quota counters live only inside the queues.
 */
@Component
public class RuntimeQueueRegistry {

    private static final Logger log = LoggerFactory.getLogger(RuntimeQueueRegistry.class);

    private final QuotaResolver quotaResolver;
    private final EventBus eventBus;
    private final ConcurrentHashMap<String, RuntimeQueue> queues = new ConcurrentHashMap<>();

    public RuntimeQueueRegistry(QuotaResolver quotaResolver, EventBus eventBus) {
        this.quotaResolver = quotaResolver;
        this.eventBus = eventBus;
    }

    /**
     * Queue id for a config within a workflow: {@code configId@workflowId}, or the bare
     * config id when there is no workflow.
     */
    public static String queueId(String agentConfigId, String workflowId) {
        return workflowId == null ? agentConfigId : agentConfigId + "@" + workflowId;
    }

    /**
     * Returns the queue for {@code config} in {@code workflowId}, creating it on first use,
     * and sizes it to the quota effective for that workflow.
     */
    public RuntimeQueue queueFor(AgentRuntimeConfig config, String workflowId) {
        String queueId = queueId(config.id(), workflowId);
        RuntimeQueue queue = queues.computeIfAbsent(queueId, id -> new RuntimeQueue(config.id(), eventBus));
        QuotaResolution quota = quotaResolver.getEffectiveQuota(config, workflowId);
        if (queue.getMaxConcurrent() != quota.quota()) {
            log.info("Quota for {} set to {} (source: {})", queueId, quota.quota(), quota.source());
            queue.setMaxConcurrent(quota.quota());
        }
        return queue;
    }

    /**
     * @param queueId as built by {@link #queueId(String, String)}
     */
    public Optional<RuntimeQueue> find(String queueId) {
        return Optional.ofNullable(queues.get(queueId));
    }

    /**
     * Instance lookup across every queue.
     */
    public Optional<RuntimeInstance> findInstance(String instanceId) {
        for (RuntimeQueue queue : queues.values()) {
            Optional<RuntimeInstance> found = queue.getInstance(instanceId);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    /**
     * Stats of every queue keyed by queue id, sorted by id.
     */
    public Map<String, RuntimeQueueStats> stats() {
        var result = new TreeMap<String, RuntimeQueueStats>();
        queues.forEach((id, queue) -> result.put(id, queue.getStats()));
        return result;
    }
}
