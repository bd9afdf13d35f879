package com.agentfleet.concurrency;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "agentfleet.concurrency")
public class ConcurrencyProperties {

    /** One of default, high-performance, conservative, serial. */
    private String preset = "default";
    /** Overrides the preset's queue strategy when set. */
    private QueueStrategy queueStrategy;

    public String getPreset() { return preset; }
    public void setPreset(String preset) { this.preset = preset; }
    public QueueStrategy getQueueStrategy() { return queueStrategy; }
    public void setQueueStrategy(QueueStrategy queueStrategy) { this.queueStrategy = queueStrategy; }

    public ConcurrencyPolicy resolvePolicy() {
        ConcurrencyPolicy policy = ConcurrencyPolicies.byName(preset);
        return queueStrategy != null ? policy.withQueueStrategy(queueStrategy) : policy;
    }
}
