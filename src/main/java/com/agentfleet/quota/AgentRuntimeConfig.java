package com.agentfleet.quota;

import java.util.List;
import java.util.Map;

/**
 * Static configuration template for an agent type. Runtime instances are bound to it by id.
 *
 * @param id           config id, also the key of its runtime queue
 * @param name         display name
 * @param role         "executor", "orchestrator", "reviewer" or "tool"
 * @param defaultQuota default concurrency ceiling, values below 1 resolve to 1
 * @param quotaPolicy  optional project/workflow overrides
 * @param command      executable and arguments used to spawn the agent process, may be empty
 * @param env          extra environment for the agent process
 */
public record AgentRuntimeConfig(
    String id,
    String name,
    String role,
    int defaultQuota,
    QuotaPolicy quotaPolicy,
    List<String> command,
    Map<String, String> env
) {
    public AgentRuntimeConfig {
        quotaPolicy = quotaPolicy == null ? QuotaPolicy.none() : quotaPolicy;
        command = command == null ? List.of() : List.copyOf(command);
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    public static AgentRuntimeConfig of(String id, String role, int defaultQuota) {
        return new AgentRuntimeConfig(id, id, role, defaultQuota, QuotaPolicy.none(), List.of(), Map.of());
    }
}
