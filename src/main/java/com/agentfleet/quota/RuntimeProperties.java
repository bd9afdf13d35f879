package com.agentfleet.quota;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "agentfleet.runtime")
public class RuntimeProperties {

    /** Quota used for agent roles that have no explicit runtime config. */
    private int defaultMaxConcurrent = 1;
    /** Runtime configs keyed by config id (an agent id or a lower-case role name). */
    private Map<String, AgentEntry> agents = new LinkedHashMap<>();

    public int getDefaultMaxConcurrent() { return defaultMaxConcurrent; }
    public void setDefaultMaxConcurrent(int defaultMaxConcurrent) { this.defaultMaxConcurrent = defaultMaxConcurrent; }
    public Map<String, AgentEntry> getAgents() { return agents; }
    public void setAgents(Map<String, AgentEntry> agents) { this.agents = agents; }

    public List<AgentRuntimeConfig> toConfigs() {
        return agents.entrySet().stream()
                .map(e -> e.getValue().toConfig(e.getKey()))
                .toList();
    }

    public static class AgentEntry {
        private String name;
        private String role = "executor";
        private int defaultQuota = 1;
        private Integer projectQuota;
        private Map<String, Integer> workflowQuotas = new LinkedHashMap<>();
        private List<String> command = new ArrayList<>();
        private Map<String, String> env = new LinkedHashMap<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }
        public int getDefaultQuota() { return defaultQuota; }
        public void setDefaultQuota(int defaultQuota) { this.defaultQuota = defaultQuota; }
        public Integer getProjectQuota() { return projectQuota; }
        public void setProjectQuota(Integer projectQuota) { this.projectQuota = projectQuota; }
        public Map<String, Integer> getWorkflowQuotas() { return workflowQuotas; }
        public void setWorkflowQuotas(Map<String, Integer> workflowQuotas) { this.workflowQuotas = workflowQuotas; }
        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public Map<String, String> getEnv() { return env; }
        public void setEnv(Map<String, String> env) { this.env = env; }

        AgentRuntimeConfig toConfig(String id) {
            return new AgentRuntimeConfig(id, name != null ? name : id, role, defaultQuota,
                    new QuotaPolicy(projectQuota, workflowQuotas), command, env);
        }
    }
}
