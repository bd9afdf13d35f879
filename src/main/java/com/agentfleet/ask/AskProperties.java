package com.agentfleet.ask;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "agentfleet.ask")
public class AskProperties {

    /** Applied when a request carries no timeout of its own. */
    private long defaultTimeoutMs = 600_000;
    /** How many settled resolutions are kept for repeated resolve calls. */
    private int settledHistory = 1000;

    public long getDefaultTimeoutMs() { return defaultTimeoutMs; }
    public void setDefaultTimeoutMs(long defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }
    public int getSettledHistory() { return settledHistory; }
    public void setSettledHistory(int settledHistory) { this.settledHistory = settledHistory; }
}
