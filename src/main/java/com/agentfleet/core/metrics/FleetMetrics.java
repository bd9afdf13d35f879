package com.agentfleet.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for scheduling, recovery, supervision and asks.
 */
@Service
public class FleetMetrics {

    private final MeterRegistry registry;

    public FleetMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTickDuration(long ms) {
        Timer.builder("agentfleet.tick.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSchedulingDecision(boolean assigned) {
        Counter.builder("agentfleet.scheduling.decisions")
                .tag("result", assigned ? "assigned" : "unassigned")
                .register(registry)
                .increment();
    }

    public void recordRecoveryAction(String action) {
        Counter.builder("agentfleet.recovery.actions")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void incrementEscalations() {
        Counter.builder("agentfleet.escalations.total")
                .register(registry)
                .increment();
    }

    /**
     * Records a supervisor-initiated kill.
     *
     * @param reason "heartbeat_missing", "heartbeat_timeout" or "stop_grace_expired"
     */
    public void recordProcessKill(String agentId, String reason) {
        Counter.builder("agentfleet.process.kills")
                .description("Agent processes killed by the supervisor")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordProcessRestart(String agentId) {
        Counter.builder("agentfleet.process.restarts")
                .description("Automatic agent process restarts")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "answered", "timed_out" or "empty"
     */
    public void recordAskOutcome(String outcome) {
        Counter.builder("agentfleet.asks.resolved")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
