package com.agentfleet.dispatch.api;

import com.agentfleet.concurrency.ConcurrencyGovernor;
import com.agentfleet.concurrency.ConcurrencyStats;
import com.agentfleet.quota.RuntimeQueue;
import com.agentfleet.quota.RuntimeQueueRegistry;
import com.agentfleet.quota.RuntimeQueueStats;
import com.agentfleet.supervisor.AgentProcessInfo;
import com.agentfleet.supervisor.AgentProcessSupervisor;
import com.agentfleet.supervisor.StopSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for runtime queues, admission stats and supervised agent processes.
 */
@RestController
@RequestMapping("/api/v1/runtime")
public class RuntimeController {

    private static final Logger log = LoggerFactory.getLogger(RuntimeController.class);

    private final RuntimeQueueRegistry queues;
    private final AgentProcessSupervisor supervisor;
    private final ConcurrencyGovernor governor;

    public RuntimeController(RuntimeQueueRegistry queues, AgentProcessSupervisor supervisor,
                             ConcurrencyGovernor governor) {
        this.queues = queues;
        this.supervisor = supervisor;
        this.governor = governor;
    }

    @GetMapping("/queues")
    public ResponseEntity<Map<String, RuntimeQueueStats>> queueStats() {
        return ResponseEntity.ok(queues.stats());
    }

    /**
     * GET /api/v1/runtime/queues/{queueId}: Stats plus queued and active instances.
     * The queue id is {@code configId@workflowId}.
     */
    @GetMapping("/queues/{queueId}")
    public ResponseEntity<?> queue(@PathVariable String queueId) {
        Optional<RuntimeQueue> queue = queues.find(queueId);
        if (queue.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Queue not found: " + queueId));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stats", queue.get().getStats());
        body.put("queued", queue.get().getQueued());
        body.put("active", queue.get().getActive());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/instances/{instanceId}")
    public ResponseEntity<?> instance(@PathVariable String instanceId) {
        return queues.findInstance(instanceId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Instance not found: " + instanceId)));
    }

    @GetMapping("/concurrency")
    public ResponseEntity<ConcurrencyStats> concurrency() {
        return ResponseEntity.ok(governor.getStats());
    }

    @GetMapping("/processes")
    public ResponseEntity<List<AgentProcessInfo>> processes() {
        return ResponseEntity.ok(supervisor.list());
    }

    /**
     * POST /api/v1/runtime/processes/{agentId}/heartbeat: Liveness signal from an agent.
     */
    @PostMapping("/processes/{agentId}/heartbeat")
    public ResponseEntity<Map<String, Object>> heartbeat(@PathVariable String agentId) {
        if (!supervisor.updateHeartbeat(agentId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Agent process not found: " + agentId));
        }
        return ResponseEntity.ok(Map.of("ok", true));
    }

    /**
     * POST /api/v1/runtime/processes/{agentId}/stop: Requests a stop; returns before the process exits.
     */
    @PostMapping("/processes/{agentId}/stop")
    public ResponseEntity<Map<String, Object>> stop(@PathVariable String agentId,
                                                    @RequestParam(defaultValue = "false") boolean force) {
        try {
            supervisor.stop(agentId, force ? StopSignal.FORCE : StopSignal.GRACEFUL);
            log.info("Stop requested for agent process {} (force={})", agentId, force);
            return ResponseEntity.accepted().body(Map.of("agent_id", agentId, "signal",
                    force ? StopSignal.FORCE.name() : StopSignal.GRACEFUL.name()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }
}
