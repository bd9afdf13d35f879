package com.agentfleet.dispatch.api;

import com.agentfleet.ask.AskHandle;
import com.agentfleet.ask.AskManager;
import com.agentfleet.ask.AskRequest;
import com.agentfleet.ask.AskResolution;
import com.agentfleet.ask.AskScope;
import com.agentfleet.ask.PendingAsk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller through which humans list and answer pending asks.
 */
@RestController
@RequestMapping("/api/v1/asks")
public class AskController {

    private static final Logger log = LoggerFactory.getLogger(AskController.class);

    private final AskManager askManager;

    public AskController(AskManager askManager) {
        this.askManager = askManager;
    }

    /**
     * GET /api/v1/asks: Pending asks, oldest first, optionally filtered by scope.
     */
    @GetMapping
    public ResponseEntity<List<PendingAsk>> listPending(
            @RequestParam(name = "agent_id", required = false) String agentId,
            @RequestParam(name = "session_id", required = false) String sessionId,
            @RequestParam(name = "workflow_id", required = false) String workflowId,
            @RequestParam(name = "epic_id", required = false) String epicId) {
        return ResponseEntity.ok(askManager.listPending(new AskScope(null, agentId, sessionId, workflowId, epicId)));
    }

    /**
     * POST /api/v1/asks: Opens an ask. The caller learns the outcome through
     * the event stream or by polling the pending list.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> open(@RequestBody AskRequest request) {
        try {
            AskHandle handle = askManager.open(request);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("request_id", handle.pending().requestId());
            body.put("expires_at", handle.pending().expiresAt().toString());
            return ResponseEntity.status(HttpStatus.CREATED).body(body);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/asks/{requestId}/answer: Answers one ask. Answering an ask
     * that already settled returns the original resolution.
     */
    @PostMapping("/{requestId}/answer")
    public ResponseEntity<?> answer(@PathVariable String requestId, @RequestBody AnswerRequest request) {
        Optional<AskResolution> resolution = askManager.resolveByRequestId(requestId, request.answer());
        if (resolution.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Ask not found: " + requestId));
        }
        log.info("Ask {} answered via API", requestId);
        return ResponseEntity.ok(resolution.get());
    }

    /**
     * POST /api/v1/asks/answer: Answers the oldest pending ask in the given scope.
     */
    @PostMapping("/answer")
    public ResponseEntity<?> answerOldest(@RequestBody AnswerRequest request) {
        AskScope scope = new AskScope(null, request.agentId(), request.sessionId(),
                request.workflowId(), request.epicId());
        Optional<AskResolution> resolution = askManager.resolveOldestByScope(scope, request.answer());
        if (resolution.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "No pending ask in scope"));
        }
        return ResponseEntity.ok(resolution.get());
    }
}
