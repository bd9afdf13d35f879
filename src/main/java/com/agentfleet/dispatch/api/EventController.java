package com.agentfleet.dispatch.api;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

/**
 * REST controller for the lifecycle event stream.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventStreamService eventStreamService;

    public EventController(EventStreamService eventStreamService) {
        this.eventStreamService = eventStreamService;
    }

    /**
     * GET /api/v1/events: SSE stream, optionally narrowed by workflow and by a
     * comma-separated list of event wire names.
     */
    @GetMapping
    public ResponseEntity<SseEmitter> stream(@RequestParam(name = "workflow_id", required = false) String workflowId,
                                             @RequestParam(name = "types", required = false) String types) {
        String workflow = workflowId == null || workflowId.isBlank() ? null : workflowId.trim();
        return ResponseEntity.ok(eventStreamService.createEmitter(workflow, EventStreamService.parseTypes(types)));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
