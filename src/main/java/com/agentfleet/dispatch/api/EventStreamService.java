package com.agentfleet.dispatch.api;

import com.agentfleet.core.events.EventBus;
import com.agentfleet.core.events.EventType;
import com.agentfleet.core.events.FleetEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter}s, so an external event sink
 * can follow task, runtime, process and ask lifecycle over HTTP.
 * <p>
 * Idle connections get an SSE comment every 30 seconds so proxies keep them open.
 */
@Service
public class EventStreamService {

    private static final Logger log = LoggerFactory.getLogger(EventStreamService.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;
    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;
    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    private record Registration(String workflowId, SseEmitter emitter, EventBus.Subscription subscription) {}

    @Autowired
    public EventStreamService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    EventStreamService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeats.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stop() {
        heartbeats.shutdownNow();
        registrations.forEach(r -> r.emitter().complete());
    }

    /**
     * Opens a stream.
     *
     * @param workflowId workflow to follow, null for all
     * @param types      event types to forward, empty for all
     */
    public SseEmitter createEmitter(String workflowId, Set<EventType> types) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventBus.Subscription subscription = eventBus.subscribe(workflowId, types, event -> send(emitter, event));
        Registration registration = new Registration(workflowId, emitter, subscription);
        registrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> {
            log.debug("SSE stream for {} failed: {}", label(workflowId), ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to open SSE stream for {}: {}", label(workflowId), e.getMessage());
        }
        log.info("SSE stream opened for {} (types {})", label(workflowId), types.isEmpty() ? "all" : types);
        return emitter;
    }

    public int activeStreamCount() {
        return registrations.size();
    }

    /**
     * Parses a comma-separated list of wire names ("task_failed,ask_opened").
     *
     * @throws IllegalArgumentException for an unknown name
     */
    static Set<EventType> parseTypes(String csv) {
        if (csv == null || csv.isBlank()) {
            return Set.of();
        }
        Set<EventType> types = EnumSet.noneOf(EventType.class);
        for (String name : csv.split(",")) {
            String trimmed = name.trim();
            if (trimmed.isEmpty()) continue;
            types.add(Arrays.stream(EventType.values())
                    .filter(t -> t.wireName().equals(trimmed))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + trimmed)));
        }
        return types;
    }

    static Map<String, Object> toData(FleetEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (event.workflowId() != null) {
            data.put("workflowId", event.workflowId());
        }
        if (event.subjectId() != null) {
            data.put("subjectId", event.subjectId());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private void send(SseEmitter emitter, FleetEvent event) {
        try {
            emitter.send(SseEmitter.event().name(event.type().wireName()).data(toData(event)));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropped SSE event {}: {}", event.type().wireName(), e.getMessage());
        }
    }

    private void sendHeartbeats() {
        for (Registration registration : registrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat skipped for {}: {}", label(registration.workflowId()), e.getMessage());
            }
        }
    }

    private void cleanup(Registration registration) {
        if (registrations.remove(registration)) {
            registration.subscription().unsubscribe();
            log.debug("SSE stream closed for {}", label(registration.workflowId()));
        }
    }

    private static String label(String workflowId) {
        return workflowId == null ? "all workflows" : "workflow " + workflowId;
    }
}
