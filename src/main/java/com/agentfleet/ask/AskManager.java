package com.agentfleet.ask;

import com.agentfleet.core.events.EventBus;
import com.agentfleet.core.events.EventType;
import com.agentfleet.core.events.FleetEvent;
import com.agentfleet.core.metrics.FleetMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Human-decision requests that outlive a single tick.
 *
 * <p>Every ask settles exactly once, through an answer or its deadline. Both paths go through
 * {@link #finalizeAsk}: the first caller wins, later calls get the settled value back unchanged.
 */
@Service
public class AskManager {

    private static final Logger log = LoggerFactory.getLogger(AskManager.class);
    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final Pattern INDEX = Pattern.compile("\\d{1,9}");

    private final long defaultTimeoutMs;
    private final int settledHistory;
    private final EventBus eventBus;
    private final FleetMetrics metrics;
    private final Clock clock;

    private final Map<String, PendingState> pending = new HashMap<>();
    private final Map<String, AskResolution> settled;
    private long sequence;

    private final ScheduledExecutorService timers = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ask-timeouts");
        t.setDaemon(true);
        return t;
    });

    private static final class PendingState {
        final PendingAsk ask;
        final long seq;
        final CompletableFuture<AskResolution> result = new CompletableFuture<>();
        ScheduledFuture<?> timer;

        PendingState(PendingAsk ask, long seq) {
            this.ask = ask;
            this.seq = seq;
        }
    }

    @Autowired
    public AskManager(AskProperties properties, EventBus eventBus,
                      @Autowired(required = false) FleetMetrics metrics) {
        this(properties.getDefaultTimeoutMs(), properties.getSettledHistory(), eventBus, metrics, Clock.systemUTC());
    }

    AskManager(long defaultTimeoutMs, int settledHistory, EventBus eventBus, FleetMetrics metrics, Clock clock) {
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.settledHistory = Math.max(1, settledHistory);
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.settled = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, AskResolution> eldest) {
                return size() > AskManager.this.settledHistory;
            }
        };
    }

    /**
     * Opens an ask and arms its timeout.
     *
     * @throws IllegalArgumentException when the question is blank
     */
    public AskHandle open(AskRequest request) {
        String question = trimToNull(request.question());
        if (question == null) {
            throw new IllegalArgumentException("ask question is required");
        }
        long timeoutMs = request.timeoutMs() != null && request.timeoutMs() > 0
                ? request.timeoutMs()
                : defaultTimeoutMs;

        PendingState state;
        synchronized (this) {
            Instant now = clock.instant();
            String requestId = newRequestId(now.toEpochMilli());
            PendingAsk ask = new PendingAsk(requestId, question, sanitizeOptions(request.options()),
                    trimToNull(request.context()), trimToNull(request.agentId()), trimToNull(request.sessionId()),
                    trimToNull(request.workflowId()), trimToNull(request.epicId()),
                    now, now.plusMillis(timeoutMs));
            state = new PendingState(ask, sequence++);
            pending.put(requestId, state);
            state.timer = timers.schedule(
                    () -> finalizeAsk(requestId, AskResolution.timeout(requestId, clock.instant())),
                    timeoutMs, TimeUnit.MILLISECONDS);
        }

        PendingAsk ask = state.ask;
        log.info("Ask {} opened (timeout {}ms, {} options)", ask.requestId(), timeoutMs, ask.options().size());
        publish(EventType.ASK_OPENED, ask.workflowId(), ask.requestId(), Map.of("question", ask.question()));
        return new AskHandle(ask, state.result);
    }

    /**
     * Pending asks matching the scope, oldest first.
     */
    public synchronized List<PendingAsk> listPending(AskScope scope) {
        AskScope filter = scope == null ? AskScope.ANY : scope;
        List<PendingState> states = new ArrayList<>(pending.values());
        states.sort(Comparator.comparing((PendingState s) -> s.ask.createdAt()).thenComparingLong(s -> s.seq));
        return states.stream()
                .map(s -> s.ask)
                .filter(filter::matches)
                .toList();
    }

    public List<PendingAsk> listPending() {
        return listPending(AskScope.ANY);
    }

    /**
     * Answers a specific ask. A request id that already settled yields its original resolution.
     *
     * @return empty when the request id is unknown
     */
    public Optional<AskResolution> resolveByRequestId(String requestId, String answer) {
        PendingState state;
        synchronized (this) {
            AskResolution done = settled.get(requestId);
            if (done != null) {
                return Optional.of(done);
            }
            state = pending.get(requestId);
        }
        if (state == null) {
            return Optional.empty();
        }
        return Optional.of(finalizeAsk(requestId, answerResolution(state.ask, answer)));
    }

    /**
     * Answers the oldest pending ask in scope.
     *
     * @return empty when nothing in scope is pending
     */
    public Optional<AskResolution> resolveOldestByScope(AskScope scope, String answer) {
        List<PendingAsk> candidates = listPending(scope);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return resolveByRequestId(candidates.get(0).requestId(), answer);
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    @PreDestroy
    void shutdown() {
        timers.shutdownNow();
    }

    private AskResolution finalizeAsk(String requestId, AskResolution resolution) {
        PendingState state;
        synchronized (this) {
            AskResolution done = settled.get(requestId);
            if (done != null) {
                return done;
            }
            state = pending.remove(requestId);
            if (state == null) {
                return resolution;
            }
            if (state.timer != null) {
                state.timer.cancel(false);
            }
            settled.put(requestId, resolution);
        }

        String outcome = resolution.timedOut() ? "timed_out" : resolution.ok() ? "answered" : "empty";
        log.info("Ask {} resolved: {}", requestId, outcome);
        if (metrics != null) {
            metrics.recordAskOutcome(outcome);
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("ok", resolution.ok());
        payload.put("timedOut", resolution.timedOut());
        if (resolution.selectedOption() != null) {
            payload.put("selectedOption", resolution.selectedOption());
        }
        publish(EventType.ASK_RESOLVED, state.ask.workflowId(), requestId, payload);
        state.result.complete(resolution);
        return resolution;
    }

    private AskResolution answerResolution(PendingAsk ask, String answer) {
        String normalized = answer == null ? "" : answer.trim();
        boolean ok = !normalized.isEmpty();
        return new AskResolution(ok, ask.requestId(), ok ? normalized : null,
                selectOption(normalized, ask.options()), false, clock.instant());
    }

    /**
     * A 1-based in-range index or a case-insensitive label picks an option.
     */
    static String selectOption(String answer, List<String> options) {
        if (options == null || options.isEmpty() || answer == null || answer.isBlank()) {
            return null;
        }
        String normalized = answer.trim();
        if (INDEX.matcher(normalized).matches()) {
            int index = Integer.parseInt(normalized);
            if (index >= 1 && index <= options.size()) {
                return options.get(index - 1);
            }
        }
        String lower = normalized.toLowerCase(Locale.ROOT);
        return options.stream()
                .filter(o -> o.toLowerCase(Locale.ROOT).equals(lower))
                .findFirst()
                .orElse(null);
    }

    static List<String> sanitizeOptions(List<String> options) {
        if (options == null) {
            return List.of();
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String option : options) {
            String trimmed = trimToNull(option);
            if (trimmed != null) {
                unique.add(trimmed);
            }
        }
        return List.copyOf(unique);
    }

    private String newRequestId(long epochMillis) {
        String id;
        do {
            StringBuilder suffix = new StringBuilder(6);
            ThreadLocalRandom random = ThreadLocalRandom.current();
            for (int i = 0; i < 6; i++) {
                suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
            }
            id = "ask-" + epochMillis + "-" + suffix;
        } while (pending.containsKey(id) || settled.containsKey(id));
        return id;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private void publish(EventType type, String workflowId, String requestId, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(FleetEvent.of(type, workflowId, requestId, payload));
        }
    }
}
