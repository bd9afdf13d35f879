package com.agentfleet.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub channel for lifecycle events.
 * <p>
 * A subscription may be narrowed to one workflow, to a set of event types, or both.
 * Delivery is fire-and-forget on the publishing thread: a subscriber that throws is logged
 * and skipped, the remaining subscribers still receive the event.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /**
     * @param workflowId null for every workflow, including events that carry no workflow
     * @param types      empty for every type
     */
    private record Subscriber(String workflowId, Set<EventType> types, Consumer<FleetEvent> consumer) {
        boolean wants(FleetEvent event) {
            if (workflowId != null && !workflowId.equals(event.workflowId())) return false;
            return types.isEmpty() || types.contains(event.type());
        }
    }

    private final CopyOnWriteArrayList<Subscriber> subscribers = new CopyOnWriteArrayList<>();

    public void publish(FleetEvent event) {
        log.debug("Publishing event: {} for workflow {} ({})",
                event.type().wireName(), event.workflowId(), event.subjectId());
        for (Subscriber subscriber : subscribers) {
            if (subscriber.wants(event)) {
                deliverSafely(subscriber.consumer(), event);
            }
        }
    }

    /**
     * Subscribe to every event of one workflow.
     */
    public Subscription subscribe(String workflowId, Consumer<FleetEvent> consumer) {
        return subscribe(workflowId, Set.of(), consumer);
    }

    /**
     * Subscribe to some event types.
     *
     * @param workflowId workflow to follow, or null for all of them
     * @param types      types to receive, empty for all
     */
    public Subscription subscribe(String workflowId, Set<EventType> types, Consumer<FleetEvent> consumer) {
        Set<EventType> filter = types == null || types.isEmpty() ? Set.of() : EnumSet.copyOf(types);
        Subscriber subscriber = new Subscriber(workflowId, filter, consumer);
        subscribers.add(subscriber);
        log.debug("Subscribed to workflow {} (types {})", workflowId == null ? "*" : workflowId,
                filter.isEmpty() ? "*" : filter);
        return () -> subscribers.remove(subscriber);
    }

    /**
     * Subscribe to events from all workflows.
     */
    public Subscription subscribeAll(Consumer<FleetEvent> consumer) {
        return subscribe(null, Set.of(), consumer);
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<FleetEvent> subscriber, FleetEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.type().wireName(), e.getMessage(), e);
        }
    }
}
