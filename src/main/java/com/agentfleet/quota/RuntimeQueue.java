package com.agentfleet.quota;

import com.agentfleet.core.events.EventBus;
import com.agentfleet.core.events.EventType;
import com.agentfleet.core.events.FleetEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FIFO admission queue enforcing at most {@code maxConcurrent} active instances
 * for one agent config within one workflow.
 * <p>
 * Ordering is strictly first-in first-out; the priority recorded at enqueue time is kept
 * for observability only. {@link #tryDequeue()} never blocks and is meant to be polled.
 * Completed instances are archived, never deleted. All methods are thread-safe.
 */
public class RuntimeQueue {

    private static final Logger log = LoggerFactory.getLogger(RuntimeQueue.class);

    public static final int DEFAULT_PRIORITY = 5;

    private record QueueItem(RuntimeInstance instance, Instant enqueuedAt, int priority) {}

    private final String agentConfigId;
    private final EventBus eventBus;

    private final List<QueueItem> queue = new ArrayList<>();
    private final Map<String, RuntimeInstance> active = new LinkedHashMap<>();
    private final Map<String, RuntimeInstance> completed = new LinkedHashMap<>();
    private int maxConcurrent = 1;

    public RuntimeQueue(String agentConfigId, EventBus eventBus) {
        this.agentConfigId = agentConfigId;
        this.eventBus = eventBus;
    }

    public RuntimeQueue(String agentConfigId) {
        this(agentConfigId, null);
    }

    public String agentConfigId() {
        return agentConfigId;
    }

    public synchronized void setMaxConcurrent(int max) {
        this.maxConcurrent = Math.max(1, max);
    }

    public synchronized int getMaxConcurrent() {
        return maxConcurrent;
    }

    /**
     * Appends an instance to the tail of the queue.
     *
     * @return the instance's 1-based queue position
     */
    public int enqueue(RuntimeInstance instance, int priority) {
        RuntimeInstance queued;
        int position;
        synchronized (this) {
            queue.add(new QueueItem(instance.withStatus(RuntimeStatus.QUEUED, null), Instant.now(), priority));
            updateQueuePositions();
            position = queue.size();
            queued = queue.get(position - 1).instance();
        }
        log.debug("Enqueued {} for {} at position {}", instance.instanceId(), agentConfigId, position);
        publish(EventType.RUNTIME_SPAWNED, queued, Map.of(
                "queuePosition", position,
                "queuedCount", position));
        return position;
    }

    public int enqueue(RuntimeInstance instance) {
        return enqueue(instance, DEFAULT_PRIORITY);
    }

    /**
     * Pops the head of the queue if a slot is free.
     *
     * @return the instance now RUNNING, or empty when saturated or nothing is queued
     */
    public Optional<RuntimeInstance> tryDequeue() {
        RuntimeInstance started;
        synchronized (this) {
            if (active.size() >= maxConcurrent || queue.isEmpty()) {
                return Optional.empty();
            }
            QueueItem item = queue.remove(0);
            started = item.instance().running(Instant.now());
            active.put(started.instanceId(), started);
            updateQueuePositions();
        }
        log.debug("Dequeued {} for {}", started.instanceId(), agentConfigId);
        publish(EventType.RUNTIME_STATUS_CHANGED, started, Map.of(
                "previousStatus", RuntimeStatus.QUEUED.name(),
                "currentStatus", RuntimeStatus.RUNNING.name()));
        return Optional.of(started);
    }

    /**
     * Moves an active instance to the archive. Unknown or already-completed ids are
     * logged and ignored.
     */
    public void complete(String instanceId, FinalStatus finalStatus, String errorReason) {
        RuntimeInstance finished;
        synchronized (this) {
            RuntimeInstance instance = active.remove(instanceId);
            if (instance == null) {
                log.warn("Instance {} not found in active set of {}", instanceId, agentConfigId);
                return;
            }
            finished = instance.finished(finalStatus, errorReason, Instant.now());
            completed.put(instanceId, finished);
        }
        log.info("Instance {} finished: {}{}", instanceId, finalStatus,
                errorReason != null ? " (" + errorReason + ")" : "");

        var payload = new HashMap<String, Object>();
        payload.put("finalStatus", finalStatus.name());
        if (finished.startedAt() != null) {
            payload.put("durationMs", Duration.between(finished.startedAt(), finished.endedAt()).toMillis());
        }
        if (errorReason != null) payload.put("errorReason", errorReason);
        publish(EventType.RUNTIME_FINISHED, finished, payload);
    }

    public void complete(String instanceId, FinalStatus finalStatus) {
        complete(instanceId, finalStatus, null);
    }

    /**
     * Updates the status of an active or queued instance.
     *
     * @return false when the instance is neither active nor queued
     */
    public boolean updateStatus(String instanceId, RuntimeStatus status, String summary) {
        RuntimeInstance previous;
        RuntimeInstance updated;
        synchronized (this) {
            previous = active.get(instanceId);
            if (previous != null) {
                updated = previous.withStatus(status, summary);
                active.put(instanceId, updated);
            } else {
                int idx = indexOfQueued(instanceId);
                if (idx < 0) return false;
                QueueItem item = queue.get(idx);
                previous = item.instance();
                updated = previous.withStatus(status, summary);
                queue.set(idx, new QueueItem(updated, item.enqueuedAt(), item.priority()));
            }
        }
        publish(EventType.RUNTIME_STATUS_CHANGED, updated, Map.of(
                "previousStatus", previous.status().name(),
                "currentStatus", status.name()));
        return true;
    }

    /**
     * Records the OS pid of the process serving an active instance.
     */
    public synchronized boolean attachPid(String instanceId, long pid) {
        RuntimeInstance instance = active.get(instanceId);
        if (instance == null) return false;
        active.put(instanceId, instance.withPid(pid));
        return true;
    }

    /**
     * Looks in active, then completed, then queued.
     */
    public synchronized Optional<RuntimeInstance> getInstance(String instanceId) {
        RuntimeInstance found = active.get(instanceId);
        if (found == null) found = completed.get(instanceId);
        if (found == null) {
            int idx = indexOfQueued(instanceId);
            if (idx >= 0) found = queue.get(idx).instance();
        }
        return Optional.ofNullable(found);
    }

    public synchronized List<RuntimeInstance> getQueued() {
        return queue.stream().map(QueueItem::instance).toList();
    }

    public synchronized List<RuntimeInstance> getActive() {
        return List.copyOf(active.values());
    }

    public synchronized List<RuntimeInstance> getCompleted() {
        return List.copyOf(completed.values());
    }

    public synchronized RuntimeQueueStats getStats() {
        return new RuntimeQueueStats(queue.size(), active.size(), completed.size(), maxConcurrent);
    }

    public synchronized void clearCompleted() {
        completed.clear();
    }

    public synchronized void reset() {
        queue.clear();
        active.clear();
        completed.clear();
    }

    private void updateQueuePositions() {
        int count = queue.size();
        for (int i = 0; i < count; i++) {
            QueueItem item = queue.get(i);
            queue.set(i, new QueueItem(item.instance().queuedAt(i + 1, count), item.enqueuedAt(), item.priority()));
        }
    }

    private int indexOfQueued(String instanceId) {
        for (int i = 0; i < queue.size(); i++) {
            if (queue.get(i).instance().instanceId().equals(instanceId)) return i;
        }
        return -1;
    }

    private void publish(EventType type, RuntimeInstance instance, Map<String, Object> extra) {
        if (eventBus == null) return;
        var payload = new HashMap<String, Object>(extra);
        payload.put("agentConfigId", instance.agentConfigId());
        if (instance.taskId() != null) payload.put("taskId", instance.taskId());
        eventBus.publish(FleetEvent.of(type, instance.workflowId(), instance.instanceId(), payload));
    }
}
