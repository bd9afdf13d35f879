package com.agentfleet.concurrency;

/**
 * Ordering of the governor's wait queue.
 */
public enum QueueStrategy {
    /** Arrival order. */
    FIFO,
    /** Base priority, highest first; arrival order breaks ties. */
    PRIORITY,
    /** Base priority plus one per {@code agingRateMs} waited. */
    AGING
}
