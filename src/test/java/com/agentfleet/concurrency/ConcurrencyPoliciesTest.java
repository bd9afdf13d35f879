package com.agentfleet.concurrency;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyPoliciesTest {

    @Test
    @DisplayName("Presets resolve by name, case and separator insensitive")
    void byName() {
        assertSame(ConcurrencyPolicies.DEFAULT, ConcurrencyPolicies.byName("default"));
        assertSame(ConcurrencyPolicies.DEFAULT, ConcurrencyPolicies.byName(null));
        assertSame(ConcurrencyPolicies.HIGH_PERFORMANCE, ConcurrencyPolicies.byName("HIGH_PERFORMANCE"));
        assertSame(ConcurrencyPolicies.CONSERVATIVE, ConcurrencyPolicies.byName(" conservative "));
        assertSame(ConcurrencyPolicies.SERIAL, ConcurrencyPolicies.byName("serial"));
    }

    @Test
    @DisplayName("Unknown preset names are rejected")
    void unknownName() {
        var ex = assertThrows(IllegalArgumentException.class, () -> ConcurrencyPolicies.byName("turbo"));
        assertTrue(ex.getMessage().contains("turbo"));
    }

    @Test
    @DisplayName("all() lists presets in a stable order")
    void all() {
        assertEquals(List.of("default", "high-performance", "conservative", "serial"),
                List.copyOf(ConcurrencyPolicies.all().keySet()));
    }

    @Test
    @DisplayName("Only the serial preset is serial mode")
    void serialMode() {
        assertTrue(ConcurrencyPolicies.isSerialMode(ConcurrencyPolicies.SERIAL));
        assertFalse(ConcurrencyPolicies.isSerialMode(ConcurrencyPolicies.DEFAULT));
        assertFalse(ConcurrencyPolicies.isSerialMode(ConcurrencyPolicies.CONSERVATIVE));
    }

    @Test
    @DisplayName("Conservative preset pauses dispatch when degraded")
    void conservativeShape() {
        ConcurrencyPolicy policy = ConcurrencyPolicies.CONSERVATIVE;
        assertEquals(2, policy.globalMaxConcurrency());
        assertEquals(QueueStrategy.FIFO, policy.queueStrategy());
        assertTrue(policy.degradationPolicy().pauseNewDispatches());
    }

    @Test
    @DisplayName("Queue position text")
    void describeQueuePosition() {
        assertEquals("Starting next", ConcurrencyPolicies.describeQueuePosition(0, 3));
        assertEquals("Queue position: 2/3", ConcurrencyPolicies.describeQueuePosition(2, 3));
    }

    @Test
    @DisplayName("Properties resolve the preset and apply a queue strategy override")
    void propertiesOverride() {
        var properties = new ConcurrencyProperties();
        assertSame(ConcurrencyPolicies.DEFAULT, properties.resolvePolicy());

        properties.setPreset("conservative");
        properties.setQueueStrategy(QueueStrategy.PRIORITY);
        ConcurrencyPolicy policy = properties.resolvePolicy();

        assertEquals(QueueStrategy.PRIORITY, policy.queueStrategy());
        assertEquals(2, policy.globalMaxConcurrency());
    }
}
