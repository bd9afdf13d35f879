package com.agentfleet.concurrency;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyGovernorTest {

    /** Clock the test advances by hand. */
    static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2026-01-01T00:00:00Z");

        void advance(long ms) {
            now = now.plusMillis(ms);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
    }

    private ConcurrencyGovernor governor(ConcurrencyPolicy policy) {
        return new ConcurrencyGovernor(policy, clock);
    }

    private static ConcurrencyPolicy pausingPolicy() {
        return new ConcurrencyPolicy(4, Map.of(), 2000, 500, EstimatorMode.STATIC, Map.of(), 0.7,
                QueueStrategy.FIFO, 5000, 30_000, 120_000,
                new ConcurrencyPolicy.RetryPolicy(2, 1000, 30_000, List.of()),
                new ConcurrencyPolicy.DegradationPolicy(0.4, 3, true));
    }

    // -- Admission -----------------------------------------------------

    @Nested
    @DisplayName("evaluate")
    class Evaluate {

        @Test
        @DisplayName("Idle governor admits a long task with a high benefit score")
        void admits() {
            SchedulingDecision decision = governor(ConcurrencyPolicies.DEFAULT)
                    .evaluate("t1", "generate code", "executor");

            assertTrue(decision.allowed());
            assertEquals("All admission conditions met", decision.reason());
            assertEquals(10_000, decision.estimatedDurationMs());
            assertEquals(10_000.0 / 10_500, decision.benefitScore(), 1e-9);
            assertNull(decision.suggestedConcurrency());
        }

        @Test
        @DisplayName("Global ceiling denies and suggests one less")
        void globalCeiling() {
            var governor = governor(ConcurrencyPolicies.SERIAL);
            governor.startTask("t1", "generate code", "executor");

            SchedulingDecision decision = governor.evaluate("t2", "generate code", "tool");

            assertFalse(decision.allowed());
            assertEquals("Global concurrency limit reached (1/1)", decision.reason());
            assertEquals(1, decision.suggestedConcurrency());
        }

        @Test
        @DisplayName("Per-resource ceiling denies only that resource class")
        void resourceCeiling() {
            var governor = governor(ConcurrencyPolicies.DEFAULT);
            governor.startTask("o1", "generate code", "orchestrator");

            SchedulingDecision denied = governor.evaluate("o2", "generate code", "orchestrator");
            assertFalse(denied.allowed());
            assertTrue(denied.reason().startsWith("Resource orchestrator concurrency limit reached"));

            assertTrue(governor.evaluate("e1", "generate code", "executor").allowed());
        }

        @Test
        @DisplayName("Unknown resource classes get the fallback limit")
        void unknownResourceLimit() {
            var governor = governor(pausingPolicy());
            assertTrue(governor.evaluate("x", "generate code", "gpu").allowed());
        }

        @Test
        @DisplayName("Short tasks are not run next to active tasks")
        void shortTaskRule() {
            var governor = governor(ConcurrencyPolicies.DEFAULT);
            assertTrue(governor.evaluate("f1", "copy file", "tool").allowed());

            governor.startTask("long", "generate code", "executor");
            SchedulingDecision decision = governor.evaluate("f1", "copy file", "tool");

            assertFalse(decision.allowed());
            assertEquals(1000, decision.estimatedDurationMs());
            assertTrue(decision.reason().contains("below the scheduling benefit threshold"));
        }

        @Test
        @DisplayName("Pausing degradation refuses admission with no predicted start")
        void pauseWhileDegraded() {
            var governor = governor(pausingPolicy());
            governor.startTask("t1", "generate code", "tool");
            governor.startTask("t2", "generate code", "tool");
            assertTrue(governor.isDegraded());

            SchedulingDecision decision = governor.evaluate("t3", "generate code", "tool");

            assertFalse(decision.allowed());
            assertEquals(-1, decision.estimatedStartTime());
            assertEquals(3, decision.suggestedConcurrency());
        }
    }

    // -- Degradation ---------------------------------------------------

    @Nested
    @DisplayName("Degradation")
    class Degradation {

        @Test
        @DisplayName("Activates above the threshold, lowers the ceiling and clears below it")
        void lifecycle() {
            var governor = governor(ConcurrencyPolicies.DEFAULT);
            for (int i = 0; i < 5; i++) {
                governor.startTask("t" + i, "generate code", "r" + i);
            }

            assertTrue(governor.isDegraded());
            SchedulingDecision decision = governor.evaluate("t9", "generate code", "r9");
            assertFalse(decision.allowed());
            assertEquals("Global concurrency limit reached (5/2)", decision.reason());

            governor.completeTask("t0", true);
            assertFalse(governor.isDegraded());
            assertEquals(1, governor.getStats().degradationCount());
        }

        @Test
        @DisplayName("Staying above the threshold counts one activation")
        void countedOncePerEntry() {
            var governor = governor(ConcurrencyPolicies.CONSERVATIVE);
            governor.startTask("t1", "generate code", "tool");
            governor.startTask("t2", "generate code", "tool");
            governor.startTask("t3", "generate code", "tool");

            assertEquals(1, governor.getStats().degradationCount());
        }
    }

    // -- Queue ---------------------------------------------------------

    @Nested
    @DisplayName("Wait queue")
    class WaitQueue {

        @Test
        @DisplayName("FIFO keeps arrival order")
        void fifo() {
            var governor = governor(ConcurrencyPolicies.CONSERVATIVE);
            governor.enqueue("a", "generate code", "tool", 1);
            clock.advance(10);
            governor.enqueue("b", "generate code", "tool", 9);

            assertEquals(List.of("a", "b"), governor.queued().stream().map(ConcurrencyGovernor.QueuedTask::taskKey).toList());
        }

        @Test
        @DisplayName("PRIORITY orders by base priority")
        void priority() {
            var governor = governor(ConcurrencyPolicies.DEFAULT.withQueueStrategy(QueueStrategy.PRIORITY));
            governor.enqueue("a", "generate code", "tool", 1);
            clock.advance(10);
            governor.enqueue("b", "generate code", "tool", 9);

            assertEquals("b", governor.queued().get(0).taskKey());
        }

        @Test
        @DisplayName("AGING lets a long-waiting task overtake a higher base priority")
        void aging() {
            var governor = governor(ConcurrencyPolicies.DEFAULT);
            governor.enqueue("old", "generate code", "tool", 1);
            clock.advance(20_000);
            governor.enqueue("new", "generate code", "tool", 3);

            List<ConcurrencyGovernor.QueuedTask> queued = governor.queued();
            assertEquals("old", queued.get(0).taskKey());
            assertEquals(5, queued.get(0).currentPriority());
            assertEquals(3, queued.get(1).currentPriority());
        }

        @Test
        @DisplayName("dequeue returns the first admissible task and startTask consumes it")
        void dequeue() {
            var governor = governor(ConcurrencyPolicies.SERIAL);
            governor.startTask("running", "generate code", "tool");
            governor.enqueue("next", "generate code", "tool", 5);

            assertTrue(governor.dequeue().isEmpty());

            governor.completeTask("running", true);
            ConcurrencyGovernor.QueuedTask next = governor.dequeue().orElseThrow();
            assertEquals("next", next.taskKey());
            assertTrue(governor.queued().isEmpty());
        }

        @Test
        @DisplayName("startTask removes a queued entry with the same key")
        void startConsumesQueued() {
            var governor = governor(ConcurrencyPolicies.DEFAULT);
            governor.enqueue("a", "generate code", "tool", 5);
            clock.advance(250);
            governor.startTask("a", "generate code", "tool");

            assertTrue(governor.queued().isEmpty());
            assertTrue(governor.isActive("a"));
            assertEquals(250.0, governor.getStats().avgSchedulingLatencyMs(), 1e-9);
        }

        @Test
        @DisplayName("Tasks queued past the block timeout are reported")
        void blockedTooLong() {
            var governor = governor(ConcurrencyPolicies.DEFAULT);
            governor.enqueue("a", "generate code", "tool", 5);
            clock.advance(30_000);
            assertTrue(governor.blockedTooLong().isEmpty());

            clock.advance(1);
            assertEquals("a", governor.blockedTooLong().get(0).taskKey());
        }

        @Test
        @DisplayName("Active tasks past the execution timeout are overdue")
        void overdue() {
            var governor = governor(ConcurrencyPolicies.DEFAULT);
            governor.startTask("a", "generate code", "tool");
            clock.advance(120_001);

            assertEquals(List.of("a"), governor.overdueTasks());
        }
    }

    // -- Estimation ----------------------------------------------------

    @Nested
    @DisplayName("Estimation")
    class Estimation {

        @Test
        @DisplayName("Task type is inferred from the description")
        void inferTaskType() {
            assertEquals("web_search", ConcurrencyGovernor.inferTaskType("Search the docs"));
            assertEquals("file_ops", ConcurrencyGovernor.inferTaskType("Rename file"));
            assertEquals("code_generation", ConcurrencyGovernor.inferTaskType("Write code"));
            assertEquals("shell_exec", ConcurrencyGovernor.inferTaskType("exec the build"));
            assertEquals("report_generation", ConcurrencyGovernor.inferTaskType("Weekly report"));
            assertEquals("general", ConcurrencyGovernor.inferTaskType(null));
        }

        @Test
        @DisplayName("Unknown types fall back to the default estimate")
        void fallback() {
            assertEquals(ConcurrencyGovernor.FALLBACK_ESTIMATE_MS,
                    governor(ConcurrencyPolicies.DEFAULT).estimateExecutionTime("t", "think hard"));
        }

        @Test
        @DisplayName("ADAPTIVE blends history in once enough samples exist")
        void adaptive() {
            var governor = governor(ConcurrencyPolicies.DEFAULT);
            for (int i = 0; i < 2; i++) {
                governor.startTask("t" + i, "generate code", "executor");
                clock.advance(2000);
                governor.completeTask("t" + i, true);
            }
            assertEquals(10_000, governor.estimateExecutionTime("x", "generate code"));

            governor.startTask("t2", "generate code", "executor");
            clock.advance(2000);
            governor.completeTask("t2", false);

            assertEquals(4400, governor.estimateExecutionTime("x", "generate code"));
            ConcurrencyStats stats = governor.getStats();
            assertEquals(2000, stats.avgExecutionTimeMs());
            assertEquals(2.0 / 3, stats.successRate(), 1e-9);
        }

        @Test
        @DisplayName("STATIC ignores history")
        void staticMode() {
            var governor = governor(ConcurrencyPolicies.DEFAULT.withEstimator(EstimatorMode.STATIC));
            for (int i = 0; i < 3; i++) {
                governor.startTask("t" + i, "generate code", "executor");
                clock.advance(100);
                governor.completeTask("t" + i, true);
            }
            assertEquals(10_000, governor.estimateExecutionTime("x", "generate code"));
        }

        @Test
        @DisplayName("EXTERNAL uses provided estimates with a conservative fallback")
        void external() {
            var governor = governor(ConcurrencyPolicies.DEFAULT.withEstimator(EstimatorMode.EXTERNAL));
            assertEquals(ConcurrencyGovernor.EXTERNAL_FALLBACK_ESTIMATE_MS, governor.estimateExecutionTime("t", "x"));

            governor.provideEstimate("t", 750);
            assertEquals(750, governor.estimateExecutionTime("t", "x"));
        }
    }

    @Test
    @DisplayName("releaseTask frees the slot without an execution sample")
    void releaseTask() {
        var governor = governor(ConcurrencyPolicies.DEFAULT);
        governor.startTask("a", "generate code", "tool");
        governor.releaseTask("a");

        assertFalse(governor.isActive("a"));
        assertEquals(0, governor.getStats().activeTasks());
        assertEquals(0, governor.getStats().avgExecutionTimeMs());
        assertEquals(1.0, governor.getStats().successRate());
    }

    @Test
    @DisplayName("Stats group active tasks by resource class")
    void statsByResource() {
        var governor = governor(ConcurrencyPolicies.DEFAULT);
        governor.startTask("a", "generate code", "executor");
        governor.startTask("b", "generate code", "executor");
        governor.enqueue("c", "generate code", "tool", 5);

        ConcurrencyStats stats = governor.getStats();
        assertEquals(2, stats.activeTasks());
        assertEquals(1, stats.queuedTasks());
        assertEquals(Map.of("executor", 2), stats.activeByResource());
    }

    @Test
    @DisplayName("updatePolicy takes effect on the next evaluation")
    void updatePolicy() {
        var governor = governor(ConcurrencyPolicies.DEFAULT);
        governor.startTask("a", "generate code", "tool");
        governor.updatePolicy(ConcurrencyPolicies.SERIAL);

        assertSame(ConcurrencyPolicies.SERIAL, governor.getPolicy());
        assertFalse(governor.evaluate("b", "generate code", "tool").allowed());
    }
}
