package com.agentfleet.supervisor;

import com.agentfleet.core.events.EventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class AgentProcessSupervisorTest {

    private SupervisorProperties properties;
    private AgentProcessSupervisor supervisor;
    private AtomicInteger launches;

    @BeforeEach
    void setUp() {
        properties = new SupervisorProperties();
        properties.setStopGraceMs(1000);
        launches = new AtomicInteger();
        ProcessLauncher system = ProcessLauncher.system();
        ProcessLauncher counting = (command, env) -> {
            launches.incrementAndGet();
            return system.launch(command, env);
        };
        supervisor = new AgentProcessSupervisor(properties, new EventBus(), null, counting);
    }

    @AfterEach
    void tearDown() {
        supervisor.stopAll();
    }

    private AgentProcessConfig sleeper(String agentId) {
        return properties.toConfig(agentId, agentId, List.of("/bin/sh", "-c", "sleep 30"));
    }

    private static AgentProcessConfig crasher(String agentId) {
        return AgentProcessConfig.of(agentId, agentId, List.of("/bin/sh", "-c", "exit 3"));
    }

    private static void awaitUntil(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within " + timeoutMs + "ms");
            }
            Thread.sleep(20);
        }
    }

    private AgentProcessStatus status(String agentId) {
        return supervisor.info(agentId).orElseThrow().status();
    }

    @Test
    @DisplayName("Scheduler threads are daemons with distinct names")
    void schedulerThreadNames() {
        var factory = AgentProcessSupervisor.schedulerThreads();
        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertEquals("agent-supervisor-1", first.getName());
        assertEquals("agent-supervisor-2", second.getName());
        assertTrue(first.isDaemon());
    }

    @Test
    @DisplayName("Properties defaults flow into process configs")
    void propertiesToConfig() {
        properties.setMaxRestarts(7);
        AgentProcessConfig config = sleeper("exec-1");

        assertEquals(7, config.maxRestarts());
        assertEquals(1000, config.stopGraceMs());
        assertEquals(AgentProcessConfig.DEFAULT_HEARTBEAT_MARKER, config.heartbeatMarker());
    }

    @Test
    @DisplayName("start registers the process and list reports it")
    void startAndList() {
        AgentProcessInfo info = supervisor.start(sleeper("exec-1"));

        assertEquals(AgentProcessStatus.RUNNING, info.status());
        assertEquals(List.of("exec-1"), supervisor.list().stream().map(AgentProcessInfo::agentId).toList());
        assertEquals(info.pid(), supervisor.info("exec-1").orElseThrow().pid());
    }

    @Test
    @DisplayName("Starting a running agent again is rejected")
    void duplicateStart() {
        supervisor.start(sleeper("exec-1"));
        assertThrows(IllegalStateException.class, () -> supervisor.start(sleeper("exec-1")));
    }

    @Test
    @DisplayName("ensureRunning reuses the live process")
    void ensureRunningReuses() {
        AgentProcessInfo first = supervisor.ensureRunning(sleeper("exec-1"));
        AgentProcessInfo second = supervisor.ensureRunning(sleeper("exec-1"));

        assertEquals(first.pid(), second.pid());
    }

    @Test
    @DisplayName("ensureRunning starts a fresh process after a stop")
    void ensureRunningAfterStop() throws Exception {
        AgentProcessInfo first = supervisor.start(sleeper("exec-1"));
        supervisor.stop("exec-1", StopSignal.GRACEFUL).get(5, TimeUnit.SECONDS);

        AgentProcessInfo second = supervisor.ensureRunning(sleeper("exec-1"));

        assertNotEquals(first.pid(), second.pid());
        assertEquals(AgentProcessStatus.RUNNING, second.status());
    }

    @Test
    @DisplayName("A crashed agent waiting for its restart cannot be replaced")
    void startDuringRestart() throws Exception {
        supervisor.start(crasher("exec-1").withRestart(true, 3, 2000));
        awaitUntil(() -> status("exec-1") == AgentProcessStatus.RESTARTING, 5_000);

        assertThrows(IllegalStateException.class, () -> supervisor.start(sleeper("exec-1")));
        assertEquals(AgentProcessStatus.RESTARTING, supervisor.ensureRunning(sleeper("exec-1")).status());
        assertEquals(1, launches.get());

        supervisor.stopAll();
        assertEquals(AgentProcessStatus.STOPPED, status("exec-1"));
        Thread.sleep(300);
        assertEquals(1, launches.get());
    }

    @Test
    @DisplayName("ensureRunning relaunches a crashed agent against its restart budget and then refuses")
    void ensureRunningKeepsRestartBudget() throws Exception {
        AgentProcessConfig config = crasher("exec-1").withRestart(false, 1, 0);
        supervisor.start(config);
        awaitUntil(() -> status("exec-1") == AgentProcessStatus.CRASHED, 5_000);

        AgentProcessInfo relaunched = supervisor.ensureRunning(config);
        assertEquals(1, relaunched.restartCount());
        awaitUntil(() -> status("exec-1") == AgentProcessStatus.CRASHED, 5_000);

        var ex = assertThrows(IllegalStateException.class, () -> supervisor.ensureRunning(config));
        assertEquals("Agent exec-1 exceeded max restarts (1)", ex.getMessage());
        assertEquals(2, launches.get());
        assertEquals(1, supervisor.info("exec-1").orElseThrow().restartCount());
    }

    @Test
    @DisplayName("Heartbeats route to the agent's process")
    void heartbeat() {
        supervisor.start(sleeper("exec-1"));

        assertTrue(supervisor.updateHeartbeat("exec-1"));
        assertNotNull(supervisor.info("exec-1").orElseThrow().lastHeartbeat());
        assertFalse(supervisor.updateHeartbeat("ghost"));
    }

    @Test
    @DisplayName("Unknown agents cannot be stopped")
    void stopUnknown() {
        var ex = assertThrows(IllegalArgumentException.class, () -> supervisor.stop("ghost", StopSignal.FORCE));
        assertEquals("Unknown agent process: ghost", ex.getMessage());
        assertTrue(supervisor.info("ghost").isEmpty());
    }

    @Test
    @DisplayName("stopAll stops every child")
    void stopAll() {
        supervisor.start(sleeper("exec-1"));
        supervisor.start(sleeper("exec-2"));

        supervisor.stopAll();

        assertTrue(supervisor.list().stream().allMatch(p -> p.status() == AgentProcessStatus.STOPPED));
    }
}
