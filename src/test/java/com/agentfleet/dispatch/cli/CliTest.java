package com.agentfleet.dispatch.cli;

import com.agentfleet.core.engine.WorkflowEngine;
import com.agentfleet.core.events.EventBus;
import com.agentfleet.core.health.HealthCheckService;
import com.agentfleet.core.health.HealthStatus;
import com.agentfleet.core.recovery.RecoveryManager;
import com.agentfleet.core.scheduler.TaskScheduler;
import com.agentfleet.core.state.TaskStateMachine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Exercises the picocli command tree directly, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static final String CHAIN = """
            [
              {"id": "T1", "title": "Implement parser"},
              {"id": "T2", "title": "Implement evaluator", "dependencies": ["T1"]},
              {"id": "T3", "title": "Implement printer", "dependencies": ["T2"], "mainPath": true}
            ]
            """;

    private static final String ONE_EXECUTOR = """
            [ {"id": "exec-1", "role": "executor"} ]
            """;

    @TempDir
    Path tempDir;

    private HealthCheckService health = mock(HealthCheckService.class);

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ScheduleCommand.class) {
                    WorkflowEngine engine = new WorkflowEngine(new TaskStateMachine(), new TaskScheduler(),
                            new RecoveryManager(new TaskStateMachine()), new EventBus(), null);
                    return (K) new ScheduleCommand(engine, new ObjectMapper());
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(health);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new AgentFleetCommand(), factory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private String write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file.toString();
    }

    // =====================================================================
    //  Help output
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("schedule", "policies", "health", "serve", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("AgentFleet 0.1.0"));
        }

        @Test
        @DisplayName("schedule --help shows its options")
        void scheduleHelp() {
            CliResult result = execute("schedule", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--agents"));
            assertTrue(result.output().contains("--ticks"));
        }

        @Test
        @DisplayName("schedule without --agents is a usage error")
        void scheduleMissingAgents() throws IOException {
            CliResult result = execute("schedule", write("tasks.json", CHAIN));
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("--agents"));
        }
    }

    // =====================================================================
    //  schedule
    // =====================================================================

    @Nested
    @DisplayName("schedule")
    class ScheduleTests {

        @Test
        @DisplayName("A dependency chain closes one task per tick")
        void chainCloses() throws IOException {
            CliResult result = execute("schedule", write("tasks.json", CHAIN),
                    "--agents", write("agents.json", ONE_EXECUTOR));

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("[TICK 3]"));
            assertFalse(result.output().contains("[TICK 4]"));
            assertTrue(result.output().contains("All 3 tasks closed"));
        }

        @Test
        @DisplayName("Too few ticks leave the chain unfinished")
        void tickLimit() throws IOException {
            CliResult result = execute("schedule", write("tasks.json", CHAIN),
                    "--agents", write("agents.json", ONE_EXECUTOR), "--ticks", "2");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("2/3 tasks closed after 2 ticks"));
        }

        @Test
        @DisplayName("--no-complete keeps the first task running on its agent")
        void noComplete() throws IOException {
            CliResult result = execute("schedule", write("tasks.json", CHAIN),
                    "--agents", write("agents.json", ONE_EXECUTOR), "--no-complete", "-t", "2");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("T1 on exec-1"));
            assertTrue(result.output().contains("Already running on exec-1"));
            assertTrue(result.output().contains("0/3 tasks closed"));
        }

        @Test
        @DisplayName("Tasks without a matching agent are reported as waiting")
        void noMatchingAgent() throws IOException {
            String reviewerOnly = write("agents.json", "[ {\"id\": \"rev-1\", \"role\": \"reviewer\"} ]");
            CliResult result = execute("schedule", write("tasks.json", CHAIN),
                    "--agents", reviewerOnly, "-t", "1");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("T1 waiting (No suitable agent available)"));
        }

        @Test
        @DisplayName("A missing plan file exits with 2")
        void missingFile() throws IOException {
            CliResult result = execute("schedule", tempDir.resolve("absent.json").toString(),
                    "--agents", write("agents.json", ONE_EXECUTOR));

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Could not read plan"));
        }

        @Test
        @DisplayName("An unknown agent role exits with 2")
        void unknownRole() throws IOException {
            CliResult result = execute("schedule", write("tasks.json", CHAIN),
                    "--agents", write("agents.json", "[ {\"id\": \"w-1\", \"role\": \"wizard\"} ]"));

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Could not read plan"));
        }
    }

    // =====================================================================
    //  policies / health
    // =====================================================================

    @Nested
    @DisplayName("policies")
    class PoliciesTests {

        @Test
        @DisplayName("Without a name every preset is printed")
        void allPresets() {
            CliResult result = execute("policies");
            assertEquals(0, result.exitCode());
            for (String preset : List.of("default", "high-performance", "conservative", "serial")) {
                assertTrue(result.output().contains(preset), "Should print preset " + preset);
            }
        }

        @Test
        @DisplayName("The serial preset is flagged as serial")
        void serialPreset() {
            CliResult result = execute("policies", "serial");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("serial (serial)"));
            assertTrue(result.output().contains("FIFO"));
        }

        @Test
        @DisplayName("An unknown preset prints an error")
        void unknownPreset() {
            CliResult result = execute("policies", "turbo");
            assertTrue(result.output().contains("Unknown concurrency preset: turbo"));
        }
    }

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("All components up exits 0")
        void healthy() {
            when(health.checkAll()).thenReturn(List.of(
                    new HealthStatus("engine", HealthStatus.Status.UP, "Workflow engine running", Map.of()),
                    new HealthStatus("concurrency", HealthStatus.Status.DEGRADED, "Degraded", Map.of())));

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("engine: Workflow engine running"));
            assertTrue(result.output().contains("fleet operational"));
        }

        @Test
        @DisplayName("A DOWN component exits 1")
        void unhealthy() {
            when(health.checkAll()).thenReturn(List.of(
                    new HealthStatus("engine", HealthStatus.Status.DOWN, "Workflow engine stopped", Map.of())));

            CliResult result = execute("health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("one or more components down"));
        }
    }

    @Test
    @DisplayName("serve is detected in any argument position")
    void serveModeDetection() {
        assertTrue(CliRunner.isServeMode("serve"));
        assertTrue(CliRunner.isServeMode("--verbose", "serve"));
        assertFalse(CliRunner.isServeMode("schedule", "tasks.json"));
    }
}
