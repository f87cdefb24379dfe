package com.maestro.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.maestro.core.agent.AgentRegistry;
import com.maestro.core.agent.DefaultAgentProfiles;
import com.maestro.core.engine.AgentExecutor;
import com.maestro.core.engine.LifecycleNotifier;
import com.maestro.core.engine.MockAgentExecutor;
import com.maestro.core.engine.TaskDispatcher;
import com.maestro.core.engine.WorkflowEngine;
import com.maestro.core.events.EventBus;
import com.maestro.core.plan.PlanParser;
import com.maestro.core.plan.PlanTranslator;
import com.maestro.core.scheduler.ReadySetScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
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

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises picocli directly without a Spring context, wiring a real engine
 * around a scripted agent executor.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path tempDir;

    private AgentRegistry registry;
    private EventBus eventBus;
    private WorkflowEngine engine;

    @BeforeEach
    void setUp() {
        registry = new AgentRegistry();
        DefaultAgentProfiles.registerAll(registry);
        eventBus = new EventBus();
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.shutdown();
        }
    }

    private WorkflowEngine engine(AgentExecutor executor) {
        var notifier = new LifecycleNotifier(eventBus);
        engine = new WorkflowEngine(new ReadySetScheduler(), new TaskDispatcher(executor, notifier, null),
                new PlanTranslator(registry, null, 3, 2, "Developer", true), notifier, null, 4, 200, 1);
        return engine;
    }

    private CommandLine.IFactory factory(WorkflowEngine workflowEngine) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(workflowEngine, new PlanParser(), eventBus);
                }
                if (cls == AgentsCommand.class) {
                    return (K) new AgentsCommand(registry);
                }
                if (cls == RouteCommand.class) {
                    return (K) new RouteCommand(registry);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(new MockAgentExecutor(), args);
    }

    private CliResult execute(AgentExecutor executor, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            var commandLine = new CommandLine(new MaestroCommand(), factory(engine(executor)));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private Path planFile(String json) throws IOException {
        Path file = tempDir.resolve("plan.json");
        Files.writeString(file, json);
        return file;
    }

    @Nested
    @DisplayName("help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("run"));
            assertTrue(result.output().contains("agents"));
            assertTrue(result.output().contains("route"));
        }

        @Test
        @DisplayName("--version shows version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Maestro 0.1.0"));
        }
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("a successful plan exits 0 and prints the summary")
        void successfulPlan() throws IOException {
            Path plan = planFile("""
                    {"name": "Login", "objective": "Ship login", "tasks": [
                      {"task": "Research auth libraries", "assignee": "Research"},
                      {"task": "Implement login endpoint", "depends_on": [1]}
                    ]}
                    """);

            CliResult result = execute("run", plan.toString());

            assertEquals(RunCommand.EXIT_OK, result.exitCode());
            assertTrue(result.output().contains("task_1"));
            assertTrue(result.output().contains("2 completed, 0 failed, 0 skipped, 0 cancelled"));
        }

        @Test
        @DisplayName("a failing task exits 1 and skips its dependents")
        void failingPlan() throws IOException {
            Path plan = planFile("""
                    [{"task": "break things", "max_retries": 1}, {"task": "after", "depends_on": [1]}]
                    """);
            AgentExecutor failing = (agent, task, context) -> {
                if (task.startsWith("break")) throw new IllegalStateException("exploded");
                return "ok";
            };

            CliResult result = execute(failing, "run", "--quiet", plan.toString());

            assertEquals(RunCommand.EXIT_WORKFLOW_ERRORS, result.exitCode());
            assertTrue(result.output().contains("completed_with_errors"));
            assertTrue(result.output().contains("Dependency failed: task_1"));
        }

        @Test
        @DisplayName("--json prints a parseable snapshot")
        void jsonOutput() throws Exception {
            Path plan = planFile("[{\"task\": \"Write the README\"}]");

            CliResult result = execute("run", "--json", plan.toString());

            assertEquals(0, result.exitCode());
            var json = new ObjectMapper().readTree(result.output());
            assertEquals("completed", json.get("status").asText());
            assertEquals("Documentation", json.get("tasks").get(0).get("assignee").asText());
        }

        @Test
        @DisplayName("a cyclic plan exits 2")
        void cyclicPlan() throws IOException {
            Path plan = planFile("""
                    [{"task": "a", "depends_on": [2]}, {"task": "b", "depends_on": [1]}]
                    """);

            CliResult result = execute("run", plan.toString());

            assertEquals(RunCommand.EXIT_BAD_PLAN, result.exitCode());
            assertTrue(result.output().contains("CYCLE"));
        }

        @Test
        @DisplayName("an unreadable or malformed plan exits 2")
        void badPlanFile() throws IOException {
            assertEquals(RunCommand.EXIT_BAD_PLAN,
                    execute("run", tempDir.resolve("missing.json").toString()).exitCode());
            assertEquals(RunCommand.EXIT_BAD_PLAN, execute("run", planFile("not json").toString()).exitCode());
        }
    }

    @Nested
    @DisplayName("agents and route")
    class AgentTests {

        @Test
        @DisplayName("agents lists the default profiles")
        void listsAgents() {
            CliResult result = execute("agents");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("UI/UX Designer"));
            assertTrue(result.output().contains("CODE_GENERATION"));
        }

        @Test
        @DisplayName("route names the best match")
        void routesTask() {
            CliResult result = execute("route", "test", "the", "signup", "flow");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Best match: QA Tester"));
        }

        @Test
        @DisplayName("route reports when nothing matches")
        void routesNothing() {
            CliResult result = execute("route", "zzz");

            assertTrue(result.output().contains("No agent matches"));
        }
    }
}
