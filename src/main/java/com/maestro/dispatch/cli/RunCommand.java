package com.maestro.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.maestro.core.engine.WorkflowEngine;
import com.maestro.core.events.EventBus;
import com.maestro.core.model.Workflow;
import com.maestro.core.model.WorkflowSnapshot;
import com.maestro.core.model.WorkflowStatus;
import com.maestro.core.plan.InvalidPlanException;
import com.maestro.core.plan.PlanParseException;
import com.maestro.core.plan.PlanParser;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: maestro run &lt;plan.json&gt;
 * <p>
 * Builds a workflow from a plan file, executes it with the configured agent executor
 * and prints the final status. Exit code 0 when every task completed, 1 when the
 * workflow ended with errors or was cancelled, 2 when the plan could not be used.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Execute a task plan")
@Component
public class RunCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_WORKFLOW_ERRORS = 1;
    static final int EXIT_BAD_PLAN = 2;

    @Parameters(index = "0", description = "Plan file (JSON array of tasks or {name, objective, tasks})")
    private Path planFile;

    @Option(names = {"--name", "-n"}, description = "Workflow name (overrides the plan file)")
    private String name;

    @Option(names = {"--objective", "-o"}, description = "Objective text (overrides the plan file)")
    private String objective;

    @Option(names = {"--max-parallel", "-p"}, description = "Maximum tasks per batch (default: engine setting)")
    private Integer maxParallel;

    @Option(names = {"--json"}, description = "Print the final status snapshot as JSON")
    private boolean json;

    @Option(names = {"--quiet", "-q"}, description = "Do not print lifecycle events")
    private boolean quiet;

    private final WorkflowEngine engine;
    private final PlanParser planParser;
    private final EventBus eventBus;

    public RunCommand(WorkflowEngine engine, PlanParser planParser, EventBus eventBus) {
        this.engine = engine;
        this.planParser = planParser;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        if (!json) {
            ConsoleOutput.printBanner();
        }

        PlanParser.ParsedPlan plan;
        try {
            plan = planParser.parse(Files.readString(planFile));
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read plan file " + planFile + ": " + e.getMessage());
            return EXIT_BAD_PLAN;
        } catch (PlanParseException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_BAD_PLAN;
        }

        String workflowName = firstNonBlank(name, plan.name(), planFile.getFileName().toString());
        String workflowObjective = firstNonBlank(objective, plan.objective(), workflowName);

        Workflow workflow;
        try {
            workflow = engine.submit(workflowName, workflowObjective, plan.items());
        } catch (InvalidPlanException e) {
            ConsoleOutput.error("Invalid plan (" + e.getKind() + "): " + e.getMessage());
            return EXIT_BAD_PLAN;
        }

        if (!json) {
            ConsoleOutput.info("Running " + workflow.getId() + " with " + workflow.getTasks().size() + " tasks");
        }
        EventBus.Subscription subscription = json || quiet
                ? () -> { }
                : eventBus.subscribe(workflow.getId(), ConsoleOutput::event);
        try {
            engine.execute(workflow, maxParallel != null ? maxParallel : engine.getMaxParallel());
        } finally {
            subscription.unsubscribe();
        }

        WorkflowSnapshot snapshot = engine.getWorkflowStatus(workflow.getId()).orElseThrow();
        if (json) {
            System.out.println(toJson(snapshot));
        } else {
            ConsoleOutput.workflowSummary(snapshot);
        }
        return snapshot.status() == WorkflowStatus.COMPLETED ? EXIT_OK : EXIT_WORKFLOW_ERRORS;
    }

    static String toJson(WorkflowSnapshot snapshot) {
        var mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize workflow snapshot " + snapshot.id(), e);
        }
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) return value;
        }
        return null;
    }
}
