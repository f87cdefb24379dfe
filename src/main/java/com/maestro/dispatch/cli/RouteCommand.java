package com.maestro.dispatch.cli;

import com.maestro.core.agent.AgentRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: maestro route &lt;task text&gt;
 * <p>
 * Shows how each registered agent scores against a task and which one would be chosen.
 */
@Command(name = "route", mixinStandardHelpOptions = true, description = "Show which agent a task routes to")
@Component
public class RouteCommand implements Runnable {

    @Parameters(arity = "1..*", description = "Task description")
    private String[] words;

    private final AgentRegistry registry;

    public RouteCommand(AgentRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        String task = String.join(" ", words);
        for (var profile : registry.getAll()) {
            System.out.printf("  %-16s %.1f%n", profile.name(), registry.score(profile, task));
        }
        registry.findBest(task).ifPresentOrElse(
                best -> ConsoleOutput.success("Best match: " + best.name()),
                () -> ConsoleOutput.info("No agent matches; the default assignee would be used"));
    }
}
