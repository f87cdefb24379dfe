package com.maestro.dispatch.cli;

import com.maestro.core.agent.AgentCapability;
import com.maestro.core.agent.AgentRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.stream.Collectors;

/**
 * CLI command: maestro agents
 * <p>
 * Lists the registered agents with their roles and capabilities.
 */
@Command(name = "agents", mixinStandardHelpOptions = true, description = "List registered agents")
@Component
public class AgentsCommand implements Runnable {

    private final AgentRegistry registry;

    public AgentsCommand(AgentRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var profiles = registry.getAll();
        if (profiles.isEmpty()) {
            ConsoleOutput.info("No agents registered.");
            return;
        }
        for (var profile : profiles) {
            String capabilities = profile.capabilities().isEmpty()
                    ? "-"
                    : profile.capabilities().stream()
                            .sorted()
                            .map(AgentCapability::name)
                            .collect(Collectors.joining(", "));
            ConsoleOutput.agent(profile.name(), profile.role() + " | " + capabilities);
        }
    }
}
