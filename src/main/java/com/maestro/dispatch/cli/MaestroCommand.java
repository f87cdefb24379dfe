package com.maestro.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Maestro.
 * Routes to subcommands: run, agents, route.
 */
@Command(
        name = "maestro",
        mixinStandardHelpOptions = true,
        version = "Maestro 0.1.0",
        description = "Runs multi-agent task plans as dependency-ordered workflows",
        subcommands = {
                RunCommand.class,
                AgentsCommand.class,
                RouteCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class MaestroCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
