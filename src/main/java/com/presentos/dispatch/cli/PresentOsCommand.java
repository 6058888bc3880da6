package com.presentos.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for the router.
 * Routes to subcommands: serve, route, health.
 */
@Command(
        name = "presentos",
        mixinStandardHelpOptions = true,
        version = "PresentOS Router 0.1.0",
        description = "Classifies free-text messages and routes them to task, calendar, email, research and messaging handlers",
        subcommands = {
                ServeCommand.class,
                RouteCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PresentOsCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
