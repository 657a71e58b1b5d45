package com.sourcemanager.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command.
 * Routes to subcommands: regions, resolve, sources, migrate, health.
 */
@Command(
        name = "source-manager",
        mixinStandardHelpOptions = true,
        version = "Source Manager 2.0.0",
        description = "Manage regional source citations and migrate project files",
        subcommands = {
                RegionsCommand.class,
                ResolveCommand.class,
                SourcesCommand.class,
                MigrateCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SourceManagerCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
