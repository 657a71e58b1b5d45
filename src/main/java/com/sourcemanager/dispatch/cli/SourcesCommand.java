package com.sourcemanager.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command group: source-manager sources (list | add | update)
 */
@Command(
        name = "sources",
        mixinStandardHelpOptions = true,
        description = "List, add and update regional source records",
        subcommands = {
                SourcesListCommand.class,
                SourcesAddCommand.class,
                SourcesUpdateCommand.class
        }
)
@Component
public class SourcesCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
