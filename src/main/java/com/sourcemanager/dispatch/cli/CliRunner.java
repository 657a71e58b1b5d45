package com.sourcemanager.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle: parses the arguments, runs
 * the selected command and keeps its exit code for {@code SpringApplication.exit}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final SourceManagerCommand sourceManagerCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SourceManagerCommand sourceManagerCommand, IFactory factory) {
        this.sourceManagerCommand = sourceManagerCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(sourceManagerCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
