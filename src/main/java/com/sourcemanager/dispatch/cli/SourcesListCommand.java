package com.sourcemanager.dispatch.cli;

import com.sourcemanager.core.io.DocumentIoException;
import com.sourcemanager.core.store.RegionSources;
import com.sourcemanager.core.store.RegionalSourceStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: source-manager sources list (--region R | --project P)
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List the sources of a region")
@Component
public class SourcesListCommand implements Callable<Integer> {

    static class Target {
        @Option(names = {"--region", "-r"}, description = "Region name")
        String region;

        @Option(names = {"--project", "-p"}, description = "Project path, routed to its region")
        String project;
    }

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Target target;

    private final RegionalSourceStore store;

    public SourcesListCommand(RegionalSourceStore store) {
        this.store = store;
    }

    @Override
    public Integer call() {
        RegionSources sources;
        try {
            sources = target.region != null
                    ? store.listSources(target.region)
                    : store.sourcesForProject(target.project);
        } catch (DocumentIoException e) {
            ConsoleOutput.error("Could not read sources: " + e.getMessage());
            return 1;
        }
        if (target.region != null && !target.region.equals(sources.regionName())) {
            ConsoleOutput.warn("Unknown region '" + target.region + "'; showing " + sources.regionName());
        }
        ConsoleOutput.info(sources.regionName() + ": " + sources.sources().size() + " sources");
        sources.sources().forEach(ConsoleOutput::source);
        return 0;
    }
}
