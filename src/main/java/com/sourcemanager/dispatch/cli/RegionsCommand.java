package com.sourcemanager.dispatch.cli;

import com.sourcemanager.core.store.RegionSummary;
import com.sourcemanager.core.store.RegionalSourceStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: source-manager regions
 * <p>
 * Lists the configured regions with their current source counts.
 */
@Command(name = "regions", mixinStandardHelpOptions = true, description = "List configured regions")
@Component
public class RegionsCommand implements Callable<Integer> {

    private final RegionalSourceStore store;

    public RegionsCommand(RegionalSourceStore store) {
        this.store = store;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        List<RegionSummary> regions = store.listRegions();
        ConsoleOutput.info(regions.size() + " regions under " + store.masterSourcesDir());
        regions.forEach(ConsoleOutput::region);
        return 0;
    }
}
