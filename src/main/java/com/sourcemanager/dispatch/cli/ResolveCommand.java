package com.sourcemanager.dispatch.cli;

import com.sourcemanager.core.region.RegionRouter;
import com.sourcemanager.core.store.RegionalSourceStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: source-manager resolve &lt;path&gt;
 * <p>
 * Shows which region owns a project path and where its document lives.
 */
@Command(name = "resolve", mixinStandardHelpOptions = true, description = "Show the region that owns a project path")
@Component
public class ResolveCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project file or directory path")
    private String projectPath;

    private final RegionRouter router;
    private final RegionalSourceStore store;

    public ResolveCommand(RegionRouter router, RegionalSourceStore store) {
        this.router = router;
        this.store = store;
    }

    @Override
    public Integer call() {
        String region = router.resolveRegion(projectPath);
        ConsoleOutput.success(projectPath + " -> " + region);
        ConsoleOutput.info("Document: " + store.sourceFilePath(region));
        return 0;
    }
}
