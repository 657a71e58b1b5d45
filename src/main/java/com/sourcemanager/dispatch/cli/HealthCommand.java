package com.sourcemanager.dispatch.cli;

import com.sourcemanager.core.health.HealthCheckService;
import com.sourcemanager.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: source-manager health
 * <p>
 * Checks the master-sources directory and every region document.
 * Exits non-zero only when a component is DOWN.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check store health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> ConsoleOutput.error(label);
                case DEGRADED -> ConsoleOutput.warn(label);
            }
        }

        ConsoleOutput.rule();
        HealthStatus.Status overall = HealthCheckService.overall(checks);
        switch (overall) {
            case UP -> ConsoleOutput.success("Overall: all components healthy");
            case DEGRADED -> ConsoleOutput.warn("Overall: one or more components degraded");
            case DOWN -> ConsoleOutput.error("Overall: one or more components down");
        }
        return overall == HealthStatus.Status.DOWN ? 1 : 0;
    }
}
