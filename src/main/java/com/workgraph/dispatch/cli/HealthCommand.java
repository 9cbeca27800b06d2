package com.workgraph.dispatch.cli;

import com.workgraph.core.health.HealthCheckService;
import com.workgraph.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: workgraph health
 * <p>
 * Checks the store, the index and the current snapshot and exits non-zero
 * when any component is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }

        System.out.println(ConsoleOutput.RULE);
        HealthStatus.Status overall = HealthStatus.overall(checks);
        if (overall == HealthStatus.Status.UP) {
            ConsoleOutput.success("Overall: all systems operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
        return overall == HealthStatus.Status.DOWN ? CliRunner.EXIT_FAILURE : 0;
    }
}
