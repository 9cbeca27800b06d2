package com.workgraph.dispatch.cli;

import com.workgraph.core.analytics.AnalyticsService;
import com.workgraph.core.model.RiskAssessment;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * CLI command: workgraph risks
 * <p>
 * Reports single points of failure, dependency cycles and orphaned items.
 */
@Command(name = "risks", mixinStandardHelpOptions = true,
        description = "Assess structural risks in the dependency graph")
@Component
public class RisksCommand implements Runnable {

    @Option(names = "--spof-threshold",
            description = "Directly blocked items needed to count as a single point of failure")
    private Integer spofThreshold;

    @Option(names = "--json", description = "Print the result as JSON")
    private boolean json;

    @Mixin
    private TimeoutOption timeout;

    private final AnalyticsService analyticsService;

    public RisksCommand(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @Override
    public void run() {
        RiskAssessment risks = analyticsService.risks(spofThreshold, timeout.timeoutMs);
        if (json) {
            ConsoleOutput.json(risks);
            return;
        }
        ConsoleOutput.printBanner();
        if (risks.highRiskTasks().isEmpty() && risks.circularDependencies().isEmpty()
                && risks.orphanedTasks().isEmpty()) {
            ConsoleOutput.success("No structural risks found");
            return;
        }
        if (!risks.highRiskTasks().isEmpty()) {
            ConsoleOutput.section("High-risk tasks");
            for (var task : risks.highRiskTasks()) {
                ConsoleOutput.warn(task.id() + " (risk " + task.riskScore() + "): "
                        + String.join("; ", task.riskFactors()));
            }
        }
        if (!risks.circularDependencies().isEmpty()) {
            ConsoleOutput.section("Circular dependencies");
            for (var cycle : risks.circularDependencies()) {
                ConsoleOutput.error(String.join(" -> ", cycle) + " -> " + cycle.get(0));
            }
        }
        if (!risks.orphanedTasks().isEmpty()) {
            ConsoleOutput.section("Orphaned tasks");
            ConsoleOutput.info(String.join(", ", risks.orphanedTasks()));
        }
        ConsoleOutput.section("Recommendations");
        risks.recommendations().forEach(r -> System.out.println("  - " + r));
    }
}
