package com.workgraph.dispatch.cli;

import com.workgraph.core.analytics.AnalyticsService;
import com.workgraph.core.model.ImpactAnalysis;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: workgraph impact &lt;item-id&gt;
 */
@Command(name = "impact", mixinStandardHelpOptions = true,
        description = "Show what completing an item would unblock")
@Component
public class ImpactCommand implements Runnable {

    @Parameters(index = "0", description = "Work item ID")
    private String itemId;

    @Option(names = "--json", description = "Print the result as JSON")
    private boolean json;

    @Mixin
    private TimeoutOption timeout;

    private final AnalyticsService analyticsService;

    public ImpactCommand(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @Override
    public void run() {
        ImpactAnalysis impact = analyticsService.impact(itemId, timeout.timeoutMs);
        if (json) {
            ConsoleOutput.json(impact);
            return;
        }
        ConsoleOutput.printBanner();
        ConsoleOutput.info(String.format("Completing %s unblocks %d directly, %d in total (%.1f%% of remaining work)",
                impact.nodeId(), impact.directDependents(), impact.totalImpact(), impact.completionImpact()));
        if (!impact.affectedTasks().isEmpty()) {
            System.out.println("  direct:   " + String.join(", ", impact.directDependentIds()));
            System.out.println("  affected: " + String.join(", ", impact.affectedTasks()));
        }
    }
}
