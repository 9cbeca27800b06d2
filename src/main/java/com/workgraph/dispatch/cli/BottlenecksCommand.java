package com.workgraph.dispatch.cli;

import com.workgraph.core.analytics.AnalyticsService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * CLI command: workgraph bottlenecks
 * <p>
 * Lists the unfinished items that hold up the most weighted work.
 */
@Command(name = "bottlenecks", mixinStandardHelpOptions = true,
        description = "Show the items blocking the most work")
@Component
public class BottlenecksCommand implements Runnable {

    @Option(names = {"--top", "-n"}, description = "Number of bottlenecks to show (default: configured)")
    private Integer topN;

    @Option(names = "--min-impact", description = "Minimum number of directly blocked items")
    private Integer minImpact;

    @Option(names = "--json", description = "Print the result as JSON")
    private boolean json;

    @Mixin
    private TimeoutOption timeout;

    private final AnalyticsService analyticsService;

    public BottlenecksCommand(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @Override
    public void run() {
        var bottlenecks = analyticsService.bottlenecks(topN, minImpact, timeout.timeoutMs);
        if (json) {
            ConsoleOutput.json(bottlenecks);
            return;
        }
        ConsoleOutput.printBanner();
        ConsoleOutput.bottlenecks(bottlenecks);
    }
}
