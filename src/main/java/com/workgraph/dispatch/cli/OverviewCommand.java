package com.workgraph.dispatch.cli;

import com.workgraph.core.analytics.AnalyticsService;
import com.workgraph.core.model.StrategicOverview;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * CLI command: workgraph overview
 * <p>
 * Session-start summary: top recommendations, top bottlenecks and parallel capacity.
 */
@Command(name = "overview", mixinStandardHelpOptions = true,
        description = "Summarize what to do next")
@Component
public class OverviewCommand implements Runnable {

    @Option(names = "--json", description = "Print the result as JSON")
    private boolean json;

    @Mixin
    private TimeoutOption timeout;

    private final AnalyticsService analyticsService;

    public OverviewCommand(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @Override
    public void run() {
        StrategicOverview overview = analyticsService.overview(timeout.timeoutMs);
        if (json) {
            ConsoleOutput.json(overview);
            return;
        }
        ConsoleOutput.printBanner();
        ConsoleOutput.section("Recommended next");
        ConsoleOutput.recommendations(overview.recommendations());
        ConsoleOutput.section("Bottlenecks");
        ConsoleOutput.bottlenecks(overview.bottlenecks());
        ConsoleOutput.section("Parallel capacity");
        var parallel = overview.parallelCapacity();
        ConsoleOutput.info(parallel.totalReady() + " ready now, up to " + parallel.maxParallelism()
                + " agents in parallel");
        System.out.println(ConsoleOutput.RULE);
        ConsoleOutput.info("Snapshot version " + overview.snapshotVersion());
    }
}
