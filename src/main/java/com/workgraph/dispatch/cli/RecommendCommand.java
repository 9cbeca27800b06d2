package com.workgraph.dispatch.cli;

import com.workgraph.core.analytics.AnalyticsService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * CLI command: workgraph recommend
 */
@Command(name = "recommend", mixinStandardHelpOptions = true,
        description = "Recommend what to work on next")
@Component
public class RecommendCommand implements Runnable {

    @Option(names = {"--agents", "-a"}, description = "Number of agents picking up work")
    private Integer agentCount;

    @Option(names = "--lookahead", description = "Minimum number of recommendations to return")
    private Integer lookahead;

    @Option(names = "--json", description = "Print the result as JSON")
    private boolean json;

    @Mixin
    private TimeoutOption timeout;

    private final AnalyticsService analyticsService;

    public RecommendCommand(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @Override
    public void run() {
        var recommendations = analyticsService.recommend(agentCount, lookahead, timeout.timeoutMs);
        if (json) {
            ConsoleOutput.json(recommendations);
            return;
        }
        ConsoleOutput.printBanner();
        ConsoleOutput.recommendations(recommendations);
    }
}
