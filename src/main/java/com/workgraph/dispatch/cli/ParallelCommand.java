package com.workgraph.dispatch.cli;

import com.workgraph.core.analytics.AnalyticsService;
import com.workgraph.core.model.ParallelWork;
import com.workgraph.core.model.WorkItemStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: workgraph parallel
 * <p>
 * Shows which items can be worked on at the same time, layer by layer.
 */
@Command(name = "parallel", mixinStandardHelpOptions = true,
        description = "Show work that can proceed in parallel")
@Component
public class ParallelCommand implements Runnable {

    @Option(names = {"--max-agents", "-a"}, description = "Number of agents available")
    private Integer maxAgents;

    @Option(names = "--status", description = "Status an item must have to be ready (default: todo)")
    private String status;

    @Option(names = "--json", description = "Print the result as JSON")
    private boolean json;

    @Mixin
    private TimeoutOption timeout;

    private final AnalyticsService analyticsService;

    public ParallelCommand(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @Override
    public void run() {
        WorkItemStatus filter = status != null ? WorkItemStatus.fromValue(status) : null;
        ParallelWork work = analyticsService.parallelWork(maxAgents, filter, timeout.timeoutMs);
        if (json) {
            ConsoleOutput.json(work);
            return;
        }
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Ready now (" + work.totalReady() + "): " + join(work.readyNow()));
        ConsoleOutput.info("Max parallelism: " + work.maxParallelism() + " across " + work.levelCount() + " levels");
        for (int i = 0; i < work.layers().size(); i++) {
            System.out.println("  L" + i + ": " + String.join(", ", work.layers().get(i)));
        }
        if (!work.cycleMembers().isEmpty()) {
            ConsoleOutput.warn("Stuck in dependency cycles: " + String.join(", ", work.cycleMembers()));
        }
        if (!work.unscheduled().isEmpty()) {
            ConsoleOutput.warn("Not schedulable: " + String.join(", ", work.unscheduled()));
        }
    }

    private static String join(List<String> ids) {
        return ids.isEmpty() ? "-" : String.join(", ", ids);
    }
}
