package com.workgraph.dispatch.cli;

import com.workgraph.core.analytics.AnalyticsService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * CLI command: workgraph queue
 */
@Command(name = "queue", mixinStandardHelpOptions = true,
        description = "Show the ordered work queue")
@Component
public class QueueCommand implements Runnable {

    @Option(names = {"--max", "-n"}, description = "Maximum number of entries")
    private Integer maxItems;

    @Option(names = "--include-blocked", description = "Also list items still waiting on other work")
    private boolean includeBlocked;

    @Option(names = "--json", description = "Print the result as JSON")
    private boolean json;

    @Mixin
    private TimeoutOption timeout;

    private final AnalyticsService analyticsService;

    public QueueCommand(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @Override
    public void run() {
        var queue = analyticsService.queue(maxItems, includeBlocked, timeout.timeoutMs);
        if (json) {
            ConsoleOutput.json(queue);
            return;
        }
        ConsoleOutput.printBanner();
        if (queue.isEmpty()) {
            ConsoleOutput.info("Queue is empty");
            return;
        }
        System.out.printf("  %-16s %-12s %-9s %-7s %s%n", "ID", "STATUS", "PRIORITY", "SCORE", "TITLE");
        System.out.println("  " + "-".repeat(64));
        for (var item : queue) {
            String score = item.ready() ? String.format("%.1f", item.score()) : "-";
            System.out.printf("  %-16s %-12s %-9s %-7s %s%n", item.id(), item.status().value(),
                    item.priority().value(), score, ConsoleOutput.truncate(item.title(), 30));
            if (!item.blockedBy().isEmpty()) {
                System.out.println("      waiting on: " + String.join(", ", item.blockedBy()));
            }
        }
    }
}
