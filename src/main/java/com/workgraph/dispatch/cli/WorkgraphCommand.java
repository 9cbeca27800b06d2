package com.workgraph.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Workgraph.
 * Routes to the analytics, index and server subcommands.
 */
@Command(
        name = "workgraph",
        mixinStandardHelpOptions = true,
        version = "Workgraph 0.1.0",
        description = "Work-tracking graph with dependency analytics",
        subcommands = {
                BottlenecksCommand.class,
                ParallelCommand.class,
                RecommendCommand.class,
                RisksCommand.class,
                ImpactCommand.class,
                QueueCommand.class,
                OverviewCommand.class,
                RebuildCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WorkgraphCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
