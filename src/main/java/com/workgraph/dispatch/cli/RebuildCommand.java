package com.workgraph.dispatch.cli;

import com.workgraph.core.index.GraphIndex;
import com.workgraph.core.index.IndexVerification;
import com.workgraph.core.index.RebuildReport;
import com.workgraph.core.index.RebuildTrigger;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: workgraph rebuild
 * <p>
 * Reconstructs the graph index from the document store, or with {@code --verify}
 * only reports whether the two diverge.
 */
@Command(name = "rebuild", mixinStandardHelpOptions = true,
        description = "Rebuild the graph index from the work item store")
@Component
public class RebuildCommand implements Runnable {

    @Option(names = "--verify", description = "Compare index and store without rebuilding")
    private boolean verifyOnly;

    private final GraphIndex graphIndex;

    public RebuildCommand(GraphIndex graphIndex) {
        this.graphIndex = graphIndex;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (verifyOnly) {
            IndexVerification verification = graphIndex.verify();
            if (verification.consistent()) {
                ConsoleOutput.success("Index matches the store");
            } else {
                ConsoleOutput.error("Index diverges from the store");
                printIds("missing or changed nodes", verification.missingNodes());
                printIds("stale nodes", verification.staleNodes());
                printIds("missing edges", verification.missingEdges());
                printIds("extra edges", verification.extraEdges());
            }
            return;
        }
        RebuildReport report = graphIndex.rebuild(RebuildTrigger.MANUAL);
        ConsoleOutput.success("Rebuilt index: " + report.nodeCount() + " items, " + report.edgeCount()
                + " edges, version " + report.version() + " (" + report.durationMs() + "ms)");
    }

    private static void printIds(String label, List<String> ids) {
        if (!ids.isEmpty()) {
            System.out.println("  " + label + ": " + String.join(", ", ids));
        }
    }
}
