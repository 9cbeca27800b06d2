package com.workgraph.core.analytics;

import com.workgraph.core.model.Bottleneck;
import com.workgraph.core.model.WorkItem;
import com.workgraph.core.snapshot.GraphSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;

/**
 * Ranks unfinished items by how much work they hold up.
 * <p>
 * Direct dependents count at their full priority weight, dependents reached only
 * transitively at {@code transitiveFactor} of it. Ties break on transitive count
 * (descending) and then id, which makes the ranking a total order.
 */
final class BottleneckAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(BottleneckAnalyzer.class);

    private final AnalyticsProperties properties;

    BottleneckAnalyzer(AnalyticsProperties properties) {
        this.properties = properties;
    }

    List<Bottleneck> find(GraphSnapshot snapshot, int topN, int minImpact, Deadline deadline) {
        if (topN < 0 || minImpact < 0) {
            throw new IllegalArgumentException("topN and minImpact must not be negative");
        }
        Reachability reachability = Reachability.of(snapshot, deadline);
        double transitiveFactor = properties.getScoring().getTransitiveFactor();

        var ranked = new ArrayList<Ranked>();
        for (WorkItem node : snapshot.nodes()) {
            if (node.isDone()) {
                continue;
            }
            deadline.check("find_bottlenecks");
            List<String> direct = snapshot.blocks(node.id());
            if (direct.size() < minImpact) {
                continue;
            }
            List<String> transitive = reachability.transitivelyBlocked(node.id());

            double impact = 0;
            for (String d : direct) {
                impact += properties.weight(snapshot.node(d).priority());
            }
            var directSet = new HashSet<>(direct);
            double indirect = 0;
            for (String t : transitive) {
                if (!directSet.contains(t)) {
                    indirect += properties.weight(snapshot.node(t).priority());
                }
            }
            impact += transitiveFactor * indirect;
            ranked.add(new Ranked(node, direct, transitive.size(), impact));
        }

        ranked.sort(Comparator.comparingDouble(Ranked::impact).reversed()
                .thenComparing(Comparator.comparingInt(Ranked::transitiveCount).reversed())
                .thenComparing(r -> r.node().id()));

        var result = ranked.stream()
                .limit(topN)
                .map(r -> new Bottleneck(r.node().id(), r.node().title(), r.node().status(),
                        r.node().priority(), r.direct().size(), r.impact(), r.direct()))
                .toList();
        log.debug("find_bottlenecks: {} candidates, returning {}", ranked.size(), result.size());
        return result;
    }

    private record Ranked(WorkItem node, List<String> direct, int transitiveCount, double impact) {}
}
