package com.workgraph.core.health;

import com.workgraph.core.index.GraphIndex;
import com.workgraph.core.index.IndexVerification;
import com.workgraph.core.snapshot.GraphSnapshot;
import com.workgraph.core.store.WorkItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final WorkItemStore store;
    private final GraphIndex index;

    public HealthCheckService(WorkItemStore store, GraphIndex index) {
        this.store = store;
        this.index = index;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkIndex());
        results.add(checkSnapshot());
        return results;
    }

    private HealthStatus checkStore() {
        try {
            int documents = store.loadAll().size();
            return HealthStatus.up("store", documents + " documents in " + store.describe(),
                    Map.of("documents", String.valueOf(documents)));
        } catch (RuntimeException e) {
            log.warn("Store health check failed: {}", e.getMessage());
            return HealthStatus.down("store", "Store error: " + e.getMessage());
        }
    }

    /**
     * Compares the live index with a fresh scan of the store. Divergence is reported as
     * degraded because a rebuild restores it.
     */
    private HealthStatus checkIndex() {
        try {
            IndexVerification verification = index.verify();
            if (verification.consistent()) {
                return HealthStatus.up("index", "Index matches store at version " + index.version(),
                        Map.of("version", String.valueOf(index.version())));
            }
            return HealthStatus.degraded("index", "Index diverges from store; run rebuild",
                    Map.of("missingNodes", String.join(",", verification.missingNodes()),
                            "staleNodes", String.join(",", verification.staleNodes()),
                            "missingEdges", String.valueOf(verification.missingEdges().size()),
                            "extraEdges", String.valueOf(verification.extraEdges().size())));
        } catch (RuntimeException e) {
            log.warn("Index health check failed: {}", e.getMessage());
            return HealthStatus.down("index", "Index error: " + e.getMessage());
        }
    }

    private HealthStatus checkSnapshot() {
        GraphSnapshot snapshot = index.snapshot();
        return HealthStatus.up("snapshot",
                snapshot.size() + " items, " + snapshot.unresolvedCount() + " unresolved, "
                        + snapshot.blockEdges().size() + " blocking edges",
                Map.of("version", String.valueOf(snapshot.version()),
                        "items", String.valueOf(snapshot.size())));
    }
}
