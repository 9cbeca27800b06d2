package com.workgraph.core.index;

import com.workgraph.core.error.IndexInconsistentException;
import com.workgraph.core.error.NotFoundException;
import com.workgraph.core.error.ValidationException;
import com.workgraph.core.events.EventBus;
import com.workgraph.core.events.GraphEvent;
import com.workgraph.core.logging.MdcContext;
import com.workgraph.core.metrics.WorkgraphMetrics;
import com.workgraph.core.model.Edge;
import com.workgraph.core.model.EdgeKind;
import com.workgraph.core.model.WorkItem;
import com.workgraph.core.snapshot.GraphSnapshot;
import com.workgraph.core.snapshot.GraphSnapshotBuilder;
import com.workgraph.core.store.WorkItemDocument;
import com.workgraph.core.store.WorkItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Query-optimized mirror of the {@link WorkItemStore}.
 * <p>
 * The current contents are an immutable {@link IndexState} behind an atomic reference.
 * {@link #apply} serializes writers per affected node and publishes a new state with a
 * compare-and-set, so writers on different nodes proceed independently and readers
 * never take a lock. {@link #rebuild} scans the store into a fresh state and swaps it
 * in under the exclusive side of a read-write lock whose shared side is held by
 * {@code apply}; readers keep seeing the previous state until the swap.
 */
public class GraphIndex implements GraphReader {

    private static final Logger log = LoggerFactory.getLogger(GraphIndex.class);

    private final WorkItemStore store;
    private final EventBus eventBus;
    private final WorkgraphMetrics metrics;

    private final AtomicReference<IndexState> state = new AtomicReference<>(IndexState.empty());
    private final AtomicReference<GraphSnapshot> lastSnapshot = new AtomicReference<>();
    private final NodeLockTable nodeLocks = new NodeLockTable();
    private final ReadWriteLock rebuildLock = new ReentrantReadWriteLock();

    public GraphIndex(WorkItemStore store, EventBus eventBus, WorkgraphMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Incorporates one store mutation. Idempotent: applying the same change twice
     * leaves the index unchanged the second time.
     *
     * @throws IndexInconsistentException if the change cannot be applied; nothing is published
     */
    public void apply(IndexChange change) {
        Objects.requireNonNull(change, "change");
        rebuildLock.readLock().lock();
        try {
            nodeLocks.runWithLocks(change.affectedIds(), () -> publish(change));
        } finally {
            rebuildLock.readLock().unlock();
        }
    }

    private void publish(IndexChange change) {
        while (true) {
            IndexState current = state.get();
            IndexState next;
            try {
                next = current.apply(change);
            } catch (IndexInconsistentException e) {
                log.warn("Rolled back {}: {}", change, e.getMessage());
                metrics.recordIndexApply(change.type().name(), false);
                eventBus.publish(GraphEvent.of(GraphEvent.APPLY_FAILED, change.affectedIds().get(0),
                        Map.of("change", change.toString(), "reason", e.getMessage())));
                throw e;
            }
            if (next == current) {
                log.debug("{} already reflected at version {}", change, current.version());
                return;
            }
            if (state.compareAndSet(current, next)) {
                log.debug("Applied {} -> version {}", change, next.version());
                metrics.recordIndexApply(change.type().name(), true);
                eventBus.publish(GraphEvent.of(GraphEvent.APPLIED, change.affectedIds().get(0),
                        Map.of("change", change.toString(), "version", next.version())));
                return;
            }
            // Another writer on a different node won the race; recompute from its state.
        }
    }

    /**
     * Discards the current contents and reconstructs them from every document in the store.
     * On failure the previous contents stay in place.
     *
     * @throws IndexInconsistentException if the store holds documents that do not form a valid graph
     */
    public RebuildReport rebuild(RebuildTrigger trigger) {
        rebuildLock.writeLock().lock();
        long start = System.currentTimeMillis();
        try (var mdc = MdcContext.operation("rebuild", state.get().version())) {
            IndexState fresh = scanStore();
            IndexState swapped = fresh.withVersion(state.get().version() + 1);
            state.set(swapped);
            long elapsed = System.currentTimeMillis() - start;

            var report = new RebuildReport(trigger, swapped.nodes().size(), swapped.edges().size(),
                    swapped.version(), elapsed);
            log.info("Index rebuilt ({}): {} nodes, {} edges, version {} in {}ms",
                    trigger, report.nodeCount(), report.edgeCount(), report.version(), elapsed);
            metrics.recordRebuild(trigger.name(), elapsed);
            metrics.recordGraphSize(report.nodeCount(), report.edgeCount());
            eventBus.publish(GraphEvent.of(GraphEvent.REBUILT, null, Map.of(
                    "trigger", trigger.name(),
                    "nodes", report.nodeCount(),
                    "edges", report.edgeCount(),
                    "version", report.version())));
            return report;
        } finally {
            rebuildLock.writeLock().unlock();
        }
    }

    /**
     * Compares the live contents with a fresh scan of the store without swapping anything.
     */
    public IndexVerification verify() {
        rebuildLock.writeLock().lock();
        try {
            IndexState live = state.get();
            IndexState expected = scanStore();
            if (live.sameContentAs(expected)) {
                return new IndexVerification(true, List.of(), List.of(), List.of(), List.of());
            }
            var missingNodes = new ArrayList<String>();
            expected.nodes().forEach((id, node) -> {
                if (!node.equals(live.nodes().get(id))) {
                    missingNodes.add(id);
                }
            });
            var staleNodes = live.nodes().keySet().stream()
                    .filter(id -> !expected.nodes().containsKey(id))
                    .toList();
            var missingEdges = expected.edges().stream()
                    .filter(e -> !live.edges().contains(e))
                    .map(GraphIndex::describe)
                    .toList();
            var extraEdges = live.edges().stream()
                    .filter(e -> !expected.edges().contains(e))
                    .map(GraphIndex::describe)
                    .toList();
            log.warn("Index diverges from store: {} missing/changed nodes, {} stale nodes, {} missing edges, {} extra edges",
                    missingNodes.size(), staleNodes.size(), missingEdges.size(), extraEdges.size());
            return new IndexVerification(false, missingNodes, staleNodes, missingEdges, extraEdges);
        } finally {
            rebuildLock.writeLock().unlock();
        }
    }

    /**
     * Immutable point-in-time view for analytics. Later writes never affect a returned snapshot.
     */
    public GraphSnapshot snapshot() {
        IndexState current = state.get();
        GraphSnapshot cached = lastSnapshot.get();
        if (cached != null && cached.version() == current.version()) {
            return cached;
        }
        GraphSnapshot built = GraphSnapshotBuilder.build(current.version(), current.nodes().values(), current.edges());
        lastSnapshot.set(built);
        return built;
    }

    public long version() {
        return state.get().version();
    }

    @Override
    public List<WorkItem> getAllNodes() {
        return List.copyOf(state.get().nodes().values());
    }

    @Override
    public List<Edge> getAllEdges(EdgeKind kind) {
        return state.get().edges().stream()
                .filter(e -> e.kind() == kind)
                .toList();
    }

    @Override
    public WorkItem getNode(String id) {
        WorkItem node = state.get().nodes().get(id);
        if (node == null) {
            throw new NotFoundException(id);
        }
        return node;
    }

    /** Edges of any kind touching {@code id}, in either direction. */
    public List<Edge> edgesOf(String id) {
        return List.copyOf(state.get().edgesTouching(id));
    }

    private IndexState scanStore() {
        List<WorkItemDocument> documents;
        try {
            documents = store.loadAll();
        } catch (ValidationException e) {
            throw new IndexInconsistentException("Store holds an unreadable document: " + e.getMessage(), e);
        }
        IndexState building = IndexState.empty();
        for (WorkItemDocument doc : documents) {
            building = building.apply(IndexChange.upsertNode(doc.toWorkItem()));
        }
        for (WorkItemDocument doc : documents) {
            for (Edge edge : doc.outgoingEdges()) {
                building = building.apply(IndexChange.addEdge(edge));
            }
        }
        return building;
    }

    private static String describe(Edge edge) {
        return edge.from() + " " + edge.kind().value() + " " + edge.to();
    }
}
