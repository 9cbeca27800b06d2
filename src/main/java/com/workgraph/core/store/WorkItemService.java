package com.workgraph.core.store;

import com.workgraph.core.error.IndexInconsistentException;
import com.workgraph.core.error.NotFoundException;
import com.workgraph.core.error.ValidationException;
import com.workgraph.core.index.GraphIndex;
import com.workgraph.core.index.IndexChange;
import com.workgraph.core.index.NodeLockTable;
import com.workgraph.core.index.RebuildTrigger;
import com.workgraph.core.logging.MdcContext;
import com.workgraph.core.model.Edge;
import com.workgraph.core.model.ItemType;
import com.workgraph.core.model.Priority;
import com.workgraph.core.model.WorkItem;
import com.workgraph.core.model.WorkItemStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Write path for work items and their relations.
 * <p>
 * Every mutation locks the node ids it touches, validates against the store, writes
 * the affected document atomically and then applies the same change to the
 * {@link GraphIndex} before returning. If the index cannot take the change it is
 * rebuilt from the store once; the store write is never undone.
 */
@Service
public class WorkItemService {

    private static final Logger log = LoggerFactory.getLogger(WorkItemService.class);

    private final WorkItemStore store;
    private final GraphIndex index;
    private final Clock clock;
    private final NodeLockTable locks = new NodeLockTable();

    public WorkItemService(WorkItemStore store, GraphIndex index, Clock clock) {
        this.store = store;
        this.index = index;
        this.clock = clock;
    }

    public WorkItem create(NewWorkItem request) {
        ItemType type = request.itemType() != null ? request.itemType() : ItemType.FEATURE;
        String id = request.id() != null ? request.id() : generateId(type);
        return locks.withLocks(List.of(id), () -> {
            if (store.exists(id)) {
                throw new ValidationException("Work item already exists: " + id);
            }
            if (store.wasDeleted(id)) {
                throw new ValidationException("Work item id was used before and cannot be reused: " + id);
            }
            Instant now = clock.instant();
            var item = new WorkItem(id, request.title(), WorkItemStatus.TODO,
                    request.priority() != null ? request.priority() : Priority.MEDIUM,
                    type, request.estimatedEffortHours(), now, now);
            store.save(WorkItemDocument.of(item, List.of()));
            log.info("Created {} '{}' ({})", id, item.title(), item.priority().value());
            applyToIndex(IndexChange.upsertNode(item));
            return item;
        });
    }

    public WorkItem get(String id) {
        return store.load(id).map(WorkItemDocument::toWorkItem).orElseThrow(() -> new NotFoundException(id));
    }

    /** Caller-driven status transition; any status may move to any other. */
    public WorkItem updateStatus(String id, WorkItemStatus status) {
        return locks.withLocks(List.of(id), () -> {
            WorkItemDocument doc = loadOrThrow(id);
            WorkItem updated = doc.toWorkItem().withStatus(status, clock.instant());
            store.save(doc.withItem(updated));
            log.info("Status of {} -> {}", id, status.value());
            applyToIndex(IndexChange.upsertNode(updated));
            return updated;
        });
    }

    /** Updates title, priority and effort; null arguments keep the current value. */
    public WorkItem updateDetails(String id, String title, Priority priority, Double estimatedEffortHours) {
        return locks.withLocks(List.of(id), () -> {
            WorkItemDocument doc = loadOrThrow(id);
            WorkItem updated = doc.toWorkItem().withDetails(title, priority, estimatedEffortHours, clock.instant());
            store.save(doc.withItem(updated));
            applyToIndex(IndexChange.upsertNode(updated));
            return updated;
        });
    }

    /**
     * Records a relation in the source's document. Adding an existing edge is a no-op.
     *
     * @throws ValidationException if either endpoint does not exist
     */
    public void addEdge(Edge edge) {
        locks.runWithLocks(List.of(edge.from(), edge.to()), () -> {
            WorkItemDocument source = store.load(edge.from())
                    .orElseThrow(() -> new ValidationException("Edge source does not exist: " + edge.from()));
            if (!store.exists(edge.to())) {
                throw new ValidationException("Edge target does not exist: " + edge.to());
            }
            if (!source.hasEdge(edge)) {
                store.save(source.withEdge(edge));
                log.info("{} {} {}", edge.from(), edge.kind().value(), edge.to());
            }
            applyToIndex(IndexChange.addEdge(edge));
        });
    }

    public void removeEdge(Edge edge) {
        locks.runWithLocks(List.of(edge.from(), edge.to()), () -> {
            WorkItemDocument source = loadOrThrow(edge.from());
            if (source.hasEdge(edge)) {
                store.save(source.withoutEdge(edge));
                log.info("Removed {} {} {}", edge.from(), edge.kind().value(), edge.to());
            }
            applyToIndex(IndexChange.removeEdge(edge));
        });
    }

    /**
     * Deletes an item that no edge references, in either direction.
     *
     * @throws ValidationException if the item still has relations
     */
    public void delete(String id) {
        locks.runWithLocks(List.of(id), () -> {
            WorkItemDocument doc = loadOrThrow(id);
            var references = new ArrayList<String>();
            doc.outgoingEdges().forEach(e -> references.add(e.to()));
            references.addAll(store.findReferencing(id));
            if (!references.isEmpty()) {
                throw new ValidationException("Cannot delete " + id + ": related to " + references);
            }
            store.delete(id);
            log.info("Deleted {}", id);
            applyToIndex(IndexChange.removeNode(id));
        });
    }

    private WorkItemDocument loadOrThrow(String id) {
        return store.load(id).orElseThrow(() -> new NotFoundException(id));
    }

    private void applyToIndex(IndexChange change) {
        try (var mdc = MdcContext.item(change.affectedIds().get(0))) {
            try {
                index.apply(change);
            } catch (IndexInconsistentException e) {
                log.warn("Index rejected {}; rebuilding from store", change, e);
                index.rebuild(RebuildTrigger.RECOVERY);
            }
        }
    }

    private String generateId(ItemType type) {
        String id;
        do {
            id = type.idPrefix() + "-" + UUID.randomUUID().toString().substring(0, 8);
        } while (store.exists(id) || store.wasDeleted(id));
        return id;
    }
}
