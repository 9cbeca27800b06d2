package com.workgraph.core.store;

import java.util.List;
import java.util.Optional;

/**
 * Source of truth for work items: one individually addressable document per item.
 * <p>
 * Implementations must make every {@link #save} atomic: readers see either the
 * previous or the new document, never a partial write.
 */
public interface WorkItemStore {

    Optional<WorkItemDocument> load(String id);

    /**
     * Every stored document, ordered by id. This is the complete input of an index rebuild.
     */
    List<WorkItemDocument> loadAll();

    void save(WorkItemDocument document);

    /**
     * Removes the document and remembers the id so it can never be handed out again.
     */
    void delete(String id);

    boolean exists(String id);

    boolean wasDeleted(String id);

    /**
     * Ids of documents holding an edge that points at {@code id}.
     */
    default List<String> findReferencing(String id) {
        return loadAll().stream()
                .filter(doc -> doc.edges().stream().anyMatch(e -> e.to().equals(id)))
                .map(WorkItemDocument::id)
                .toList();
    }

    /** Human readable location, used in health output. */
    String describe();
}
