package com.workgraph.core.store;

import com.workgraph.core.error.ValidationException;
import com.workgraph.core.model.Edge;
import com.workgraph.core.model.EdgeKind;
import com.workgraph.core.model.ItemType;
import com.workgraph.core.model.Priority;
import com.workgraph.core.model.WorkItem;
import com.workgraph.core.model.WorkItemStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileWorkItemStoreTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir
    Path dir;

    private FileWorkItemStore store;

    @BeforeEach
    void setUp() {
        store = new FileWorkItemStore(dir);
    }

    private static WorkItem item(String id) {
        return new WorkItem(id, "Item " + id, WorkItemStatus.TODO, Priority.HIGH, ItemType.BUG, 1.5, T0, T0);
    }

    @Test
    @DisplayName("saves one JSON file per item and loads it back")
    void saveAndLoad() {
        var doc = WorkItemDocument.of(item("bug-1"), List.of(Edge.blocks("bug-1", "bug-2")));
        store.save(doc);

        assertTrue(Files.exists(dir.resolve("bug-1.json")));
        assertEquals(doc, store.load("bug-1").orElseThrow());
        assertTrue(store.exists("bug-1"));
        assertTrue(store.load("missing").isEmpty());
    }

    @Test
    @DisplayName("loadAll returns documents in id order and skips temp files")
    void loadAllOrdered() throws Exception {
        store.save(WorkItemDocument.of(item("c"), List.of()));
        store.save(WorkItemDocument.of(item("a"), List.of()));
        store.save(WorkItemDocument.of(item("b"), List.of()));
        Files.writeString(dir.resolve(".tmp-123.json"), "{ half written");

        assertEquals(List.of("a", "b", "c"), store.loadAll().stream().map(WorkItemDocument::id).toList());
    }

    @Test
    @DisplayName("overwriting leaves no temp files behind")
    void atomicReplace() throws Exception {
        store.save(WorkItemDocument.of(item("a"), List.of()));
        store.save(WorkItemDocument.of(item("a").withStatus(WorkItemStatus.DONE, T0), List.of()));

        assertEquals(WorkItemStatus.DONE, store.load("a").orElseThrow().status());
        try (Stream<Path> files = Files.list(dir)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().startsWith(".tmp-")));
        }
    }

    @Test
    @DisplayName("reads legacy status and type spellings")
    void legacyDocument() throws Exception {
        Files.writeString(dir.resolve("old-1.json"), """
                {
                  "id": "old-1",
                  "title": "Legacy item",
                  "status": "in_progress",
                  "priority": "low",
                  "type": "phase",
                  "created_at": "2025-06-01T10:00:00Z",
                  "updated_at": "2025-06-02T10:00:00Z",
                  "edges": [ { "kind": "parent-of", "to": "old-2" } ],
                  "owner": "ignored"
                }
                """);

        WorkItemDocument doc = store.load("old-1").orElseThrow();
        assertEquals(WorkItemStatus.IN_PROGRESS, doc.status());
        assertEquals(ItemType.EPIC, doc.type());
        assertEquals(List.of(new Edge("old-1", "old-2", EdgeKind.PARENT_OF)), doc.outgoingEdges());
    }

    @Test
    @DisplayName("malformed or mismatched documents are validation errors")
    void malformed() throws Exception {
        Files.writeString(dir.resolve("bad.json"), "{\"id\": \"bad\", \"title\": \"x\", \"status\": \"paused\"}");
        assertThrows(ValidationException.class, () -> store.load("bad"));

        Files.writeString(dir.resolve("wrong.json"), """
                {"id": "other", "title": "x", "status": "todo", "priority": "low", "type": "bug",
                 "created_at": "2025-06-01T10:00:00Z", "updated_at": "2025-06-01T10:00:00Z"}
                """);
        assertThrows(ValidationException.class, () -> store.load("wrong"));
    }

    @Test
    @DisplayName("deleted ids are tombstoned")
    void tombstones() {
        store.save(WorkItemDocument.of(item("a"), List.of()));
        store.delete("a");

        assertFalse(store.exists("a"));
        assertTrue(store.wasDeleted("a"));
        assertFalse(store.wasDeleted("b"));
        assertTrue(store.loadAll().isEmpty());
    }

    @Test
    @DisplayName("unsafe ids are rejected before touching the filesystem")
    void unsafeIds() {
        assertThrows(ValidationException.class, () -> store.load("../etc/passwd"));
        assertThrows(ValidationException.class, () -> store.exists(".hidden"));
    }

    @Test
    @DisplayName("findReferencing scans incoming edges")
    void findReferencing() {
        store.save(WorkItemDocument.of(item("a"), List.of(Edge.blocks("a", "c"))));
        store.save(WorkItemDocument.of(item("b"), List.of(Edge.parentOf("b", "c"))));
        store.save(WorkItemDocument.of(item("c"), List.of()));

        assertEquals(List.of("a", "b"), store.findReferencing("c"));
        assertTrue(store.findReferencing("a").isEmpty());
    }
}
