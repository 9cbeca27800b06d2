package com.workgraph.core.health;

import com.workgraph.core.events.EventBus;
import com.workgraph.core.index.GraphIndex;
import com.workgraph.core.index.RebuildTrigger;
import com.workgraph.core.metrics.WorkgraphMetrics;
import com.workgraph.core.model.ItemType;
import com.workgraph.core.model.Priority;
import com.workgraph.core.model.WorkItem;
import com.workgraph.core.model.WorkItemStatus;
import com.workgraph.core.store.FileWorkItemStore;
import com.workgraph.core.store.WorkItemDocument;
import com.workgraph.core.store.WorkItemStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");

    @TempDir
    Path dir;

    private static WorkItemDocument doc(String id) {
        return WorkItemDocument.of(new WorkItem(id, "Task " + id, WorkItemStatus.TODO, Priority.MEDIUM,
                ItemType.FEATURE, null, T0, T0), List.of());
    }

    private static GraphIndex index(WorkItemStore store) {
        return new GraphIndex(store, new EventBus(), new WorkgraphMetrics(new SimpleMeterRegistry()));
    }

    private static Map<String, HealthStatus> byComponent(List<HealthStatus> results) {
        return results.stream().collect(Collectors.toMap(HealthStatus::component, Function.identity()));
    }

    @Test
    @DisplayName("all components are up when the index matches the store")
    void allUp() {
        var store = new FileWorkItemStore(dir);
        store.save(doc("a"));
        store.save(doc("b"));
        GraphIndex index = index(store);
        index.rebuild(RebuildTrigger.STARTUP);

        var results = byComponent(new HealthCheckService(store, index).checkAll());

        assertEquals(3, results.size());
        assertTrue(results.values().stream().allMatch(s -> s.status() == HealthStatus.Status.UP));
        assertEquals("2", results.get("store").metadata().get("documents"));
        assertEquals("2", results.get("snapshot").metadata().get("items"));
    }

    @Test
    @DisplayName("an index that drifted from the store is degraded")
    void degraded() {
        var store = new FileWorkItemStore(dir);
        store.save(doc("a"));
        GraphIndex index = index(store);
        index.rebuild(RebuildTrigger.STARTUP);
        store.save(doc("late"));

        HealthStatus status = byComponent(new HealthCheckService(store, index).checkAll()).get("index");

        assertEquals(HealthStatus.Status.DEGRADED, status.status());
        assertEquals("late", status.metadata().get("missingNodes"));
        assertEquals("", status.metadata().get("staleNodes"));
    }

    @Test
    @DisplayName("an unreadable store takes store and index down")
    void down() {
        WorkItemStore store = mock(WorkItemStore.class);
        when(store.loadAll()).thenThrow(new UncheckedIOException(new IOException("disk gone")));

        var results = byComponent(new HealthCheckService(store, index(store)).checkAll());

        assertEquals(HealthStatus.Status.DOWN, results.get("store").status());
        assertTrue(results.get("store").detail().contains("disk gone"));
        assertEquals(HealthStatus.Status.DOWN, results.get("index").status());
        assertEquals(HealthStatus.Status.UP, results.get("snapshot").status());
    }

    @Test
    @DisplayName("overall status is the worst component status")
    void overall() {
        var up = HealthStatus.up("store", "ok", Map.of());
        var degraded = HealthStatus.degraded("index", "diverged", Map.of());
        var down = HealthStatus.down("index", "Index error: boom");

        assertEquals(HealthStatus.Status.UP, HealthStatus.overall(List.of()));
        assertEquals(HealthStatus.Status.UP, HealthStatus.overall(List.of(up)));
        assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.overall(List.of(up, degraded)));
        assertEquals(HealthStatus.Status.DOWN, HealthStatus.overall(List.of(down, degraded, up)));
        assertTrue(down.metadata().isEmpty());
    }
}
