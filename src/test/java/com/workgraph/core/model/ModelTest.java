package com.workgraph.core.model;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.workgraph.core.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2026-01-02T00:00:00Z");

    private static WorkItem item(String id) {
        return new WorkItem(id, "Title " + id, WorkItemStatus.TODO, Priority.MEDIUM, ItemType.FEATURE, null, T0, T0);
    }

    @Nested
    @DisplayName("WorkItemStatus")
    class StatusTests {

        @Test
        @DisplayName("parses canonical and legacy spellings")
        void aliases() {
            assertEquals(WorkItemStatus.IN_PROGRESS, WorkItemStatus.fromValue("in-progress"));
            assertEquals(WorkItemStatus.IN_PROGRESS, WorkItemStatus.fromValue("in_progress"));
            assertEquals(WorkItemStatus.IN_PROGRESS, WorkItemStatus.fromValue("active"));
            assertEquals(WorkItemStatus.DONE, WorkItemStatus.fromValue("Completed"));
            assertEquals(WorkItemStatus.TODO, WorkItemStatus.fromValue(" todo "));
        }

        @Test
        @DisplayName("unknown or blank status is a validation error")
        void unknown() {
            assertThrows(ValidationException.class, () -> WorkItemStatus.fromValue("paused"));
            assertThrows(ValidationException.class, () -> WorkItemStatus.fromValue(""));
            assertThrows(ValidationException.class, () -> WorkItemStatus.fromValue(null));
        }

        @Test
        @DisplayName("only done counts as done")
        void isDone() {
            assertTrue(WorkItemStatus.DONE.isDone());
            assertFalse(WorkItemStatus.BLOCKED.isDone());
        }
    }

    @Nested
    @DisplayName("Priority and ItemType")
    class EnumTests {

        @Test
        @DisplayName("default weights run from low=1 to critical=4")
        void weights() {
            assertEquals(List.of(1, 2, 3, 4),
                    List.of(Priority.LOW.defaultWeight(), Priority.MEDIUM.defaultWeight(),
                            Priority.HIGH.defaultWeight(), Priority.CRITICAL.defaultWeight()));
        }

        @Test
        @DisplayName("phase is read as epic")
        void phaseAlias() {
            assertEquals(ItemType.EPIC, ItemType.fromValue("phase"));
            assertEquals(ItemType.BUG, ItemType.fromValue("BUG"));
            assertThrows(ValidationException.class, () -> ItemType.fromValue("story"));
            assertThrows(ValidationException.class, () -> Priority.fromValue("urgent"));
        }

        @Test
        @DisplayName("edge kinds accept both separators")
        void edgeKinds() {
            assertEquals(EdgeKind.PARENT_OF, EdgeKind.fromValue("parent-of"));
            assertEquals(EdgeKind.BLOCKS, EdgeKind.fromValue("blocks"));
            assertThrows(ValidationException.class, () -> EdgeKind.fromValue("relates"));
        }
    }

    @Nested
    @DisplayName("WorkItem")
    class WorkItemTests {

        @Test
        @DisplayName("rejects blank title, negative effort and time travel")
        void validation() {
            assertThrows(ValidationException.class, () ->
                    new WorkItem("a", " ", WorkItemStatus.TODO, Priority.LOW, ItemType.BUG, null, T0, T0));
            assertThrows(ValidationException.class, () ->
                    new WorkItem("a", "t", WorkItemStatus.TODO, Priority.LOW, ItemType.BUG, -1.0, T0, T0));
            assertThrows(ValidationException.class, () ->
                    new WorkItem("a", "t", WorkItemStatus.TODO, Priority.LOW, ItemType.BUG, null, T1, T0));
            assertThrows(ValidationException.class, () ->
                    new WorkItem("", "t", WorkItemStatus.TODO, Priority.LOW, ItemType.BUG, null, T0, T0));
        }

        @Test
        @DisplayName("updated_at never moves backwards")
        void monotonicUpdate() {
            WorkItem updated = item("a").withStatus(WorkItemStatus.DONE, T1);
            assertEquals(T1, updated.updatedAt());

            WorkItem again = updated.withStatus(WorkItemStatus.TODO, T0);
            assertEquals(T1, again.updatedAt());
            assertEquals(T0, again.createdAt());
        }

        @Test
        @DisplayName("withDetails keeps fields passed as null")
        void withDetails() {
            WorkItem updated = item("a").withDetails(null, Priority.HIGH, 3.0, T1);
            assertEquals("Title a", updated.title());
            assertEquals(Priority.HIGH, updated.priority());
            assertEquals(3.0, updated.estimatedEffortHours());
        }

        @Test
        @DisplayName("serializes with wire names and without derived fields")
        void json() throws Exception {
            var mapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();
            String json = mapper.writeValueAsString(item("a").withStatus(WorkItemStatus.IN_PROGRESS, T0));

            assertTrue(json.contains("\"status\":\"in-progress\""));
            assertTrue(json.contains("\"type\":\"feature\""));
            assertTrue(json.contains("\"estimated_effort_hours\""));
            assertFalse(json.contains("\"done\""));
        }
    }

    @Nested
    @DisplayName("Edge")
    class EdgeTests {

        @Test
        @DisplayName("self-blocking edge is rejected")
        void selfEdge() {
            assertThrows(ValidationException.class, () -> Edge.blocks("a", "a"));
            assertThrows(ValidationException.class, () -> Edge.blocks("a", " "));
        }

        @Test
        @DisplayName("edges order by source, target, then kind")
        void ordering() {
            var sorted = new TreeSet<>(List.of(Edge.parentOf("b", "a"), Edge.blocks("a", "c"),
                    Edge.blocks("a", "b")));
            assertEquals(List.of(Edge.blocks("a", "b"), Edge.blocks("a", "c"), Edge.parentOf("b", "a")),
                    List.copyOf(sorted));
            assertTrue(Edge.blocks("a", "b").touches("b"));
            assertFalse(Edge.blocks("a", "b").touches("c"));
        }
    }
}
