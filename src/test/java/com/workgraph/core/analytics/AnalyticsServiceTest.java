package com.workgraph.core.analytics;

import com.workgraph.core.error.AnalysisTimeoutException;
import com.workgraph.core.error.NotFoundException;
import com.workgraph.core.index.GraphIndex;
import com.workgraph.core.metrics.WorkgraphMetrics;
import com.workgraph.core.model.Bottleneck;
import com.workgraph.core.model.WorkItemStatus;
import com.workgraph.core.snapshot.TestGraph;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static com.workgraph.core.snapshot.TestGraph.graph;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnalyticsServiceTest {

    private SimpleMeterRegistry registry;
    private GraphIndex index;
    private AnalyticsService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        index = mock(GraphIndex.class);
        when(index.snapshot()).thenReturn(graph()
                .todo("a", "b", "c", "d")
                .blocks("a", "b", "c")
                .blocks("b", "d")
                .version(7)
                .snapshot());
        service = new AnalyticsService(index, new DependencyAnalytics(new AnalyticsProperties()),
                new WorkgraphMetrics(registry), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    /** Advances one second on every read. */
    private static final class SteppingClock extends Clock {
        private Instant now = TestGraph.T0;

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            Instant current = now;
            now = now.plusSeconds(1);
            return current;
        }
    }

    private AnalyticsService serviceWithTimeout(long defaultTimeoutMs) {
        var properties = new AnalyticsProperties();
        properties.getDefaults().setTimeoutMs(defaultTimeoutMs);
        return new AnalyticsService(index, new DependencyAnalytics(properties), new WorkgraphMetrics(registry),
                new SteppingClock());
    }

    @Test
    @DisplayName("missing arguments fall back to configured defaults")
    void defaults() {
        List<Bottleneck> bottlenecks = service.bottlenecks(null, null, null);
        assertEquals(List.of("a", "b"), bottlenecks.stream().map(Bottleneck::id).toList());

        assertEquals(List.of("a"), service.parallelWork(null, null, null).readyNow());
        assertEquals(1, service.recommend(null, null, null).size());
        assertEquals(4, service.queue(null, true, null).size());
    }

    @Test
    @DisplayName("explicit arguments override defaults")
    void explicitArguments() {
        assertEquals(List.of("a"), service.bottlenecks(1, null, null).stream().map(Bottleneck::id).toList());
        assertEquals(List.of("a"), service.bottlenecks(null, 2, null).stream().map(Bottleneck::id).toList());
        assertTrue(service.parallelWork(3, WorkItemStatus.DONE, null).readyNow().isEmpty());
    }

    @Test
    @DisplayName("each operation reads exactly one snapshot and records its latency")
    void oneSnapshotPerCall() {
        var overview = service.overview(null);

        assertEquals(7, overview.snapshotVersion());
        verify(index, times(1)).snapshot();
        assertNotNull(registry.find("workgraph.analytics.duration").tag("operation", "overview").timer());
    }

    @Test
    @DisplayName("MDC is cleared even when the operation fails")
    void clearsMdcOnFailure() {
        assertThrows(NotFoundException.class, () -> service.impact("missing", null));

        assertNull(MDC.get("operation"));
        assertNull(MDC.get("indexVersion"));
        assertNull(registry.find("workgraph.analytics.duration").tag("operation", "impact").timer());
    }

    @Test
    @DisplayName("impact of an existing item")
    void impact() {
        var impact = service.impact("a", null);
        assertEquals(3, impact.totalImpact());
        assertEquals(2, impact.directDependents());
    }

    @Test
    @DisplayName("caller MDC keys survive an analytics call")
    void keepsCallerMdc() {
        MDC.put("requestId", "r-9");
        MDC.put("itemId", "feat-1");
        MDC.put("operation", "http");

        service.risks(null, null);
        assertThrows(NotFoundException.class, () -> service.impact("missing", null));

        assertEquals("r-9", MDC.get("requestId"));
        assertEquals("feat-1", MDC.get("itemId"));
        assertEquals("http", MDC.get("operation"));
        assertNull(MDC.get("indexVersion"));
    }

    @Test
    @DisplayName("a timeout that passes mid-analysis aborts with no result")
    void explicitTimeout() {
        AnalyticsService timed = serviceWithTimeout(0);

        var e = assertThrows(AnalysisTimeoutException.class, () -> timed.bottlenecks(null, null, 500L));
        assertEquals("Deadline exceeded during transitive closure", e.getMessage());
        assertThrows(AnalysisTimeoutException.class, () -> timed.risks(null, 500L));
        assertNull(registry.find("workgraph.analytics.duration").tag("operation", "bottlenecks").timer());
    }

    @Test
    @DisplayName("the configured timeout applies when none is given and zero disables it")
    void configuredTimeout() {
        AnalyticsService timed = serviceWithTimeout(500);

        assertThrows(AnalysisTimeoutException.class, () -> timed.parallelWork(null, null, null));
        assertEquals(List.of("a"), timed.parallelWork(null, null, 0L).readyNow());
    }
}
