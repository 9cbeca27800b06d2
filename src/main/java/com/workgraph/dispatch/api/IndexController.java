package com.workgraph.dispatch.api;

import com.workgraph.core.index.GraphIndex;
import com.workgraph.core.index.IndexVerification;
import com.workgraph.core.index.RebuildReport;
import com.workgraph.core.index.RebuildTrigger;
import com.workgraph.core.snapshot.GraphSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for the graph index: state, verification, rebuild and change events.
 */
@RestController
@RequestMapping("/api/v1/index")
public class IndexController {

    private static final Logger log = LoggerFactory.getLogger(IndexController.class);

    private final GraphIndex graphIndex;
    private final GraphEventStream eventStream;

    public IndexController(GraphIndex graphIndex, GraphEventStream eventStream) {
        this.graphIndex = graphIndex;
        this.eventStream = eventStream;
    }

    @GetMapping
    public Map<String, Object> status() {
        GraphSnapshot snapshot = graphIndex.snapshot();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("version", snapshot.version());
        result.put("items", snapshot.size());
        result.put("unresolved", snapshot.unresolvedCount());
        result.put("blocks_edges", snapshot.blockEdges().size());
        result.put("parent_edges", snapshot.parentEdges().size());
        return result;
    }

    @GetMapping("/verify")
    public IndexVerification verify() {
        return graphIndex.verify();
    }

    @PostMapping("/rebuild")
    public RebuildReport rebuild() {
        log.info("Index rebuild requested over REST");
        return graphIndex.rebuild(RebuildTrigger.MANUAL);
    }

    /**
     * GET /api/v1/index/events: SSE stream of applied, rejected and rebuilt events,
     * optionally limited to one work item.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@RequestParam(name = "item", required = false) String itemId) {
        return eventStream.open(itemId);
    }
}
