package com.workgraph.dispatch.api;

import com.workgraph.core.error.IndexInconsistentException;
import com.workgraph.core.index.GraphIndex;
import com.workgraph.core.index.IndexVerification;
import com.workgraph.core.index.RebuildReport;
import com.workgraph.core.index.RebuildTrigger;
import com.workgraph.core.model.Priority;
import com.workgraph.core.model.WorkItemStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

import static com.workgraph.core.snapshot.TestGraph.graph;
import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(IndexController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class IndexControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private GraphIndex graphIndex;

    @MockitoBean
    private GraphEventStream eventStream;

    @Test
    @DisplayName("GET /index summarises the current snapshot")
    void status() throws Exception {
        when(graphIndex.snapshot()).thenReturn(graph()
                .todo("a", "b")
                .add("c", Priority.LOW, WorkItemStatus.DONE)
                .blocks("a", "b")
                .parentOf("c", "a")
                .version(12)
                .snapshot());

        mockMvc.perform(get("/api/v1/index"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(jsonPath("$.version").value(12))
                .andExpect(jsonPath("$.items").value(3))
                .andExpect(jsonPath("$.unresolved").value(2))
                .andExpect(jsonPath("$.blocks_edges").value(1))
                .andExpect(jsonPath("$.parent_edges").value(1));
    }

    @Test
    @DisplayName("GET /index/verify reports divergence")
    void verification() throws Exception {
        when(graphIndex.verify()).thenReturn(
                new IndexVerification(false, List.of("late"), List.of("stray"), List.of("a blocks late"), List.of()));

        mockMvc.perform(get("/api/v1/index/verify"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(jsonPath("$.consistent").value(false))
                .andExpect(jsonPath("$.missing_nodes", contains("late")))
                .andExpect(jsonPath("$.stale_nodes", contains("stray")))
                .andExpect(jsonPath("$.missing_edges", contains("a blocks late")))
                .andExpect(jsonPath("$.extra_edges", empty()));
    }

    @Test
    @DisplayName("POST /index/rebuild runs a manual rebuild")
    void rebuild() throws Exception {
        when(graphIndex.rebuild(RebuildTrigger.MANUAL))
                .thenReturn(new RebuildReport(RebuildTrigger.MANUAL, 3, 2, 13, 4));

        mockMvc.perform(post("/api/v1/index/rebuild"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(jsonPath("$.trigger").value("MANUAL"))
                .andExpect(jsonPath("$.node_count").value(3))
                .andExpect(jsonPath("$.version").value(13));
    }

    @Test
    @DisplayName("a rebuild over an invalid store answers 409")
    void rebuildFails() throws Exception {
        when(graphIndex.rebuild(RebuildTrigger.MANUAL))
                .thenThrow(new IndexInconsistentException("Store holds an unreadable document: broken"));

        mockMvc.perform(post("/api/v1/index/rebuild"))
                .andExpect(MockMvcResultMatchers.status().isConflict())
                .andExpect(jsonPath("$.message", containsString("unreadable")));
    }

    @Test
    @DisplayName("GET /index/events opens an SSE stream for the requested item")
    void events() throws Exception {
        when(eventStream.open("feat-1")).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/v1/index/events").param("item", "feat-1"))
                .andExpect(request().asyncStarted());
        verify(eventStream).open("feat-1");
    }
}
