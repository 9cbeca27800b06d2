package com.workgraph.dispatch.api;

import com.workgraph.core.health.HealthCheckService;
import com.workgraph.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("all components up answers 200 UP")
    void up() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("store", HealthStatus.Status.UP, "2 documents", Map.of("documents", "2")),
                new HealthStatus("snapshot", HealthStatus.Status.UP, "2 items", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.store.metadata.documents").value("2"))
                .andExpect(jsonPath("$.components.snapshot.metadata").doesNotExist());
    }

    @Test
    @DisplayName("a degraded index answers 200 DEGRADED")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("index", HealthStatus.Status.DEGRADED, "Index diverges from store; run rebuild",
                        Map.of("missingNodes", "late"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.index.detail", containsString("rebuild")));
    }

    @Test
    @DisplayName("any component down answers 503")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("store", HealthStatus.Status.DOWN, "Store error: disk gone", Map.of()),
                new HealthStatus("index", HealthStatus.Status.DEGRADED, "diverged", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.store.status").value("DOWN"));
    }
}
