package com.sandcastle.dispatch.api;

import com.sandcastle.core.health.HealthCheckService;
import com.sandcastle.core.health.HealthStatus;
import com.sandcastle.session.SessionRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

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

    @MockitoBean
    private SessionRegistry sessionRegistry;

    @Test
    @DisplayName("GET /health is 200 when nothing is down, degraded included")
    void healthy() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("runtime", HealthStatus.Status.UP, "python3 found", Map.of()),
                new HealthStatus("blob-store", HealthStatus.Status.DEGRADED, "not writable", Map.of())));
        when(sessionRegistry.activeCount()).thenReturn(3);

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.runtime.status").value("UP"))
                .andExpect(jsonPath("$.components.blob-store.status").value("DEGRADED"))
                .andExpect(jsonPath("$.active_sessions").value(3));
    }

    @Test
    @DisplayName("GET /health is 503 when the runtime is missing")
    void runtimeDown() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("runtime", HealthStatus.Status.DOWN, "python3 not on PATH", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.runtime.detail").value("python3 not on PATH"));
    }
}
