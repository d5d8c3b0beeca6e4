package com.kaspaaio.dispatch.api;

import com.kaspaaio.core.error.EngineException;
import com.kaspaaio.core.store.InstallMode;
import com.kaspaaio.core.store.InstallationState;
import com.kaspaaio.core.store.InstallationStateRepository;
import com.kaspaaio.lifecycle.ContainerStatus;
import com.kaspaaio.lifecycle.ServiceLifecycleManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ServiceController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ServiceControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ServiceLifecycleManager lifecycle;

    @MockitoBean
    private InstallationStateRepository stateRepository;

    @BeforeEach
    void setUp() {
        when(stateRepository.loadOrEmpty()).thenReturn(new InstallationState(InstallMode.RECONFIGURE,
                List.of("kaspa-node"), Map.of(), List.of("kaspa-node"), NOW, List.of()));
    }

    private static ContainerStatus running() {
        return new ContainerStatus("kaspa-node", ContainerStatus.State.RUNNING,
                "kaspanet/rusty-kaspad:latest", "healthy", NOW);
    }

    @Test
    @DisplayName("GET /services returns the status of every installed service")
    void statuses() throws Exception {
        when(lifecycle.statusAll(List.of("kaspa-node"))).thenReturn(Map.of("kaspa-node", running()));

        mockMvc.perform(get("/api/v1/services"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['kaspa-node'].state").value("RUNNING"))
                .andExpect(jsonPath("$['kaspa-node'].health").value("healthy"));
    }

    @Test
    @DisplayName("POST /services/{name}/restart restarts an installed service")
    void restart() throws Exception {
        when(lifecycle.status("kaspa-node")).thenReturn(running());

        mockMvc.perform(post("/api/v1/services/kaspa-node/restart"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.containerName").value("kaspa-node"));
        verify(lifecycle).restart("kaspa-node");
    }

    @Test
    @DisplayName("operations on containers that are not installed return 404")
    void unknownService() throws Exception {
        mockMvc.perform(post("/api/v1/services/postgres/stop"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/v1/services/postgres"))
                .andExpect(status().isNotFound());
        verify(lifecycle, never()).stop(anyString());
        verify(lifecycle, never()).status(anyString());
    }

    @Test
    @DisplayName("an engine failure maps to 502 with an error body")
    void engineFailure() throws Exception {
        doThrow(new EngineException("kaspa-node", "Docker daemon unreachable")).when(lifecycle).start("kaspa-node");

        mockMvc.perform(post("/api/v1/services/kaspa-node/start"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.errors[0].kind").value("ENGINE"));
    }
}
