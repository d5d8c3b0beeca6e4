package com.kaspaaio.dispatch.api;

import com.kaspaaio.core.catalog.ProfileCatalog;
import com.kaspaaio.core.config.ComposeCodec;
import com.kaspaaio.core.config.ConfigGenerator;
import com.kaspaaio.core.config.SecretGenerator;
import com.kaspaaio.core.config.SettingsSchema;
import com.kaspaaio.core.security.SecretMaterialFilter;
import com.kaspaaio.core.store.SnapshotContents;
import com.kaspaaio.core.store.VersionStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasLength;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfigController.class)
@Import({ProfileCatalog.class, SettingsSchema.class, SecretGenerator.class, SecretMaterialFilter.class,
        ComposeCodec.class, ConfigGenerator.class})
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ConfigControllerTest {

    private static final String MINING_ADDRESS = "kaspa:" + "q".repeat(61);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private VersionStore versionStore;

    @Test
    @DisplayName("GET /config/defaults merges global and profile defaults")
    void defaults() throws Exception {
        mockMvc.perform(get("/api/v1/config/defaults").param("profiles", "kasia-indexer"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.KASPA_NETWORK").value("mainnet"))
                .andExpect(jsonPath("$.KASIA_NODE_MODE").value("local"));
    }

    @Test
    @DisplayName("GET /config/schema describes every configuration key")
    void schema() throws Exception {
        mockMvc.perform(get("/api/v1/config/schema"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.MINING_ADDRESS.required").value(true));
    }

    @Test
    @DisplayName("POST /config/generate returns the rendered files")
    void generate() throws Exception {
        mockMvc.perform(post("/api/v1/config/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"profiles":["kaspa-node","kaspa-stratum"],
                                 "settings":{"MINING_ADDRESS":"%s"}}
                                """.formatted(MINING_ADDRESS)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.composeYaml", containsString("kaspa-stratum")))
                .andExpect(jsonPath("$.env.MINING_ADDRESS").value(MINING_ADDRESS));
    }

    @Test
    @DisplayName("POST /config/generate returns 400 with field errors")
    void generateInvalid() throws Exception {
        mockMvc.perform(post("/api/v1/config/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"profiles":["kaspa-node","kaspa-stratum"]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[*].message", hasItem("MINING_ADDRESS: is required")));
    }

    @Test
    @DisplayName("GET /config/password honours the length but never goes below the minimum")
    void password() throws Exception {
        mockMvc.perform(get("/api/v1/config/password").param("length", "48"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.password").value(hasLength(48)));
        mockMvc.perform(get("/api/v1/config/password").param("length", "8"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.password").value(hasLength(SecretGenerator.MIN_LENGTH)));
    }

    @Test
    @DisplayName("GET /config/current masks secret values")
    void currentMasksSecrets() throws Exception {
        when(versionStore.readContents(VersionStore.CURRENT)).thenReturn(new SnapshotContents(
                "services: {}\n", "KASPA_NETWORK=mainnet\nPOSTGRES_PASSWORD_EXPLORER=hunter2hunter2\n", null));

        mockMvc.perform(get("/api/v1/config/current"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.env.KASPA_NETWORK").value("mainnet"))
                .andExpect(jsonPath("$.env.POSTGRES_PASSWORD_EXPLORER").value("********"));
    }
}
