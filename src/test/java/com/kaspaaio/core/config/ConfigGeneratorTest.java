package com.kaspaaio.core.config;

import com.kaspaaio.core.catalog.KaspaProfiles;
import com.kaspaaio.core.catalog.ProfileCatalog;
import com.kaspaaio.core.error.AioError;
import com.kaspaaio.core.error.Result;
import com.kaspaaio.core.security.SecretMaterialFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigGeneratorTest {

    private static final String MINING_ADDRESS = "kaspa:" + "q".repeat(61);

    private ComposeCodec codec;
    private ConfigGenerator generator;

    @BeforeEach
    void setUp() {
        ProfileCatalog catalog = new ProfileCatalog();
        codec = new ComposeCodec();
        generator = new ConfigGenerator(catalog, new SettingsSchema(catalog), new SecretGenerator(),
                new SecretMaterialFilter(), codec);
    }

    private GeneratedConfiguration generate(List<String> profiles, Map<String, String> settings) {
        Result<GeneratedConfiguration> result = generator.generate(profiles, settings);
        assertTrue(result.isSuccess(), () -> result.errors().toString());
        return result.orElseThrow();
    }

    private List<String> messages(Result<?> result) {
        return result.errors().stream().map(AioError::message).toList();
    }

    @Nested
    @DisplayName("successful generation")
    class Success {

        @Test
        @DisplayName("node selection produces one service with mapped ports and env")
        void nodeOnly() {
            GeneratedConfiguration config = generate(List.of(KaspaProfiles.KASPA_NODE), Map.of());

            assertEquals(List.of("kaspa-node"), config.compose().serviceNames());
            ComposeService node = config.compose().service("kaspa-node").orElseThrow();
            assertEquals(List.of("16110:16110", "16111:16111", "17110:17110"), node.ports());
            assertEquals("mainnet", node.environment().get("KASPA_NETWORK"));
            assertEquals(List.of("./data/kaspa-node:/app/data"), node.volumes());
            assertEquals(List.of(ConfigGenerator.NETWORK), node.networks());
            assertEquals("unless-stopped", node.restart());
            assertTrue(config.generatedSecrets().isEmpty());
        }

        @Test
        @DisplayName("identical inputs with explicit secrets give byte-identical files")
        void deterministic() {
            var settings = Map.of(
                    "POSTGRES_PASSWORD_EXPLORER", "ExplorerPassword123",
                    "KASPA_EXPLORER_PORT", "3104");
            var profiles = List.of(KaspaProfiles.KASPA_NODE, KaspaProfiles.KASPA_EXPLORER_BUNDLE);

            GeneratedConfiguration first = generate(profiles, settings);
            GeneratedConfiguration second = generate(profiles, settings);

            assertEquals(first.composeYaml(), second.composeYaml());
            assertEquals(first.envFile(), second.envFile());
            assertTrue(first.envFile().contains("KASPA_EXPLORER_PORT=3104\n"));
        }

        @Test
        @DisplayName("services are ordered by startup order then name")
        void serviceOrder() {
            GeneratedConfiguration config = generate(
                    List.of(KaspaProfiles.KASPA_EXPLORER_BUNDLE, KaspaProfiles.KASPA_NODE), Map.of());

            assertEquals(List.of("kaspa-node", "timescaledb-explorer", "simply-kaspa-indexer", "kaspa-explorer"),
                    config.compose().serviceNames());
        }

        @Test
        @DisplayName("missing database password is generated rather than rejected")
        void generatesSecrets() {
            GeneratedConfiguration config = generate(List.of(KaspaProfiles.KASPA_EXPLORER_BUNDLE), Map.of());

            assertEquals(List.of("POSTGRES_PASSWORD_EXPLORER"), config.generatedSecrets());
            String password = config.env().get("POSTGRES_PASSWORD_EXPLORER");
            assertTrue(password.length() >= SecretGenerator.MIN_LENGTH);
            assertEquals(password, config.compose().service("timescaledb-explorer").orElseThrow()
                    .environment().get("POSTGRES_PASSWORD"));
        }

        @Test
        @DisplayName("legacy IDs are accepted")
        void legacyIds() {
            GeneratedConfiguration config = generate(List.of("core"), Map.of());
            assertEquals(List.of(KaspaProfiles.KASPA_NODE), config.profiles());
        }

        @Test
        @DisplayName("local node mode without a node profile is a warning")
        void localModeWarning() {
            GeneratedConfiguration config = generate(List.of(KaspaProfiles.KASIA_INDEXER), Map.of());
            assertEquals(1, config.warnings().size());
            assertTrue(config.warnings().get(0).startsWith("KASIA_NODE_MODE"));
        }

        @Test
        @DisplayName("built services keep their build directive in the written YAML")
        void buildServices() {
            GeneratedConfiguration config = generate(
                    List.of(KaspaProfiles.KASPA_NODE, KaspaProfiles.KASPA_STRATUM),
                    Map.of("MINING_ADDRESS", MINING_ADDRESS));

            ComposeDocument reread = codec.read(config.composeYaml());
            ComposeService stratum = reread.service("kaspa-stratum").orElseThrow();
            assertNull(stratum.image());
            assertNotNull(stratum.build());
            assertEquals("kaspa-aio/kaspa-stratum:local", stratum.runImage());
            assertEquals(List.of("5555:5555"), stratum.ports());
        }
    }

    @Nested
    @DisplayName("rejections")
    class Rejections {

        @Test
        @DisplayName("stratum without a mining address fails")
        void missingRequired() {
            var result = generator.generate(List.of(KaspaProfiles.KASPA_NODE, KaspaProfiles.KASPA_STRATUM), Map.of());
            assertFalse(result.isSuccess());
            assertEquals(List.of("MINING_ADDRESS: is required"), messages(result));
        }

        @Test
        @DisplayName("two services on the same host port fail")
        void duplicatePorts() {
            var result = generator.generate(List.of(KaspaProfiles.KASPA_NODE),
                    Map.of("KASPA_NODE_P2P_PORT", "16110"));
            assertFalse(result.isSuccess());
            assertTrue(messages(result).get(0).contains("already used by"));
        }

        @Test
        @DisplayName("privileged ports and bad enum values fail")
        void typeChecks() {
            var result = generator.generate(List.of(KaspaProfiles.KASPA_NODE),
                    Map.of("KASPA_NODE_RPC_PORT", "80", "KASPA_NETWORK", "devnet"));
            assertEquals(2, result.errors().size());
            assertTrue(result.errors().stream().allMatch(e -> e.code().equals("invalid_setting")));
        }

        @Test
        @DisplayName("unknown keys fail")
        void unknownKey() {
            var result = generator.generate(List.of(KaspaProfiles.KASPA_NODE), Map.of("NOT_A_SETTING", "x"));
            assertEquals(List.of("NOT_A_SETTING: unknown configuration key"), messages(result));
        }

        @Test
        @DisplayName("remote node mode needs a URL")
        void remoteNeedsUrl() {
            var result = generator.generate(List.of(KaspaProfiles.KASIA_INDEXER),
                    Map.of("KASIA_NODE_MODE", "remote"));
            assertFalse(result.isSuccess());
            assertTrue(messages(result).get(0).startsWith("REMOTE_KASPA_NODE_WRPC_URL"));

            var ok = generator.generate(List.of(KaspaProfiles.KASIA_INDEXER),
                    Map.of("KASIA_NODE_MODE", "remote", "REMOTE_KASPA_NODE_WRPC_URL", "wss://node.example:17110"));
            assertTrue(ok.isSuccess(), () -> ok.errors().toString());
        }

        @Test
        @DisplayName("seed phrases are refused in ordinary fields")
        void seedPhrase() {
            String words = String.join(" ", java.util.Collections.nCopies(12, "abandon"));
            var result = generator.generate(List.of(KaspaProfiles.KASPA_NODE), Map.of("EXTERNAL_IP", words));
            assertFalse(result.isSuccess());
            assertTrue(messages(result).get(0).contains("seed phrase"));
        }

        @Test
        @DisplayName("unknown or empty selections fail")
        void badSelection() {
            assertEquals("invalid_profile", generator.generate(List.of("nope"), Map.of()).errors().get(0).code());
            assertEquals("empty_selection", generator.generate(List.of(), Map.of()).errors().get(0).code());
        }
    }

    @Test
    @DisplayName("defaultSettings merges global and profile defaults without secrets")
    void defaults() {
        var defaults = generator.defaultSettings(List.of(KaspaProfiles.KASPA_EXPLORER_BUNDLE, "nope"));
        assertEquals("mainnet", defaults.get("KASPA_NETWORK"));
        assertEquals("3004", defaults.get("KASPA_EXPLORER_PORT"));
        assertFalse(defaults.containsKey("POSTGRES_PASSWORD_EXPLORER"));
    }

    @Test
    @DisplayName("generatePassword never goes below the minimum length")
    void passwordLength() {
        assertEquals(SecretGenerator.MIN_LENGTH, generator.generatePassword(8).length());
        assertEquals(48, generator.generatePassword(48).length());
    }
}
