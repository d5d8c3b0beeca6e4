package com.kaspaaio.core.engine;

import com.kaspaaio.core.catalog.ProfileCatalog;
import com.kaspaaio.core.config.ComposeCodec;
import com.kaspaaio.core.config.ConfigGenerator;
import com.kaspaaio.core.config.EnvFile;
import com.kaspaaio.core.config.SecretGenerator;
import com.kaspaaio.core.config.SettingsSchema;
import com.kaspaaio.core.error.EngineException;
import com.kaspaaio.core.error.ErrorKind;
import com.kaspaaio.core.events.AioEvent;
import com.kaspaaio.core.events.EventBus;
import com.kaspaaio.core.metrics.AioMetrics;
import com.kaspaaio.core.security.SecretMaterialFilter;
import com.kaspaaio.core.store.HistoryEntry;
import com.kaspaaio.core.store.InstallationState;
import com.kaspaaio.core.store.InstallationStateRepository;
import com.kaspaaio.core.store.VersionStore;
import com.kaspaaio.core.validation.DependencyValidator;
import com.kaspaaio.lifecycle.AioProperties;
import com.kaspaaio.lifecycle.ContainerEngine;
import com.kaspaaio.lifecycle.ServiceLifecycleManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Runs the engine against real files in a temporary install root with a mocked
 * container runtime.
 */
class ReconciliationEngineTest {

    private static final String MINING_ADDRESS = "kaspa:" + "q".repeat(61);

    @TempDir
    Path root;

    private ContainerEngine containers;
    private AioProperties properties;
    private InstallationStateRepository stateRepository;
    private VersionStore versionStore;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private ReconciliationEngine engine;

    @BeforeEach
    void setUp() {
        containers = mock(ContainerEngine.class);
        properties = new AioProperties();
        properties.getInstall().setRoot(root.toString());
        ProfileCatalog catalog = new ProfileCatalog();
        ComposeCodec codec = new ComposeCodec();
        SettingsSchema schema = new SettingsSchema(catalog);
        SecretMaterialFilter filter = new SecretMaterialFilter();
        stateRepository = new InstallationStateRepository(properties);
        versionStore = new VersionStore(properties, codec, stateRepository);
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        AioMetrics metrics = new AioMetrics(registry);
        var lifecycle = new ServiceLifecycleManager(catalog, containers, properties, codec, stateRepository, metrics);
        engine = new ReconciliationEngine(catalog, new DependencyValidator(catalog),
                new ConfigGenerator(catalog, schema, new SecretGenerator(), filter, codec),
                schema, filter, versionStore, lifecycle, stateRepository, properties, eventBus, metrics);
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private ReconciliationOutcome reconcile(List<String> profiles, Map<String, String> settings) {
        return engine.reconcile(new ReconfigurationRequest(profiles, settings, "test"));
    }

    private ReconciliationOutcome committed(List<String> profiles, Map<String, String> settings) {
        ReconciliationOutcome outcome = reconcile(profiles, settings);
        assertEquals(ReconciliationState.COMMITTED, outcome.status(), () -> outcome.errors().toString());
        return outcome;
    }

    private String read(Path path) throws Exception {
        return Files.readString(path);
    }

    @Nested
    @DisplayName("reconcile")
    class Reconcile {

        @Test
        @DisplayName("a first install writes files, deploys services and records history")
        void firstInstall() throws Exception {
            var events = new CopyOnWriteArrayList<AioEvent>();
            eventBus.subscribeAll(events::add);

            ReconciliationOutcome outcome = committed(List.of("kaspa-node"), Map.of());

            assertEquals(List.of("kaspa-node"), outcome.diff().added());
            assertNotNull(outcome.snapshotId());
            verify(containers).pullImage(eq("kaspanet/rusty-kaspad:latest"), any(Duration.class));
            verify(containers).start("kaspa-node");
            assertTrue(read(properties.getComposePath()).contains("kaspa-node"));
            assertEquals("mainnet", EnvFile.parse(read(properties.getEnvPath())).get("KASPA_NETWORK"));

            InstallationState state = stateRepository.load().orElseThrow();
            assertEquals(List.of("kaspa-node"), state.selectedProfiles());
            assertEquals("install", state.history().get(0).action());
            assertEquals(outcome.id(), state.history().get(0).reconciliationId());

            assertEquals(AioEvent.STARTED, events.get(0).eventType());
            assertEquals(AioEvent.COMMITTED, events.get(events.size() - 1).eventType());
            assertTrue(events.stream().anyMatch(e -> AioEvent.SERVICE_DEPLOYED.equals(e.eventType())
                    && "kaspa-node".equals(e.service())));
            assertEquals(1.0, registry.get("kaspa_aio.reconciliations.total").tag("status", "committed")
                    .counter().count());
            assertEquals(1.0, registry.get("kaspa_aio.backups.total").tag("operation", "snapshot")
                    .counter().count());
        }

        @Test
        @DisplayName("re-applying the same selection touches no service")
        void idempotent() {
            committed(List.of("kaspa-node"), Map.of());
            clearInvocations(containers);

            ReconciliationOutcome second = committed(List.of("kaspa-node"), Map.of());

            assertEquals(0, second.diff().touched());
            assertEquals(List.of("kaspa-node"), second.diff().unchanged());
            verify(containers, never()).create(any(), any());
            assertEquals("reconfigure", stateRepository.loadOrEmpty().history().get(1).action());
        }

        @Test
        @DisplayName("generated secrets survive later reconfigurations")
        void secretsRetained() {
            ReconciliationOutcome first = committed(List.of("kaspa-explorer-bundle"), Map.of());
            String password = stateRepository.loadOrEmpty().configuration().get("POSTGRES_PASSWORD_EXPLORER");
            assertNotNull(password);
            assertEquals(3, first.diff().added().size());

            ReconciliationOutcome second = committed(List.of("kaspa-explorer-bundle"),
                    Map.of("KASPA_EXPLORER_PORT", "3104"));

            assertEquals(password, stateRepository.loadOrEmpty().configuration().get("POSTGRES_PASSWORD_EXPLORER"));
            assertEquals(List.of("kaspa-explorer"), second.diff().changed());
            assertEquals(List.of("KASPA_EXPLORER_PORT"), second.diff().changedKeys());
        }

        @Test
        @DisplayName("an invalid selection fails before any file is touched")
        void invalidSelection() {
            ReconciliationOutcome outcome = reconcile(List.of("kaspa-stratum"), Map.of("MINING_ADDRESS", MINING_ADDRESS));

            assertEquals(ReconciliationState.FAILED, outcome.status());
            assertEquals("missing_prerequisite", outcome.errors().get(0).code());
            assertNull(outcome.snapshotId());
            assertFalse(Files.exists(properties.getComposePath()));
            assertTrue(versionStore.listBackups().isEmpty());
            verifyNoInteractions(containers);
        }

        @Test
        @DisplayName("wallet secrets in settings are refused")
        void secretMaterial() {
            ReconciliationOutcome outcome = reconcile(List.of("kaspa-node"), Map.of("EXTERNAL_IP", "ab".repeat(32)));

            assertEquals(ReconciliationState.FAILED, outcome.status());
            assertEquals("secret_material", outcome.errors().get(0).code());
        }

        @Test
        @DisplayName("schema errors fail after the snapshot without changing files")
        void schemaError() {
            committed(List.of("kaspa-node"), Map.of());

            ReconciliationOutcome outcome = reconcile(List.of("kaspa-node"), Map.of("KASPA_NODE_RPC_PORT", "80"));

            assertEquals(ReconciliationState.FAILED, outcome.status());
            assertEquals("invalid_setting", outcome.errors().get(0).code());
            assertEquals("16110", stateRepository.loadOrEmpty().configuration().get("KASPA_NODE_RPC_PORT"));
        }
    }

    @Nested
    @DisplayName("failures while applying")
    class ApplyFailures {

        @Test
        @DisplayName("an engine error rolls back files, state and added containers")
        void rollsBack() throws Exception {
            committed(List.of("kaspa-node"), Map.of());
            String composeBefore = read(properties.getComposePath());
            String envBefore = read(properties.getEnvPath());
            InstallationState stateBefore = stateRepository.loadOrEmpty();
            doThrow(new EngineException("kasia-indexer", "image not found")).when(containers).start("kasia-indexer");

            ReconciliationOutcome outcome = reconcile(List.of("kaspa-node", "kasia-indexer"), Map.of());

            assertEquals(ReconciliationState.ROLLED_BACK, outcome.status());
            assertEquals(ErrorKind.ENGINE, outcome.errors().get(0).kind());
            assertEquals(composeBefore, read(properties.getComposePath()));
            assertEquals(envBefore, read(properties.getEnvPath()));
            assertEquals(stateBefore, stateRepository.loadOrEmpty());
            verify(containers).remove("kasia-indexer");
            assertEquals(1.0, registry.get("kaspa_aio.rollbacks.total").tag("result", "restored").counter().count());
        }

        @Test
        @DisplayName("a failure in a later phase undoes the services earlier phases deployed")
        void rollsBackAcrossPhases() throws Exception {
            Files.createDirectories(root.resolve("services/k-indexer"));
            committed(List.of("kaspa-node"), Map.of());
            String composeBefore = read(properties.getComposePath());
            String envBefore = read(properties.getEnvPath());
            InstallationState stateBefore = stateRepository.loadOrEmpty();
            clearInvocations(containers);
            doThrow(new EngineException("k-indexer", "exited with code 1")).when(containers).start("k-indexer");

            ReconciliationOutcome outcome = reconcile(List.of("kaspa-node", "k-indexer-bundle"), Map.of());

            assertEquals(ReconciliationState.ROLLED_BACK, outcome.status(), () -> outcome.errors().toString());
            assertEquals(List.of("timescaledb-kindexer", "k-indexer"), outcome.diff().added());
            InOrder order = inOrder(containers);
            order.verify(containers).start("timescaledb-kindexer");
            order.verify(containers).start("k-indexer");
            order.verify(containers).remove("k-indexer");
            order.verify(containers).remove("timescaledb-kindexer");
            verify(containers, never()).remove("kaspa-node");
            assertEquals(composeBefore, read(properties.getComposePath()));
            assertEquals(envBefore, read(properties.getEnvPath()));
            assertEquals(stateBefore, stateRepository.loadOrEmpty());
            assertEquals(List.of("kaspa-node"), stateRepository.loadOrEmpty().services());
        }

        @Test
        @DisplayName("a failed rollback asks for manual recovery")
        void manualRecovery() {
            committed(List.of("kaspa-node"), Map.of());
            doThrow(new EngineException("kasia-indexer", "image not found")).when(containers).start("kasia-indexer");
            doThrow(new EngineException("kasia-indexer", "daemon gone")).when(containers).remove("kasia-indexer");

            ReconciliationOutcome outcome = reconcile(List.of("kaspa-node", "kasia-indexer"), Map.of());

            assertEquals(ReconciliationState.MANUAL_RECOVERY_REQUIRED, outcome.status());
            assertEquals("rollback_failed", outcome.errors().get(1).code());
            assertEquals(outcome.snapshotId(), outcome.errors().get(1).details().get("snapshotId"));
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("a second run is turned away while one is applying")
        void singleWriter() throws Exception {
            var entered = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            doAnswer(inv -> {
                entered.countDown();
                release.await(10, TimeUnit.SECONDS);
                return null;
            }).when(containers).pullImage(anyString(), any());

            var first = CompletableFuture.supplyAsync(() -> reconcile(List.of("kaspa-node"), Map.of()));
            assertTrue(entered.await(10, TimeUnit.SECONDS));
            assertEquals(ReconciliationState.APPLYING, engine.currentState());
            assertTrue(engine.currentProgress().isPresent());

            ReconciliationOutcome second = reconcile(List.of("kaspa-node"), Map.of());

            assertEquals(ReconciliationState.FAILED, second.status());
            assertEquals(ErrorKind.CONCURRENCY, second.errors().get(0).kind());
            release.countDown();
            assertEquals(ReconciliationState.COMMITTED, first.get(10, TimeUnit.SECONDS).status());
            assertEquals(ReconciliationState.IDLE, engine.currentState());
        }

        @Test
        @DisplayName("cancel interrupts the apply and rolls back")
        void cancel() throws Exception {
            var entered = new CountDownLatch(1);
            doAnswer(inv -> {
                entered.countDown();
                new CountDownLatch(1).await(5, TimeUnit.SECONDS);
                return null;
            }).when(containers).pullImage(anyString(), any());

            var run = CompletableFuture.supplyAsync(() -> reconcile(List.of("kaspa-node"), Map.of()));
            assertTrue(entered.await(10, TimeUnit.SECONDS));

            assertTrue(engine.cancel());
            ReconciliationOutcome outcome = run.get(30, TimeUnit.SECONDS);

            assertEquals(ReconciliationState.ROLLED_BACK, outcome.status());
            assertFalse(Files.exists(properties.getComposePath()));
            assertFalse(engine.cancel());
        }
    }

    @Nested
    @DisplayName("removeProfiles")
    class RemoveProfiles {

        @BeforeEach
        void buildContexts() throws Exception {
            Files.createDirectories(root.resolve("services/kaspa-stratum"));
            Files.createDirectories(root.resolve("services/k-indexer"));
        }

        @Test
        @DisplayName("dependent profiles can be named in any order")
        void orderIndependent() throws Exception {
            committed(List.of("kaspa-node", "kaspa-stratum", "kasia-indexer"), Map.of("MINING_ADDRESS", MINING_ADDRESS));

            ReconciliationOutcome outcome = engine.removeProfiles(List.of("kaspa-node", "kaspa-stratum"));

            assertEquals(ReconciliationState.COMMITTED, outcome.status(), () -> outcome.errors().toString());
            assertEquals(List.of("kasia-indexer"), outcome.resolvedProfiles());
            verify(containers).remove("kaspa-node");
            verify(containers).remove("kaspa-stratum");
            InstallationState state = stateRepository.loadOrEmpty();
            assertEquals(List.of("kasia-indexer"), state.services());
            assertEquals("remove-profile", state.history().get(state.history().size() - 1).action());
            assertFalse(EnvFile.parse(read(properties.getEnvPath())).containsKey("MINING_ADDRESS"));
        }

        @Test
        @DisplayName("removing a profile removes every service it owns")
        void removesWholeBundle() throws Exception {
            committed(List.of("kaspa-node", "k-indexer-bundle"), Map.of());

            ReconciliationOutcome outcome = engine.removeProfiles(List.of("k-indexer-bundle"));

            assertEquals(ReconciliationState.COMMITTED, outcome.status(), () -> outcome.errors().toString());
            assertEquals(List.of("timescaledb-kindexer", "k-indexer"), outcome.diff().removed());
            verify(containers).remove("k-indexer");
            verify(containers).remove("timescaledb-kindexer");
            verify(containers, never()).remove("kaspa-node");
            assertEquals(List.of("kaspa-node"),
                    new ComposeCodec().read(read(properties.getComposePath())).serviceNames());
            InstallationState state = stateRepository.loadOrEmpty();
            assertEquals(List.of("kaspa-node"), state.selectedProfiles());
            assertEquals(List.of("kaspa-node"), state.services());
            assertFalse(EnvFile.parse(read(properties.getEnvPath())).containsKey("K_INDEXER_PORT"));
        }

        @Test
        @DisplayName("a removal that cannot be undone asks for manual recovery")
        void failedCompensation() {
            committed(List.of("kaspa-node", "k-indexer-bundle"), Map.of());
            doThrow(new EngineException("timescaledb-kindexer", "busy")).when(containers).remove("timescaledb-kindexer");
            doThrow(new EngineException("k-indexer", "exited with code 1")).when(containers).start("k-indexer");

            ReconciliationOutcome outcome = engine.removeProfiles(List.of("k-indexer-bundle"));

            assertEquals(ReconciliationState.MANUAL_RECOVERY_REQUIRED, outcome.status());
            assertEquals("engine_failure", outcome.errors().get(0).code());
            var rollbackError = outcome.errors().get(1);
            assertEquals("rollback_failed", rollbackError.code());
            assertEquals(outcome.snapshotId(), rollbackError.details().get("snapshotId"));
            assertEquals(List.of("k-indexer"), rollbackError.details().get("services"));
            assertTrue(rollbackError.remediation().contains(outcome.snapshotId()));
            assertEquals(1.0, registry.get("kaspa_aio.rollbacks.total").tag("result", "manual_recovery").counter().count());
        }

        @Test
        @DisplayName("a prerequisite still needed blocks the removal")
        void blocked() {
            committed(List.of("kaspa-node", "kaspa-stratum"), Map.of("MINING_ADDRESS", MINING_ADDRESS));
            clearInvocations(containers);

            ReconciliationOutcome outcome = engine.removeProfiles(List.of("kaspa-node"));

            assertEquals(ReconciliationState.FAILED, outcome.status());
            assertEquals("removal_blocked", outcome.errors().get(0).code());
            verifyNoInteractions(containers);
        }

        @Test
        @DisplayName("an engine refusal leaves the installation as it was")
        void engineRefusal() throws Exception {
            committed(List.of("kaspa-node", "kaspa-stratum"), Map.of("MINING_ADDRESS", MINING_ADDRESS));
            String composeBefore = read(properties.getComposePath());
            doThrow(new EngineException("kaspa-stratum", "busy")).when(containers).remove("kaspa-stratum");

            ReconciliationOutcome outcome = engine.removeProfiles(List.of("kaspa-stratum"));

            assertEquals(ReconciliationState.ROLLED_BACK, outcome.status());
            assertEquals(composeBefore, read(properties.getComposePath()));
            assertEquals(List.of("kaspa-node", "kaspa-stratum"), stateRepository.loadOrEmpty().selectedProfiles());
        }
    }

    @Nested
    @DisplayName("restore")
    class Restore {

        @Test
        @DisplayName("converges containers to the restored backup")
        void restoresBackup() throws Exception {
            committed(List.of("kaspa-node"), Map.of());
            String composeAfterFirst = read(properties.getComposePath());
            ReconciliationOutcome second = committed(List.of("kaspa-node", "kasia-indexer"), Map.of());

            ReconciliationOutcome outcome = engine.restore(second.snapshotId());

            assertEquals(ReconciliationState.COMMITTED, outcome.status(), () -> outcome.errors().toString());
            assertEquals(List.of("kasia-indexer"), outcome.diff().removed());
            assertEquals(composeAfterFirst, read(properties.getComposePath()));
            verify(containers).remove("kasia-indexer");
            InstallationState state = stateRepository.loadOrEmpty();
            assertEquals(List.of("kaspa-node"), state.selectedProfiles());
            assertEquals("restore", state.history().get(state.history().size() - 1).action());
        }

        @Test
        @DisplayName("history made after the backup is kept and the restore is appended")
        void historyOnlyGrows() {
            ReconciliationOutcome first = committed(List.of("kaspa-node"), Map.of());
            ReconciliationOutcome second = committed(List.of("kaspa-node", "kasia-indexer"), Map.of());
            var before = stateRepository.loadOrEmpty().history();

            ReconciliationOutcome outcome = engine.restore(second.snapshotId());

            assertEquals(ReconciliationState.COMMITTED, outcome.status(), () -> outcome.errors().toString());
            var after = stateRepository.loadOrEmpty().history();
            assertEquals(before, after.subList(0, before.size()));
            assertEquals(List.of("install", "reconfigure", "restore"),
                    after.stream().map(HistoryEntry::action).toList());
            assertEquals(List.of(first.id(), second.id(), outcome.id()),
                    after.stream().map(HistoryEntry::reconciliationId).toList());
        }

        @Test
        @DisplayName("an unknown backup fails without a snapshot")
        void unknownBackup() {
            ReconciliationOutcome outcome = engine.restore("20200101-000000-000");

            assertEquals(ReconciliationState.FAILED, outcome.status());
            assertEquals("backup_not_found", outcome.errors().get(0).code());
            assertTrue(engine.lastOutcome().isPresent());
        }
    }
}
