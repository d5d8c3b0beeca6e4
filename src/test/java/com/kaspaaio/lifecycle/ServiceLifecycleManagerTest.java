package com.kaspaaio.lifecycle;

import com.kaspaaio.core.catalog.ProfileCatalog;
import com.kaspaaio.core.config.ComposeCodec;
import com.kaspaaio.core.config.ComposeDocument;
import com.kaspaaio.core.config.ComposeService;
import com.kaspaaio.core.error.CompensationException;
import com.kaspaaio.core.error.EngineException;
import com.kaspaaio.core.store.InstallMode;
import com.kaspaaio.core.store.InstallationState;
import com.kaspaaio.core.store.InstallationStateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ServiceLifecycleManagerTest {

    @TempDir
    Path root;

    private ContainerEngine engine;
    private AioProperties properties;
    private ComposeCodec codec;
    private InstallationStateRepository stateRepository;
    private MutableClock clock;
    private ServiceLifecycleManager manager;

    @BeforeEach
    void setUp() {
        engine = mock(ContainerEngine.class);
        properties = new AioProperties();
        properties.getInstall().setRoot(root.toString());
        codec = new ComposeCodec();
        stateRepository = new InstallationStateRepository(properties);
        clock = new MutableClock(Instant.parse("2026-02-01T00:00:00Z"));
        manager = new ServiceLifecycleManager(new ProfileCatalog(), engine, properties, codec, stateRepository,
                null, clock);
    }

    private static ComposeService service(String name) {
        return new ComposeService(name, "img/" + name, null, "unless-stopped", List.of(), Map.of(), List.of(),
                List.of("kaspa-network"), List.of("kaspa-explorer-bundle"));
    }

    private void installExplorer() throws Exception {
        var services = new LinkedHashMap<String, ComposeService>();
        services.put("timescaledb-explorer", service("timescaledb-explorer"));
        services.put("simply-kaspa-indexer", service("simply-kaspa-indexer"));
        services.put("kaspa-explorer", service("kaspa-explorer"));
        Files.writeString(properties.getComposePath(), codec.write(new ComposeDocument(services, Map.of())));
        stateRepository.save(new InstallationState(InstallMode.INITIAL, List.of("kaspa-explorer-bundle"), Map.of(),
                List.copyOf(services.keySet()), null, List.of()));
    }

    @Test
    @DisplayName("container names come from profiles, legacy IDs migrated and unknown IDs skipped")
    void containerNames() {
        assertEquals(List.of("kaspa-node", "kasia-indexer", "timescaledb-kindexer", "k-indexer"),
                manager.containerNamesForProfiles(List.of("core", "indexer-services", "unknown", "kaspa-node")));
    }

    @Nested
    @DisplayName("removeServices")
    class RemoveServices {

        @Test
        @DisplayName("removes containers in reverse order then updates compose and state")
        void removesInReverseOrder() throws Exception {
            installExplorer();

            List<String> removed = manager.removeServices(List.of("timescaledb-explorer", "kaspa-explorer"));

            assertEquals(List.of("kaspa-explorer", "timescaledb-explorer"), removed);
            InOrder order = inOrder(engine);
            order.verify(engine).remove("kaspa-explorer");
            order.verify(engine).remove("timescaledb-explorer");
            assertEquals(List.of("simply-kaspa-indexer"), manager.currentCompose().serviceNames());
            assertEquals(List.of("simply-kaspa-indexer"), stateRepository.loadOrEmpty().services());
        }

        @Test
        @DisplayName("a refused removal redeploys what was removed and leaves files untouched")
        void compensatesOnEngineFailure() throws Exception {
            installExplorer();
            String composeBefore = Files.readString(properties.getComposePath());
            doThrow(new EngineException("timescaledb-explorer", "busy")).when(engine).remove("timescaledb-explorer");

            assertThrows(EngineException.class,
                    () -> manager.removeServices(List.of("timescaledb-explorer", "kaspa-explorer")));

            verify(engine).pullImage(eq("img/kaspa-explorer"), any(Duration.class));
            verify(engine).create(argThat(s -> s.containerName().equals("kaspa-explorer")), eq(properties.getInstallRoot()));
            verify(engine).start("kaspa-explorer");
            verify(engine).start("timescaledb-explorer");
            assertEquals(composeBefore, Files.readString(properties.getComposePath()));
            assertEquals(3, stateRepository.loadOrEmpty().services().size());
        }

        @Test
        @DisplayName("a container stopped before its removal failed is started again")
        void restartsStoppedContainer() throws Exception {
            installExplorer();
            doThrow(new EngineException("timescaledb-explorer", "busy")).when(engine).remove("timescaledb-explorer");

            assertThrows(EngineException.class, () -> manager.removeServices(List.of("timescaledb-explorer")));

            InOrder order = inOrder(engine);
            order.verify(engine).stop(eq("timescaledb-explorer"), anyInt());
            order.verify(engine).remove("timescaledb-explorer");
            order.verify(engine).start("timescaledb-explorer");
            verify(engine, never()).create(any(), any());
        }

        @Test
        @DisplayName("a failed redeploy is reported with the services left down")
        void reportsFailedCompensation() throws Exception {
            installExplorer();
            String composeBefore = Files.readString(properties.getComposePath());
            doThrow(new EngineException("timescaledb-explorer", "busy")).when(engine).remove("timescaledb-explorer");
            doThrow(new EngineException("kaspa-explorer", "exited with code 1")).when(engine).start("kaspa-explorer");

            var e = assertThrows(CompensationException.class,
                    () -> manager.removeServices(List.of("timescaledb-explorer", "kaspa-explorer")));

            assertEquals(List.of("kaspa-explorer"), e.getUnrecovered());
            assertEquals("compensation_failed", e.getError().code());
            assertInstanceOf(EngineException.class, e.getCause());
            assertEquals(composeBefore, Files.readString(properties.getComposePath()));
        }
    }

    @Nested
    @DisplayName("deploy")
    class Deploy {

        @Test
        @DisplayName("pulls, ensures the network, creates and starts")
        void pullsAndStarts() {
            ComposeService svc = service("kaspa-node");

            manager.deploy(svc, Duration.ofMinutes(5));

            InOrder order = inOrder(engine);
            order.verify(engine).pullImage("img/kaspa-node", Duration.ofMinutes(5));
            order.verify(engine).ensureNetwork("kaspa-network");
            order.verify(engine).create(svc, properties.getInstallRoot());
            order.verify(engine).start("kaspa-node");
        }

        @Test
        @DisplayName("a missing build context fails before touching the engine")
        void missingBuildContext() {
            var svc = new ComposeService("kaspa-stratum", null,
                    com.kaspaaio.core.catalog.BuildSpec.of("./services/kaspa-stratum"), "unless-stopped",
                    List.of(), Map.of(), List.of(), List.of(), List.of("kaspa-stratum"));

            assertThrows(EngineException.class, () -> manager.deploy(svc, Duration.ofMinutes(1)));
            verifyNoInteractions(engine);
        }
    }

    @Nested
    @DisplayName("status")
    class Status {

        @Test
        @DisplayName("is cached for the TTL and invalidated by operations")
        void cachesStatus() {
            when(engine.inspect("kaspa-node")).thenAnswer(inv ->
                    new ContainerStatus("kaspa-node", ContainerStatus.State.RUNNING, "img", null, clock.instant()));

            manager.status("kaspa-node");
            manager.status("kaspa-node");
            verify(engine, times(1)).inspect("kaspa-node");

            clock.advance(properties.getStatusCacheTtl().plusMillis(1));
            manager.status("kaspa-node");
            verify(engine, times(2)).inspect("kaspa-node");

            manager.restart("kaspa-node");
            manager.status("kaspa-node");
            verify(engine, times(3)).inspect("kaspa-node");
        }

        @Test
        @DisplayName("statusAll keeps the requested order")
        void statusAll() {
            when(engine.inspect(anyString())).thenAnswer(inv ->
                    ContainerStatus.missing(inv.getArgument(0), clock.instant()));

            var statuses = manager.statusAll(List.of("b", "a"));

            assertEquals(List.of("b", "a"), List.copyOf(statuses.keySet()));
        }
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

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
            return now;
        }
    }
}
