package com.kaspaaio.core.store;

import com.kaspaaio.core.config.ComposeCodec;
import com.kaspaaio.core.error.StorageException;
import com.kaspaaio.lifecycle.AioProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VersionStoreTest {

    @TempDir
    Path root;

    private AioProperties properties;
    private InstallationStateRepository stateRepository;
    private VersionStore store;

    @BeforeEach
    void setUp() {
        properties = new AioProperties();
        properties.getInstall().setRoot(root.toString());
        properties.getBackup().setRetention(3);
        stateRepository = new InstallationStateRepository(properties);
        store = new VersionStore(properties, new ComposeCodec(), stateRepository,
                new TickingClock(Instant.parse("2026-01-01T00:00:00Z")));
    }

    private void writeLive(String compose, String env) throws Exception {
        if (compose != null) Files.writeString(properties.getComposePath(), compose);
        if (env != null) Files.writeString(properties.getEnvPath(), env);
    }

    @Nested
    @DisplayName("createBackup")
    class CreateBackup {

        @Test
        @DisplayName("captures existing files and the selected profiles")
        void capturesFiles() throws Exception {
            writeLive("services: {}\n", "KASPA_NETWORK=mainnet\n");
            stateRepository.save(new InstallationState(InstallMode.INITIAL, List.of("kaspa-node"),
                    Map.of(), List.of("kaspa-node"), null, List.of()));

            ConfigurationSnapshot snapshot = store.createBackup("manual", Map.of("source", "test"));

            assertEquals("20260101-000000-000", snapshot.id());
            assertEquals(List.of("kaspa-node"), snapshot.selectedProfiles());
            assertTrue(snapshot.captured(VersionStore.COMPOSE_FILE));
            assertTrue(snapshot.captured(VersionStore.ENV_FILE));
            assertTrue(snapshot.captured(VersionStore.STATE_FILE));
            assertEquals(snapshot, store.getBackup(snapshot.id()).orElseThrow());
        }

        @Test
        @DisplayName("absent files are recorded as absent")
        void absentFiles() {
            ConfigurationSnapshot snapshot = store.createBackup("empty", Map.of());
            assertTrue(snapshot.files().isEmpty());
            assertEquals(0, snapshot.totalSize());
        }

        @Test
        @DisplayName("no staging directory is left behind")
        void noStaging() throws Exception {
            writeLive("services: {}\n", null);
            store.createBackup("manual", Map.of());
            try (var dirs = Files.list(properties.getBackupRoot())) {
                assertTrue(dirs.noneMatch(p -> p.getFileName().toString().startsWith(".staging-")));
            }
        }
    }

    @Nested
    @DisplayName("restoreBackup")
    class Restore {

        @Test
        @DisplayName("restores bytes exactly and deletes files that did not exist")
        void restoresExactly() throws Exception {
            writeLive("services: {}\n", null);
            String id = store.createBackup("before", Map.of()).id();
            writeLive("services:\n  a:\n    image: x\n", "A=1\n");

            RestoreResult result = store.restoreBackup(id, true);

            assertEquals("services: {}\n", Files.readString(properties.getComposePath()));
            assertFalse(Files.exists(properties.getEnvPath()));
            assertEquals(List.of(VersionStore.COMPOSE_FILE), result.restoredFiles());
            assertEquals(List.of(VersionStore.ENV_FILE), result.removedFiles());
            assertNotNull(result.preRestoreBackupId());
            assertTrue(store.readContents(result.preRestoreBackupId()).envFile().contains("A=1"));
        }

        @Test
        @DisplayName("an unknown ID fails without touching live files")
        void unknownId() throws Exception {
            writeLive("services: {}\n", null);
            var e = assertThrows(StorageException.class, () -> store.restoreBackup("missing", true));
            assertEquals("backup_not_found", e.getError().code());
            assertTrue(store.listBackups().isEmpty());
        }

        @Test
        @DisplayName("path-like IDs are never resolved")
        void pathIds() {
            assertTrue(store.getBackup("../etc").isEmpty());
            assertTrue(store.getBackup(null).isEmpty());
        }
    }

    @Test
    @DisplayName("diff reports env and service changes and masks secrets")
    void diffMasksSecrets() throws Exception {
        writeLive("services:\n  a:\n    image: one\n", "POSTGRES_PASSWORD_EXPLORER=old\nPORT=1\n");
        String id = store.createBackup("before", Map.of()).id();
        writeLive("services:\n  a:\n    image: two\n  b:\n    image: three\n",
                "POSTGRES_PASSWORD_EXPLORER=new\nEXTRA=x\n");

        SnapshotDiff diff = store.diff(id, VersionStore.CURRENT);

        var byKey = new java.util.HashMap<String, SnapshotDiff.Change>();
        diff.changes().forEach(c -> byKey.put(c.key(), c));
        assertEquals(5, diff.changeCount());
        assertEquals(SnapshotDiff.ChangeType.ADDED, byKey.get("EXTRA").type());
        assertEquals(SnapshotDiff.ChangeType.REMOVED, byKey.get("PORT").type());
        assertEquals("********", byKey.get("POSTGRES_PASSWORD_EXPLORER").oldValue());
        assertEquals("********", byKey.get("POSTGRES_PASSWORD_EXPLORER").newValue());
        assertEquals(SnapshotDiff.ChangeType.CHANGED, byKey.get("service:a").type());
        assertEquals(SnapshotDiff.ChangeType.ADDED, byKey.get("service:b").type());
    }

    @Nested
    @DisplayName("retention")
    class Retention {

        @Test
        @DisplayName("listing is newest first and cleanup deletes the oldest")
        void cleanup() {
            var ids = new java.util.ArrayList<String>();
            for (int i = 0; i < 5; i++) {
                ids.add(store.createBackup("b" + i, Map.of()).id());
            }

            assertEquals(ids.get(4), store.listBackups().get(0).id());
            assertEquals(2, store.listBackups(2).size());

            List<String> deleted = store.cleanupOldBackups();

            assertEquals(List.of(ids.get(0), ids.get(1)), deleted);
            assertEquals(3, store.listBackups().size());
            assertEquals(List.of(), store.cleanupOldBackups(3));
        }

        @Test
        @DisplayName("deleteBackup returns false for unknown IDs")
        void delete() {
            String id = store.createBackup("x", Map.of()).id();
            assertTrue(store.deleteBackup(id));
            assertFalse(store.deleteBackup(id));
        }

        @Test
        @DisplayName("storage usage counts backups and files")
        void usage() throws Exception {
            writeLive("services: {}\n", "A=1\n");
            store.createBackup("x", Map.of());

            StorageUsage usage = store.getStorageUsage();

            assertEquals(1, usage.backupCount());
            assertEquals(3, usage.fileCount());
            assertTrue(usage.totalBytes() > 0);
        }
    }

    @Test
    @DisplayName("mask hides password, secret and token keys only")
    void mask() {
        assertEquals("********", VersionStore.mask("API_TOKEN", "abc"));
        assertEquals("abc", VersionStore.mask("KASPA_NETWORK", "abc"));
        assertNull(VersionStore.mask("DB_PASSWORD", null));
    }

    /** Advances one second on every read so backup IDs stay distinct. */
    static final class TickingClock extends Clock {
        private Instant now;

        TickingClock(Instant start) {
            this.now = start.minusSeconds(1);
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
        public synchronized Instant instant() {
            now = now.plus(Duration.ofSeconds(1));
            return now;
        }
    }
}
