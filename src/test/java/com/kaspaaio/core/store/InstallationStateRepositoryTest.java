package com.kaspaaio.core.store;

import com.kaspaaio.core.error.StorageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InstallationStateRepositoryTest {

    @TempDir
    Path dir;

    @Test
    void missingFileLoadsAsEmpty() {
        var repository = new InstallationStateRepository(dir.resolve("state.json"));
        assertTrue(repository.load().isEmpty());
        assertFalse(repository.loadOrEmpty().isInstalled());
    }

    @Test
    void savedStateReadsBackWithHistory() {
        var repository = new InstallationStateRepository(dir.resolve("nested/state.json"));
        Instant at = Instant.parse("2026-03-01T10:15:30Z");
        var entry = new HistoryEntry("install", at, "run-1", "snap-1", List.of("kaspa-node"),
                List.of("kaspa-node"), List.of(), List.of(), List.of("KASPA_NETWORK"));
        InstallationState state = InstallationState.empty()
                .commit(List.of("kaspa-node"), Map.of("KASPA_NETWORK", "mainnet"), List.of("kaspa-node"), entry);

        repository.save(state);
        InstallationState loaded = repository.load().orElseThrow();

        assertEquals(state, loaded);
        assertEquals(InstallMode.RECONFIGURE, loaded.mode());
        assertEquals(at, loaded.lastModified());
    }

    @Test
    void writesModeInLowerCase() throws Exception {
        var repository = new InstallationStateRepository(dir.resolve("state.json"));
        repository.save(InstallationState.empty());
        assertTrue(Files.readString(repository.path()).contains("\"mode\" : \"initial\""));
    }

    @Test
    void corruptFileIsAStorageError() throws Exception {
        Path path = dir.resolve("state.json");
        Files.writeString(path, "{not json");
        var repository = new InstallationStateRepository(path);

        var e = assertThrows(StorageException.class, repository::load);
        assertEquals("state_read_failed", e.getError().code());
    }

    @Test
    void withoutServicesKeepsSelectionAndHistory() {
        var state = new InstallationState(InstallMode.RECONFIGURE, List.of("kaspa-explorer-bundle"), Map.of(),
                List.of("timescaledb-explorer", "kaspa-explorer"), null, List.of());

        var updated = state.withoutServices(List.of("kaspa-explorer"), Instant.EPOCH);

        assertEquals(List.of("timescaledb-explorer"), updated.services());
        assertEquals(state.selectedProfiles(), updated.selectedProfiles());
        assertEquals(Instant.EPOCH, updated.lastModified());
    }
}
