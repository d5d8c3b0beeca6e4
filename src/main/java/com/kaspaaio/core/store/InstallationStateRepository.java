package com.kaspaaio.core.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kaspaaio.core.error.StorageException;
import com.kaspaaio.lifecycle.AioProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads and writes {@code installation-state.json}. Writes are atomic; callers other
 * than the reconciliation engine only read.
 */
@Component
public class InstallationStateRepository {

    private static final Logger log = LoggerFactory.getLogger(InstallationStateRepository.class);

    private final Path statePath;
    private final ObjectMapper mapper;

    @Autowired
    public InstallationStateRepository(AioProperties properties) {
        this(properties.getStatePath());
    }

    public InstallationStateRepository(Path statePath) {
        this.statePath = statePath;
        this.mapper = stateMapper();
    }

    static ObjectMapper stateMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path path() {
        return statePath;
    }

    public Optional<InstallationState> load() {
        try {
            Optional<String> json = AtomicFiles.readIfExists(statePath);
            if (json.isEmpty() || json.get().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(parse(json.get()));
        } catch (IOException e) {
            throw new StorageException("state_read_failed", "Cannot read installation state " + statePath, e);
        }
    }

    public InstallationState loadOrEmpty() {
        return load().orElseGet(InstallationState::empty);
    }

    public void save(InstallationState state) {
        try {
            AtomicFiles.write(statePath, serialize(state));
            log.debug("Saved installation state ({} profiles, {} history entries)",
                    state.selectedProfiles().size(), state.history().size());
        } catch (IOException e) {
            throw new StorageException("state_write_failed", "Cannot write installation state " + statePath, e);
        }
    }

    public InstallationState parse(String json) throws IOException {
        return mapper.readValue(json, InstallationState.class);
    }

    public String serialize(InstallationState state) throws IOException {
        return mapper.writeValueAsString(state) + "\n";
    }
}
