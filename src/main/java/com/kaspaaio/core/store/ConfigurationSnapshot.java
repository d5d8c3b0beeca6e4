package com.kaspaaio.core.store;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Metadata of an immutable backup, stored as {@code backup-metadata.json}.
 */
public record ConfigurationSnapshot(
    String id,
    Instant createdAt,
    String reason,
    Map<String, String> metadata,
    List<String> selectedProfiles,
    List<SnapshotFile> files,
    long totalSize
) {

    public ConfigurationSnapshot {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        selectedProfiles = selectedProfiles != null ? List.copyOf(selectedProfiles) : List.of();
        files = files != null ? List.copyOf(files) : List.of();
    }

    public boolean captured(String file) {
        return files.stream().anyMatch(f -> f.file().equals(file));
    }
}
