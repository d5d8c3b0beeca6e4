package com.kaspaaio.core.store;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Key-by-key comparison of two snapshots. Service-level changes use keys of the form
 * {@code service:<name>}.
 */
public record SnapshotDiff(String fromId, String toId, List<Change> changes) {

    public SnapshotDiff {
        changes = List.copyOf(changes);
    }

    @JsonProperty("changeCount")
    public int changeCount() {
        return changes.size();
    }

    public enum ChangeType { ADDED, REMOVED, CHANGED }

    public record Change(String key, ChangeType type, String oldValue, String newValue) {}
}
