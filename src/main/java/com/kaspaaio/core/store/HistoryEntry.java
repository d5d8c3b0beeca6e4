package com.kaspaaio.core.store;

import java.time.Instant;
import java.util.List;

/**
 * One committed change to the installation. Entries are appended, never rewritten.
 *
 * @param action           "install", "reconfigure", "remove-profile" or "restore"
 * @param reconciliationId the run that produced the change
 * @param snapshotId       backup taken before the change; restoring it undoes the change
 * @param profiles         selection after the change
 * @param changedKeys      environment keys added, removed or changed
 */
public record HistoryEntry(
    String action,
    Instant timestamp,
    String reconciliationId,
    String snapshotId,
    List<String> profiles,
    List<String> addedServices,
    List<String> removedServices,
    List<String> changedServices,
    List<String> changedKeys
) {

    public HistoryEntry {
        profiles = copy(profiles);
        addedServices = copy(addedServices);
        removedServices = copy(removedServices);
        changedServices = copy(changedServices);
        changedKeys = copy(changedKeys);
    }

    private static List<String> copy(List<String> values) {
        return values != null ? List.copyOf(values) : List.of();
    }
}
