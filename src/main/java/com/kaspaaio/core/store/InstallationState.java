package com.kaspaaio.core.store;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * What the operator asked for: the selected profiles, their configuration and the
 * services that were materialized, plus the append-only change history.
 */
public record InstallationState(
    InstallMode mode,
    List<String> selectedProfiles,
    Map<String, String> configuration,
    List<String> services,
    Instant lastModified,
    List<HistoryEntry> history
) {

    public InstallationState {
        mode = mode != null ? mode : InstallMode.INITIAL;
        selectedProfiles = selectedProfiles != null ? List.copyOf(selectedProfiles) : List.of();
        configuration = configuration != null ? new TreeMap<>(configuration) : new TreeMap<>();
        services = services != null ? List.copyOf(services) : List.of();
        history = history != null ? List.copyOf(history) : List.of();
    }

    public static InstallationState empty() {
        return new InstallationState(InstallMode.INITIAL, List.of(), Map.of(), List.of(), null, List.of());
    }

    @JsonIgnore
    public boolean isInstalled() {
        return !selectedProfiles.isEmpty();
    }

    /** A new state reflecting a committed change, with {@code entry} appended to the history. */
    public InstallationState commit(List<String> profiles, Map<String, String> newConfiguration,
                                    List<String> newServices, HistoryEntry entry) {
        var newHistory = new ArrayList<>(history);
        newHistory.add(entry);
        return new InstallationState(InstallMode.RECONFIGURE, profiles, newConfiguration, newServices,
                entry.timestamp(), newHistory);
    }

    public InstallationState withoutServices(List<String> removed, Instant now) {
        var remaining = new ArrayList<>(services);
        remaining.removeAll(removed);
        return new InstallationState(mode, selectedProfiles, configuration, remaining, now, history);
    }
}
