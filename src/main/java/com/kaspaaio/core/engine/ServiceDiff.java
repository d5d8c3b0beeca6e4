package com.kaspaaio.core.engine;

import com.kaspaaio.core.config.ComposeDocument;
import com.kaspaaio.core.config.ComposeService;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * What applying a new compose document changes relative to the one on disk.
 * A service is changed when any field of its compose block differs, which includes
 * the environment values it receives.
 *
 * @param changedKeys environment keys added, removed or given a new value
 */
public record ServiceDiff(
    List<String> added,
    List<String> removed,
    List<String> changed,
    List<String> unchanged,
    List<String> changedKeys
) {

    public ServiceDiff {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        changed = List.copyOf(changed);
        unchanged = List.copyOf(unchanged);
        changedKeys = List.copyOf(changedKeys);
    }

    public static ServiceDiff empty() {
        return new ServiceDiff(List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public static ServiceDiff between(ComposeDocument from, ComposeDocument to,
                                      Map<String, String> envFrom, Map<String, String> envTo) {
        var added = new ArrayList<String>();
        var changed = new ArrayList<String>();
        var unchanged = new ArrayList<String>();
        for (var entry : to.services().entrySet()) {
            ComposeService before = from.services().get(entry.getKey());
            if (before == null) {
                added.add(entry.getKey());
            } else if (before.equals(entry.getValue())) {
                unchanged.add(entry.getKey());
            } else {
                changed.add(entry.getKey());
            }
        }
        var removed = from.services().keySet().stream()
                .filter(name -> !to.services().containsKey(name))
                .toList();

        return new ServiceDiff(added, removed, changed, unchanged, changedKeys(envFrom, envTo));
    }

    public static List<String> changedKeys(Map<String, String> envFrom, Map<String, String> envTo) {
        var keys = new TreeSet<>(envFrom.keySet());
        keys.addAll(envTo.keySet());
        return keys.stream()
                .filter(k -> !Objects.equals(envFrom.get(k), envTo.get(k)))
                .toList();
    }

    public boolean hasServiceChanges() {
        return !added.isEmpty() || !removed.isEmpty() || !changed.isEmpty();
    }

    public int touched() {
        return added.size() + removed.size() + changed.size();
    }
}
