package com.kaspaaio.core.catalog;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Versioned table of deprecated profile IDs and the current IDs that replace them.
 *
 * <p>Every public entry point that accepts profile IDs passes them through
 * {@link #migrate(Collection)} once, so the validator, the generator and the
 * lifecycle manager never disagree about identity.
 */
public final class ProfileIdMigration {

    /** Bumped whenever an entry is added or changed. */
    public static final int VERSION = 2;

    private static final Map<String, List<String>> LEGACY_IDS = Map.of(
            "core", List.of("kaspa-node"),
            "kaspa-user-applications", List.of("kasia-app", "k-social-app"),
            "indexer-services", List.of("kasia-indexer", "k-indexer-bundle"),
            "archive-node", List.of("kaspa-archive-node"),
            "mining", List.of("kaspa-stratum")
    );

    private ProfileIdMigration() {}

    public static boolean isLegacy(String profileId) {
        return LEGACY_IDS.containsKey(profileId);
    }

    public static List<String> canonicalIdsFor(String profileId) {
        return LEGACY_IDS.getOrDefault(profileId, List.of(profileId));
    }

    public static Map<String, List<String>> table() {
        return LEGACY_IDS;
    }

    /**
     * Replaces legacy IDs with their current equivalents, preserving first-seen order
     * and removing duplicates. Blank entries are dropped.
     */
    public static Migration migrate(Collection<String> profileIds) {
        var canonical = new LinkedHashSet<String>();
        var migrated = new LinkedHashMap<String, List<String>>();
        if (profileIds != null) {
            for (String raw : profileIds) {
                if (raw == null || raw.isBlank()) continue;
                String id = raw.trim();
                List<String> replacements = LEGACY_IDS.get(id);
                if (replacements != null) {
                    migrated.put(id, replacements);
                    canonical.addAll(replacements);
                } else {
                    canonical.add(id);
                }
            }
        }
        return new Migration(List.copyOf(canonical), migrated);
    }

    /**
     * @param profileIds canonical IDs, deduplicated
     * @param migrated   legacy ID mapped to the IDs it was replaced with
     */
    public record Migration(List<String> profileIds, Map<String, List<String>> migrated) {

        public boolean hasMigrations() {
            return !migrated.isEmpty();
        }
    }
}
