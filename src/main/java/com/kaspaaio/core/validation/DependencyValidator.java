package com.kaspaaio.core.validation;

import com.kaspaaio.core.catalog.Profile;
import com.kaspaaio.core.catalog.ProfileCatalog;
import com.kaspaaio.core.catalog.ProfileIdMigration;
import com.kaspaaio.core.catalog.ResourceRequirements;
import com.kaspaaio.core.catalog.ServiceRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates profile selections against the {@link ProfileCatalog}.
 *
 * <p>Validation is read-only: it touches only the immutable catalog and the caller's
 * selection, so it may run while a reconciliation is in flight.
 *
 * <p>Checks, in order:
 * <ul>
 *   <li>empty selection and legacy ID migration</li>
 *   <li>unknown profile IDs (excluded from graph processing)</li>
 *   <li>dependency cycles reachable from the selection</li>
 *   <li>prerequisite OR-groups, after dependency closure</li>
 *   <li>profile-level and port-level conflicts</li>
 *   <li>resource totals (warnings only)</li>
 * </ul>
 */
@Service
public class DependencyValidator {

    private static final Logger log = LoggerFactory.getLogger(DependencyValidator.class);

    static final int MODERATE_CPU = 8;
    static final int HIGH_CPU = 16;
    static final int MODERATE_MEMORY_GB = 16;
    static final int HIGH_MEMORY_GB = 32;
    static final int MODERATE_DISK_GB = 1000;
    static final int HIGH_DISK_GB = 2000;

    private final ProfileCatalog catalog;

    public DependencyValidator(ProfileCatalog catalog) {
        this.catalog = catalog;
    }

    public ValidationResult validateSelection(Collection<String> profileIds) {
        var migration = ProfileIdMigration.migrate(profileIds);
        var errors = new ArrayList<ValidationIssue>();
        var warnings = new ArrayList<ValidationIssue>();

        migration.migrated().forEach((legacy, replacements) -> warnings.add(ValidationIssue.of(
                IssueCode.LEGACY_PROFILE_MIGRATED,
                "Profile '" + legacy + "' is deprecated and was replaced by " + String.join(", ", replacements),
                "Select " + String.join(", ", replacements) + " directly",
                Map.of("legacyId", legacy, "replacedBy", replacements))));

        if (migration.profileIds().isEmpty()) {
            errors.add(ValidationIssue.of(IssueCode.EMPTY_SELECTION,
                    "No profiles selected", "Select at least one profile", Map.of()));
            return new ValidationResult(false, errors, warnings, List.of(), StartupPlan.empty(),
                    ResourceRequirements.NONE, migration.migrated());
        }

        var known = new ArrayList<String>();
        for (String id : migration.profileIds()) {
            if (catalog.contains(id)) {
                known.add(id);
            } else {
                errors.add(ValidationIssue.of(IssueCode.INVALID_PROFILE,
                        "Unknown profile: " + id,
                        "Choose one of: " + String.join(", ", catalog.ids()),
                        Map.of("profile", id)));
            }
        }

        errors.addAll(detectCycles(known));
        Set<String> resolved = closure(known, errors);

        errors.addAll(checkPrerequisites(resolved));
        warnings.addAll(checkRecommendations(resolved));
        errors.addAll(detectProfileConflicts(resolved));
        errors.addAll(detectPortConflicts(resolved));

        StartupPlan plan = startupPlan(resolved);
        ResourceRequirements resources = aggregateResources(resolved);
        warnings.addAll(resourceWarnings(resources));

        boolean valid = errors.isEmpty();
        log.debug("Validated selection {} -> resolved {} (valid={}, {} errors, {} warnings)",
                profileIds, resolved, valid, errors.size(), warnings.size());
        return new ValidationResult(valid, errors, warnings, List.copyOf(resolved), plan, resources,
                migration.migrated());
    }

    /**
     * Breadth-first closure over hard dependencies. Unknown IDs are dropped, so
     * applying the closure to its own result returns the same set.
     */
    public Set<String> resolveDependencies(Collection<String> profileIds) {
        var known = ProfileIdMigration.migrate(profileIds).profileIds().stream()
                .filter(catalog::contains)
                .toList();
        return closure(known, new ArrayList<>());
    }

    /**
     * Checks whether {@code profileId} can be removed from an installation that currently
     * has {@code currentProfiles}. The remaining selection must stay valid.
     */
    public ValidationResult validateRemoval(String profileId, Collection<String> currentProfiles) {
        List<String> current = ProfileIdMigration.migrate(currentProfiles).profileIds();
        List<String> targets = ProfileIdMigration.canonicalIdsFor(profileId);
        var errors = new ArrayList<ValidationIssue>();

        for (String target : targets) {
            if (!current.contains(target)) {
                errors.add(ValidationIssue.of(IssueCode.PROFILE_NOT_INSTALLED,
                        "Profile " + target + " is not installed", null, Map.of("profile", target)));
            }
        }
        var remaining = new ArrayList<>(current);
        remaining.removeAll(targets);
        if (errors.isEmpty() && remaining.isEmpty()) {
            errors.add(ValidationIssue.of(IssueCode.LAST_PROFILE,
                    "Cannot remove the last installed profile",
                    "Add another profile first or uninstall the stack", Map.of("profile", profileId)));
        }

        for (String id : remaining) {
            Profile dependent = catalog.find(id).orElse(null);
            if (dependent == null) continue;
            for (String target : targets) {
                if (dependent.dependencies().contains(target)) {
                    errors.add(removalBlocked(target, id, id + " depends on " + target));
                }
                if (dependent.prerequisites().contains(target)
                        && dependent.prerequisites().stream().noneMatch(remaining::contains)) {
                    errors.add(removalBlocked(target, id, id + " requires one of: "
                            + String.join(", ", dependent.prerequisites())));
                }
            }
        }

        if (!errors.isEmpty() || remaining.isEmpty()) {
            return new ValidationResult(false, errors, List.of(), remaining, StartupPlan.empty(),
                    ResourceRequirements.NONE, Map.of());
        }
        return validateSelection(remaining);
    }

    private static ValidationIssue removalBlocked(String target, String dependent, String reason) {
        return ValidationIssue.of(IssueCode.REMOVAL_BLOCKED,
                "Cannot remove " + target + ": " + reason,
                "Remove " + dependent + " first or install an alternative",
                Map.of("profile", target, "dependent", dependent));
    }

    private Set<String> closure(List<String> start, List<ValidationIssue> errors) {
        var resolved = new LinkedHashSet<String>();
        var queue = new ArrayDeque<>(start);
        var reportedMissing = new HashSet<String>();
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!resolved.add(id)) continue;
            for (String dep : catalog.get(id).dependencies()) {
                if (!catalog.contains(dep)) {
                    if (reportedMissing.add(id + "->" + dep)) {
                        errors.add(ValidationIssue.of(IssueCode.MISSING_DEPENDENCY,
                                id + " depends on unknown profile " + dep,
                                "Check the catalog definition of " + id,
                                Map.of("profile", id, "dependency", dep)));
                    }
                    continue;
                }
                if (!resolved.contains(dep)) {
                    queue.add(dep);
                }
            }
        }
        return resolved;
    }

    /**
     * Depth-first search with an explicit path stack. A dependency edge back onto the
     * stack closes a cycle; each cycle is reported once regardless of where it was entered.
     */
    List<ValidationIssue> detectCycles(List<String> start) {
        var issues = new ArrayList<ValidationIssue>();
        var done = new HashSet<String>();
        var seenCycles = new HashSet<List<String>>();
        for (String id : start) {
            dfs(id, new ArrayList<>(), new HashSet<>(), done, seenCycles, issues);
        }
        return issues;
    }

    private void dfs(String id, List<String> path, Set<String> onPath, Set<String> done,
                     Set<List<String>> seenCycles, List<ValidationIssue> issues) {
        if (done.contains(id)) return;
        path.add(id);
        onPath.add(id);
        for (String dep : catalog.get(id).dependencies()) {
            if (!catalog.contains(dep)) continue;
            if (onPath.contains(dep)) {
                List<String> cycle = List.copyOf(path.subList(path.indexOf(dep), path.size()));
                if (seenCycles.add(normalize(cycle))) {
                    String rendered = String.join(" -> ", cycle) + " -> " + dep;
                    issues.add(ValidationIssue.of(IssueCode.CIRCULAR_DEPENDENCY,
                            "Circular dependency: " + rendered,
                            "Remove one of the dependencies between " + String.join(", ", cycle),
                            Map.of("cycle", cycle)));
                }
            } else {
                dfs(dep, path, onPath, done, seenCycles, issues);
            }
        }
        path.remove(path.size() - 1);
        onPath.remove(id);
        done.add(id);
    }

    /** Rotates a cycle so it starts at its smallest member. */
    private static List<String> normalize(List<String> cycle) {
        int min = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i).compareTo(cycle.get(min)) < 0) min = i;
        }
        var rotated = new ArrayList<String>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            rotated.add(cycle.get((min + i) % cycle.size()));
        }
        return rotated;
    }

    private List<ValidationIssue> checkPrerequisites(Set<String> resolved) {
        var issues = new ArrayList<ValidationIssue>();
        for (String id : resolved) {
            List<String> group = catalog.get(id).prerequisites();
            if (!group.isEmpty() && group.stream().noneMatch(resolved::contains)) {
                issues.add(ValidationIssue.of(IssueCode.MISSING_PREREQUISITE,
                        id + " requires one of: " + String.join(", ", group),
                        "Add one of " + String.join(", ", group) + " to the selection",
                        Map.of("profile", id, "requiresOneOf", group)));
            }
        }
        return issues;
    }

    private List<ValidationIssue> checkRecommendations(Set<String> resolved) {
        var issues = new ArrayList<ValidationIssue>();
        for (String id : resolved) {
            List<String> group = catalog.get(id).recommends();
            if (!group.isEmpty() && group.stream().noneMatch(resolved::contains)) {
                issues.add(ValidationIssue.of(IssueCode.MISSING_RECOMMENDED,
                        id + " works best with one of: " + String.join(", ", group),
                        "Add one of " + String.join(", ", group)
                                + " or set REMOTE_KASPA_NODE_WRPC_URL to use a remote node",
                        Map.of("profile", id, "recommendsOneOf", group)));
            }
        }
        return issues;
    }

    private List<ValidationIssue> detectProfileConflicts(Set<String> resolved) {
        var issues = new ArrayList<ValidationIssue>();
        var seenPairs = new HashSet<String>();
        for (String id : resolved) {
            for (String other : catalog.get(id).conflicts()) {
                if (!resolved.contains(other)) continue;
                List<String> pair = sortedPair(id, other);
                if (seenPairs.add(pair.get(0) + "|" + pair.get(1))) {
                    issues.add(ValidationIssue.of(IssueCode.PROFILE_CONFLICT,
                            pair.get(0) + " conflicts with " + pair.get(1),
                            "Keep only one of " + pair.get(0) + " and " + pair.get(1),
                            Map.of("profiles", pair)));
                }
            }
        }
        return issues;
    }

    private List<ValidationIssue> detectPortConflicts(Set<String> resolved) {
        var owners = new LinkedHashMap<Integer, List<String>>();
        for (String id : resolved) {
            for (Integer port : new LinkedHashSet<>(catalog.get(id).ports())) {
                owners.computeIfAbsent(port, p -> new ArrayList<>()).add(id);
            }
        }
        var issues = new ArrayList<ValidationIssue>();
        owners.forEach((port, profiles) -> {
            for (int i = 0; i < profiles.size(); i++) {
                for (int j = i + 1; j < profiles.size(); j++) {
                    List<String> pair = sortedPair(profiles.get(i), profiles.get(j));
                    issues.add(ValidationIssue.of(IssueCode.PORT_CONFLICT,
                            "Port " + port + " is used by both " + pair.get(0) + " and " + pair.get(1),
                            "Remove one of the profiles or change its port setting",
                            Map.of("port", port, "profiles", pair)));
                }
            }
        });
        return issues;
    }

    private static List<String> sortedPair(String a, String b) {
        return a.compareTo(b) <= 0 ? List.of(a, b) : List.of(b, a);
    }

    /** Stable order: startup order first, then service name. */
    public StartupPlan startupPlan(Collection<String> resolved) {
        var services = new ArrayList<>(catalog.servicesFor(resolved));
        services.sort(Comparator.comparingInt(ServiceRef::startupOrder).thenComparing(ServiceRef::name));
        return new StartupPlan(services);
    }

    private ResourceRequirements aggregateResources(Set<String> resolved) {
        ResourceRequirements total = ResourceRequirements.NONE;
        for (String id : resolved) {
            total = total.plus(catalog.get(id).resources());
        }
        return total;
    }

    private List<ValidationIssue> resourceWarnings(ResourceRequirements total) {
        var issues = new ArrayList<ValidationIssue>();
        tier(issues, total.minCpu(), MODERATE_CPU, HIGH_CPU, IssueCode.MODERATE_CPU, IssueCode.HIGH_CPU,
                "CPU cores");
        tier(issues, total.minMemoryGb(), MODERATE_MEMORY_GB, HIGH_MEMORY_GB, IssueCode.MODERATE_MEMORY,
                IssueCode.HIGH_MEMORY, "GB of memory");
        tier(issues, total.minDiskGb(), MODERATE_DISK_GB, HIGH_DISK_GB, IssueCode.MODERATE_DISK,
                IssueCode.HIGH_DISK, "GB of disk");
        return issues;
    }

    private static void tier(List<ValidationIssue> issues, int value, int moderate, int high,
                             IssueCode moderateCode, IssueCode highCode, String unit) {
        if (value > high) {
            issues.add(ValidationIssue.of(highCode,
                    "Selection needs at least " + value + " " + unit,
                    "Verify the host meets the requirement or deselect heavy profiles",
                    Map.of("required", value, "threshold", high)));
        } else if (value > moderate) {
            issues.add(ValidationIssue.of(moderateCode,
                    "Selection needs " + value + " " + unit,
                    "Verify the host meets the requirement",
                    Map.of("required", value, "threshold", moderate)));
        }
    }
}
