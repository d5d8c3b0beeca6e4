package com.kaspaaio.core.validation;

import com.kaspaaio.core.catalog.ResourceRequirements;

import java.util.List;
import java.util.Map;

/**
 * Outcome of validating a profile selection. Derived and never persisted.
 *
 * @param valid             true when there are no errors; warnings never affect validity
 * @param errors            blocking issues
 * @param warnings          informational issues (legacy migration, resources, recommendations)
 * @param resolvedProfiles  dependency-closed selection of known profiles, canonical IDs only
 * @param startupPlan       services of the resolved selection in start order
 * @param resources         summed requirements of the resolved selection
 * @param migratedFrom      legacy ID mapped to the IDs that replaced it
 */
public record ValidationResult(
    boolean valid,
    List<ValidationIssue> errors,
    List<ValidationIssue> warnings,
    List<String> resolvedProfiles,
    StartupPlan startupPlan,
    ResourceRequirements resources,
    Map<String, List<String>> migratedFrom
) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        resolvedProfiles = List.copyOf(resolvedProfiles);
        migratedFrom = Map.copyOf(migratedFrom);
    }

    public List<ValidationIssue> errorsOf(IssueCode code) {
        return errors.stream().filter(e -> e.is(code)).toList();
    }

    public List<ValidationIssue> warningsOf(IssueCode code) {
        return warnings.stream().filter(w -> w.is(code)).toList();
    }
}
