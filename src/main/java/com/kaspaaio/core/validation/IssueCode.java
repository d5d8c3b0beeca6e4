package com.kaspaaio.core.validation;

import java.util.Locale;

/**
 * Stable, machine-readable codes for validation errors and warnings.
 */
public enum IssueCode {
    EMPTY_SELECTION,
    INVALID_PROFILE,
    CIRCULAR_DEPENDENCY,
    MISSING_DEPENDENCY,
    MISSING_PREREQUISITE,
    PROFILE_CONFLICT,
    PORT_CONFLICT,
    PROFILE_NOT_INSTALLED,
    REMOVAL_BLOCKED,
    LAST_PROFILE,

    LEGACY_PROFILE_MIGRATED,
    MISSING_RECOMMENDED,
    MODERATE_CPU,
    MODERATE_MEMORY,
    MODERATE_DISK,
    HIGH_CPU,
    HIGH_MEMORY,
    HIGH_DISK;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
