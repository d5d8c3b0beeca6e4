package com.kaspaaio.core.error;

/**
 * Closed taxonomy of failures surfaced to operators.
 */
public enum ErrorKind {
    /** Cycle, missing prerequisite, conflict, invalid profile, schema or port-range violation. */
    VALIDATION,
    /** Backup or restore I/O failure. */
    STORAGE,
    /** Container start/stop/build failure. */
    ENGINE,
    /** Overlapping reconfiguration. */
    CONCURRENCY
}
