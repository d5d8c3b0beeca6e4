package com.kaspaaio.core.engine;

/**
 * Lifecycle of one reconciliation run.
 */
public enum ReconciliationState {
    IDLE,
    VALIDATING,
    SNAPSHOTTING,
    GENERATING,
    DIFFING,
    APPLYING,
    COMMITTED,
    ROLLED_BACK,
    /** Rejected before anything was changed. */
    FAILED,
    /** Apply failed and so did the rollback; the operator must restore a backup by hand. */
    MANUAL_RECOVERY_REQUIRED;

    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK || this == FAILED || this == MANUAL_RECOVERY_REQUIRED;
    }
}
