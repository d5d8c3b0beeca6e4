package com.kaspaaio.core.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.kaspaaio.core.error.AioError;

import java.time.Instant;
import java.util.List;

/**
 * Result of a reconciliation run, or a view of one still in progress.
 *
 * @param snapshotId backup taken before any change; {@code null} if the run failed earlier
 * @param diff       service and key changes; empty if the run never reached diffing
 * @param progress   state transitions in the order they happened
 */
public record ReconciliationOutcome(
    String id,
    ReconciliationState status,
    List<String> resolvedProfiles,
    String snapshotId,
    ServiceDiff diff,
    List<AioError> errors,
    List<String> warnings,
    List<Step> progress
) {

    public ReconciliationOutcome {
        resolvedProfiles = resolvedProfiles != null ? List.copyOf(resolvedProfiles) : List.of();
        diff = diff != null ? diff : ServiceDiff.empty();
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        progress = progress != null ? List.copyOf(progress) : List.of();
    }

    @JsonIgnore
    public boolean isCommitted() {
        return status == ReconciliationState.COMMITTED;
    }

    public record Step(ReconciliationState state, String message, Instant at) {}
}
