package com.kaspaaio.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while the installation is being changed, used for SSE streaming
 * and CLI progress output.
 *
 * @param eventType        e.g. "reconciliation.started", "service.deployed"
 * @param reconciliationId the run this event belongs to
 * @param service          the service this event relates to (nullable for run-level events)
 * @param payload          arbitrary key-value data associated with the event
 * @param timestamp        when the event occurred
 */
public record AioEvent(
    String eventType,
    String reconciliationId,
    String service,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String STARTED = "reconciliation.started";
    public static final String PHASE = "reconciliation.phase";
    public static final String SERVICE_DEPLOYED = "service.deployed";
    public static final String SERVICE_REMOVED = "service.removed";
    public static final String COMMITTED = "reconciliation.committed";
    public static final String ROLLED_BACK = "reconciliation.rolled_back";
    public static final String FAILED = "reconciliation.failed";
}
