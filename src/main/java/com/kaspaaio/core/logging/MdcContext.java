package com.kaspaaio.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing installer-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RECONCILIATION_ID = "reconciliationId";
    public static final String PHASE = "phase";
    public static final String SERVICE = "service";

    private MdcContext() {}

    public static void setReconciliation(String reconciliationId) {
        MDC.put(RECONCILIATION_ID, reconciliationId);
    }

    public static void setPhase(String reconciliationId, String phase) {
        MDC.put(RECONCILIATION_ID, reconciliationId);
        MDC.put(PHASE, phase);
    }

    public static void setService(String reconciliationId, String service) {
        MDC.put(RECONCILIATION_ID, reconciliationId);
        MDC.put(SERVICE, service);
    }

    public static void clear() {
        MDC.remove(RECONCILIATION_ID);
        MDC.remove(PHASE);
        MDC.remove(SERVICE);
    }
}
