package com.kaspaaio.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for installation changes.
 */
@Service
public class AioMetrics {

    private final MeterRegistry registry;

    public AioMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordReconciliation(String status, long ms) {
        Counter.builder("kaspa_aio.reconciliations.total")
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("kaspa_aio.reconciliation.duration")
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param operation "deploy", "remove", "start", "stop" or "restart"
     */
    public void recordServiceOperation(String operation, boolean success, long ms) {
        Timer.builder("kaspa_aio.service.operation.duration")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRollback(boolean success) {
        Counter.builder("kaspa_aio.rollbacks.total")
                .description("Rollbacks after a failed apply")
                .tag("result", success ? "restored" : "manual_recovery")
                .register(registry)
                .increment();
    }

    public void recordChangeSize(int servicesTouched) {
        DistributionSummary.builder("kaspa_aio.reconciliation.services_touched")
                .description("Services added, removed or changed per reconciliation")
                .register(registry)
                .record(servicesTouched);
    }

    public void recordBackup(String operation) {
        Counter.builder("kaspa_aio.backups.total")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}
