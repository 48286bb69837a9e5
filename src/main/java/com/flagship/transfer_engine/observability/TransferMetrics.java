package com.flagship.transfer_engine.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for transfer operations.
 *
 * Metrics exposed:
 * - transfers.initiated: counter tagged by outcome (completed, awaiting_approval, rejected_validation, failed)
 * - transfers.decided: counter tagged by decision and outcome
 * - transfers.failed: counter of execution failures tagged by the path that ran them
 * - transfers.latency: timer tagged by operation (initiate, decide)
 */
@Component
public class TransferMetrics {

    private final MeterRegistry registry;

    public TransferMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransferInitiated(String outcome) {
        registry.counter("transfers.initiated",
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordApprovalDecision(String decision, String outcome) {
        registry.counter("transfers.decided",
                "decision", sanitizeTag(decision),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordExecutionFailure(String path) {
        registry.counter("transfers.failed",
                "path", sanitizeTag(path)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("transfers.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
