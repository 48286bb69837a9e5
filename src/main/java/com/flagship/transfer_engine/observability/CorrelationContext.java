package com.flagship.transfer_engine.observability;

import java.util.UUID;

/**
 * Header and MDC keys that tie log lines to one request and one transfer.
 *
 * The correlation id lives only in the MDC: {@link CorrelationIdFilter} sets it for
 * the request thread, and TransferEngine / ApprovalProcessor add the transfer id
 * for the duration of a single operation.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TRANSFER_ID_MDC_KEY = "transferId";

    private static final int MAX_CORRELATION_ID_LENGTH = 64;

    private CorrelationContext() {
    }

    /**
     * Uses the caller's id when it is usable, otherwise a short generated one.
     */
    public static String resolveCorrelationId(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return generateCorrelationId();
        }
        String trimmed = headerValue.trim();
        return trimmed.length() > MAX_CORRELATION_ID_LENGTH
            ? trimmed.substring(0, MAX_CORRELATION_ID_LENGTH)
            : trimmed;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
