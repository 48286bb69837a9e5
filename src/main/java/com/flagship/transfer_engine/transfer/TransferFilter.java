package com.flagship.transfer_engine.transfer;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Optional criteria for listing transfers. accountId matches either leg.
 */
@Value
@Builder
public class TransferFilter {
    UUID accountId;
    UUID initiatedBy;
    TransferStatus status;
    Instant from;
    Instant to;

    public static TransferFilter none() {
        return TransferFilter.builder().build();
    }
}
