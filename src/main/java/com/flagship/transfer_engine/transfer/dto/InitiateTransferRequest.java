package com.flagship.transfer_engine.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request body for initiating a transfer.
 * Amount rules (positive, two decimal places) are enforced by the engine so they
 * surface with their validation reason.
 */
@Value
public class InitiateTransferRequest {

    @NotNull(message = "From account ID is required")
    @JsonProperty("from_account_id")
    UUID fromAccountId;

    @NotNull(message = "To account ID is required")
    @JsonProperty("to_account_id")
    UUID toAccountId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 1000, message = "Description must be at most 1000 characters")
    @JsonProperty("description")
    String description;
}
