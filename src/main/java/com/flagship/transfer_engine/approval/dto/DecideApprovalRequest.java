package com.flagship.transfer_engine.approval.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.transfer_engine.approval.ApprovalDecision;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class DecideApprovalRequest {

    @NotNull(message = "Decision is required (APPROVED or REJECTED)")
    @JsonProperty("decision")
    ApprovalDecision decision;

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    @JsonProperty("notes")
    String notes;
}
