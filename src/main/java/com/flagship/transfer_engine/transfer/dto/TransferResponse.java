package com.flagship.transfer_engine.transfer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.transfer_engine.approval.Approval;
import com.flagship.transfer_engine.approval.ApprovalStatus;
import com.flagship.transfer_engine.transfer.Transfer;
import com.flagship.transfer_engine.transfer.TransferDetails;
import com.flagship.transfer_engine.transfer.TransferStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransferResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("from_account_id")
    UUID fromAccountId;

    @JsonProperty("from_account_number")
    String fromAccountNumber;

    @JsonProperty("from_account_name")
    String fromAccountName;

    @JsonProperty("to_account_id")
    UUID toAccountId;

    @JsonProperty("to_account_number")
    String toAccountNumber;

    @JsonProperty("to_account_name")
    String toAccountName;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("status")
    TransferStatus status;

    @JsonProperty("initiated_by")
    UUID initiatedBy;

    @JsonProperty("approved_by")
    UUID approvedBy;

    @JsonProperty("approved_at")
    Instant approvedAt;

    @JsonProperty("requires_approval")
    boolean requiresApproval;

    @JsonProperty("description")
    String description;

    @JsonProperty("error_message")
    String errorMessage;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("approval")
    ApprovalView approval;

    public static TransferResponse from(Transfer transfer) {
        return baseBuilder(transfer).build();
    }

    public static TransferResponse from(TransferDetails details) {
        return baseBuilder(details.getTransfer())
            .fromAccountNumber(details.getFromAccount().getAccountNumber())
            .fromAccountName(details.getFromAccount().getAccountName())
            .toAccountNumber(details.getToAccount().getAccountNumber())
            .toAccountName(details.getToAccount().getAccountName())
            .approval(details.getApproval() != null ? ApprovalView.from(details.getApproval()) : null)
            .build();
    }

    private static TransferResponseBuilder baseBuilder(Transfer transfer) {
        return TransferResponse.builder()
            .id(transfer.getId())
            .fromAccountId(transfer.getFromAccountId())
            .toAccountId(transfer.getToAccountId())
            .amount(transfer.getAmount())
            .status(transfer.getStatus())
            .initiatedBy(transfer.getInitiatedBy())
            .approvedBy(transfer.getApprovedBy())
            .approvedAt(transfer.getApprovedAt())
            .requiresApproval(transfer.isRequiresApproval())
            .description(transfer.getDescription())
            .errorMessage(transfer.getErrorMessage())
            .createdAt(transfer.getCreatedAt())
            .updatedAt(transfer.getUpdatedAt())
            .completedAt(transfer.getCompletedAt());
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ApprovalView {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("status")
        ApprovalStatus status;

        @JsonProperty("assigned_to")
        UUID assignedTo;

        @JsonProperty("decision_notes")
        String decisionNotes;

        @JsonProperty("decided_at")
        Instant decidedAt;

        @JsonProperty("created_at")
        Instant createdAt;

        public static ApprovalView from(Approval approval) {
            return ApprovalView.builder()
                .id(approval.getId())
                .status(approval.getStatus())
                .assignedTo(approval.getAssignedTo())
                .decisionNotes(approval.getDecisionNotes())
                .decidedAt(approval.getDecidedAt())
                .createdAt(approval.getCreatedAt())
                .build();
        }
    }
}
