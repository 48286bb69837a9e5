package com.flagship.transfer_engine.transfer;

import com.flagship.transfer_engine.audit.AuditDetail;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Detail payloads for the transfer lifecycle audit records.
 */
public final class TransferAuditDetails {

    private TransferAuditDetails() {
    }

    public static AuditDetail initiated(Transfer transfer) {
        return AuditDetail.builder()
            .put("from_account_id", transfer.getFromAccountId())
            .put("to_account_id", transfer.getToAccountId())
            .put("amount", transfer.getAmount())
            .put("requires_approval", transfer.isRequiresApproval())
            .build();
    }

    public static AuditDetail validated() {
        return AuditDetail.builder()
            .put("validation_passed", true)
            .build();
    }

    public static AuditDetail awaitingApproval(BigDecimal amount, BigDecimal threshold) {
        return AuditDetail.builder()
            .put("amount", amount)
            .put("threshold", threshold)
            .build();
    }

    public static AuditDetail completed(Transfer transfer) {
        return AuditDetail.builder()
            .put("from_account_id", transfer.getFromAccountId())
            .put("to_account_id", transfer.getToAccountId())
            .put("amount", transfer.getAmount())
            .build();
    }

    public static AuditDetail approved(UUID approverId, String notes) {
        return AuditDetail.builder()
            .put("approved_by", approverId)
            .put("notes", notes)
            .build();
    }

    public static AuditDetail rejected(UUID reviewerId, String notes) {
        return AuditDetail.builder()
            .put("rejected_by", reviewerId)
            .put("notes", notes)
            .build();
    }

    public static AuditDetail failed(String errorMessage) {
        return AuditDetail.builder()
            .put("error", errorMessage)
            .build();
    }
}
