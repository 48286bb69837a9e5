package com.flagship.transfer_engine.transfer;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Transfer domain object with an explicit state machine.
 *
 * - Status transitions are explicit and validated; invalid ones throw IllegalStateException
 * - Each transition returns a new instance
 * - requiresApproval is fixed at creation and never recomputed
 */
@Value
@Builder(toBuilder = true)
public class Transfer {
    UUID id;
    UUID fromAccountId;
    UUID toAccountId;
    BigDecimal amount;
    TransferStatus status;
    UUID initiatedBy;
    UUID approvedBy;
    Instant approvedAt;
    boolean requiresApproval;
    String description;
    String errorMessage;
    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;

    /**
     * Creates a new transfer. Amounts strictly above the threshold are parked as
     * AWAITING_APPROVAL; everything else starts PENDING and executes immediately.
     */
    public static Transfer create(UUID id, UUID fromAccountId, UUID toAccountId, BigDecimal amount,
                                  UUID initiatedBy, String description, BigDecimal approvalThreshold) {
        boolean requiresApproval = amount != null && amount.compareTo(approvalThreshold) > 0;
        Instant now = Instant.now();
        return Transfer.builder()
            .id(id)
            .fromAccountId(fromAccountId)
            .toAccountId(toAccountId)
            .amount(amount)
            .status(requiresApproval ? TransferStatus.AWAITING_APPROVAL : TransferStatus.PENDING)
            .initiatedBy(initiatedBy)
            .requiresApproval(requiresApproval)
            .description(description)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * AWAITING_APPROVAL -> APPROVED, recording the approver.
     */
    public Transfer approve(UUID approverId) {
        requireTransition(TransferStatus.APPROVED, "approve");
        Instant now = Instant.now();
        return toBuilder()
            .status(TransferStatus.APPROVED)
            .approvedBy(approverId)
            .approvedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * AWAITING_APPROVAL -> REJECTED. The reviewer is recorded in the approver fields.
     */
    public Transfer reject(UUID approverId) {
        requireTransition(TransferStatus.REJECTED, "reject");
        Instant now = Instant.now();
        return toBuilder()
            .status(TransferStatus.REJECTED)
            .approvedBy(approverId)
            .approvedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * PENDING or APPROVED -> COMPLETED.
     */
    public Transfer complete() {
        requireTransition(TransferStatus.COMPLETED, "complete");
        Instant now = Instant.now();
        return toBuilder()
            .status(TransferStatus.COMPLETED)
            .completedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * PENDING or APPROVED -> FAILED, keeping the failure's message.
     */
    public Transfer fail(String errorMessage) {
        requireTransition(TransferStatus.FAILED, "fail");
        return toBuilder()
            .status(TransferStatus.FAILED)
            .errorMessage(errorMessage)
            .updatedAt(Instant.now())
            .build();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isInitiatedBy(UUID actorId) {
        return initiatedBy != null && initiatedBy.equals(actorId);
    }

    /**
     * Checks if a transition from the current status to the target is allowed.
     */
    public boolean canTransitionTo(TransferStatus target) {
        return switch (status) {
            case PENDING -> target == TransferStatus.COMPLETED || target == TransferStatus.FAILED;
            case AWAITING_APPROVAL -> target == TransferStatus.APPROVED || target == TransferStatus.REJECTED;
            case APPROVED -> target == TransferStatus.COMPLETED || target == TransferStatus.FAILED;
            case REJECTED, COMPLETED, FAILED -> false;
        };
    }

    private void requireTransition(TransferStatus target, String operation) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException(String.format(
                "Cannot %s transfer %s in %s status (%s -> %s is not allowed)",
                operation, id, status, status, target));
        }
    }
}
