package com.flagship.transfer_engine.approval;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Review record for a transfer above the approval threshold.
 * Created PENDING together with its transfer and decided exactly once.
 */
@Value
@Builder(toBuilder = true)
public class Approval {
    UUID id;
    UUID transferId;
    UUID assignedTo;
    ApprovalStatus status;
    String decisionNotes;
    Instant decidedAt;
    Instant createdAt;
    Instant updatedAt;

    public static Approval pending(UUID id, UUID transferId) {
        Instant now = Instant.now();
        return Approval.builder()
            .id(id)
            .transferId(transferId)
            .status(ApprovalStatus.PENDING)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * PENDING -> APPROVED or REJECTED. The reviewer becomes the assignee.
     */
    public Approval decide(UUID reviewerId, ApprovalDecision decision, String notes) {
        if (status != ApprovalStatus.PENDING) {
            throw new IllegalStateException(String.format(
                "Cannot decide approval %s in %s status. Only PENDING approvals can be decided.",
                id, status));
        }
        Instant now = Instant.now();
        return toBuilder()
            .assignedTo(reviewerId)
            .status(decision.toStatus())
            .decisionNotes(notes)
            .decidedAt(now)
            .updatedAt(now)
            .build();
    }
}
