package com.flagship.transfer_engine.approval;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the approvals table. One row per transfer that requires approval.
 */
@Entity
@Table(name = "approvals")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApprovalEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "transfer_id", nullable = false, updatable = false, unique = true)
    private UUID transferId;

    @Column(name = "assigned_to")
    private UUID assignedTo;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ApprovalStatus status;

    @Column(name = "decision_notes", columnDefinition = "TEXT")
    private String decisionNotes;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public static ApprovalEntity fromDomain(Approval approval) {
        return new ApprovalEntity(
            approval.getId(),
            approval.getTransferId(),
            approval.getAssignedTo(),
            approval.getStatus(),
            approval.getDecisionNotes(),
            approval.getDecidedAt(),
            approval.getCreatedAt(),
            null  // updatedAt - set by @PrePersist
        );
    }

    public Approval toDomain() {
        return Approval.builder()
            .id(id)
            .transferId(transferId)
            .assignedTo(assignedTo)
            .status(status)
            .decisionNotes(decisionNotes)
            .decidedAt(decidedAt)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Only the decision fields change after creation.
     */
    public void updateFromDomain(Approval approval) {
        this.assignedTo = approval.getAssignedTo();
        this.status = approval.getStatus();
        this.decisionNotes = approval.getDecisionNotes();
        this.decidedAt = approval.getDecidedAt();
    }
}
