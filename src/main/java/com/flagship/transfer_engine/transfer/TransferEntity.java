package com.flagship.transfer_engine.transfer;

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

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for transfer persistence.
 *
 * - No setters: state only changes through {@link #updateFromDomain(Transfer)}
 * - Account ids, amount, initiator and requires_approval are updatable = false
 * - fromDomain() is the only way to create instances
 */
@Entity
@Table(name = "transfers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransferEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "from_account_id", nullable = false, updatable = false)
    private UUID fromAccountId;

    @Column(name = "to_account_id", nullable = false, updatable = false)
    private UUID toAccountId;

    @Column(nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private TransferStatus status;

    @Column(name = "initiated_by", nullable = false, updatable = false)
    private UUID initiatedBy;

    @Column(name = "approved_by")
    private UUID approvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "requires_approval", nullable = false, updatable = false)
    private boolean requiresApproval;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String description;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

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

    public static TransferEntity fromDomain(Transfer transfer) {
        return new TransferEntity(
            transfer.getId(),
            transfer.getFromAccountId(),
            transfer.getToAccountId(),
            transfer.getAmount(),
            transfer.getStatus(),
            transfer.getInitiatedBy(),
            transfer.getApprovedBy(),
            transfer.getApprovedAt(),
            transfer.isRequiresApproval(),
            transfer.getDescription(),
            transfer.getErrorMessage(),
            transfer.getCreatedAt(),
            null, // updatedAt - set by @PrePersist
            transfer.getCompletedAt()
        );
    }

    public Transfer toDomain() {
        return Transfer.builder()
            .id(id)
            .fromAccountId(fromAccountId)
            .toAccountId(toAccountId)
            .amount(amount)
            .status(status)
            .initiatedBy(initiatedBy)
            .approvedBy(approvedBy)
            .approvedAt(approvedAt)
            .requiresApproval(requiresApproval)
            .description(description)
            .errorMessage(errorMessage)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .completedAt(completedAt)
            .build();
    }

    /**
     * Copies the mutable part of a transitioned domain object onto this entity.
     * Only status, approver, error and completion fields can change after creation.
     */
    public void updateFromDomain(Transfer transfer) {
        if (!id.equals(transfer.getId())) {
            throw new IllegalArgumentException(
                "Cannot update transfer " + id + " from domain object " + transfer.getId());
        }
        this.status = transfer.getStatus();
        this.approvedBy = transfer.getApprovedBy();
        this.approvedAt = transfer.getApprovedAt();
        this.errorMessage = transfer.getErrorMessage();
        this.completedAt = transfer.getCompletedAt();
    }
}
