package com.flagship.transfer_engine.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the append-only audit_records table.
 *
 * Marked {@link Immutable} so Hibernate never issues an UPDATE for it; the
 * database trigger rejects UPDATE and DELETE from any other path.
 */
@Entity
@Immutable
@Table(name = "audit_records")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuditRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 64)
    private AuditAction action;

    @Column(name = "actor_id", updatable = false)
    private UUID actorId;

    @Column(name = "transfer_id", updatable = false)
    private UUID transferId;

    @Column(name = "account_id", updatable = false)
    private UUID accountId;

    @Column(name = "details", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String details;

    @Column(name = "origin_address", updatable = false, length = 64)
    private String originAddress;

    @Column(name = "client_info", updatable = false, columnDefinition = "TEXT")
    private String clientInfo;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static AuditRecordEntity create(AuditAction action, UUID actorId, UUID transferId, UUID accountId,
                                    String detailsJson, RequestMetadata metadata) {
        return new AuditRecordEntity(
            null,  // id - generated on persist
            null,  // sequenceNumber - assigned by the database
            action,
            actorId,
            transferId,
            accountId,
            detailsJson,
            metadata.getOriginAddress(),
            metadata.getClientInfo(),
            null   // createdAt - set by @PrePersist
        );
    }
}
