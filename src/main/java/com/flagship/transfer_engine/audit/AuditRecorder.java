package com.flagship.transfer_engine.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Appends immutable audit records.
 *
 * Usage:
 * 1. Inside the engine, call {@link #record} from within the transfer transaction;
 *    the record commits or rolls back with the state change it documents.
 * 2. Outside a transaction (read-side views), the call runs in its own transaction.
 *
 * Never raises a business error: the only failures are storage failures, which propagate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditRecorder {

    private final AuditRecordRepository repository;
    private final AuditDetailCodec codec;

    @Transactional
    public AuditRecord record(AuditAction action, UUID actorId, UUID transferId, UUID accountId,
                              AuditDetail detail, RequestMetadata metadata) {
        if (action == null) {
            throw new IllegalArgumentException("Audit action is required");
        }
        AuditDetail payload = detail != null ? detail : AuditDetail.empty();
        RequestMetadata origin = metadata != null ? metadata : RequestMetadata.NONE;

        AuditRecordEntity entity = AuditRecordEntity.create(
            action, actorId, transferId, accountId, codec.encode(payload), origin);
        AuditRecordEntity saved = repository.save(entity);

        log.debug("Recorded audit event: action={}, actor={}, transferId={}, accountId={}",
                action, actorId, transferId, accountId);

        return new AuditRecord(
            saved.getId(),
            saved.getSequenceNumber(),
            saved.getAction(),
            saved.getActorId(),
            saved.getTransferId(),
            saved.getAccountId(),
            payload,
            saved.getOriginAddress(),
            saved.getClientInfo(),
            saved.getCreatedAt()
        );
    }

    public AuditRecord record(AuditAction action, UUID actorId, UUID transferId, AuditDetail detail,
                              RequestMetadata metadata) {
        return record(action, actorId, transferId, null, detail, metadata);
    }
}
