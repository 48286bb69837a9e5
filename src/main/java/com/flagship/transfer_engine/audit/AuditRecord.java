package com.flagship.transfer_engine.audit;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable audit event. Once written it is never updated or deleted.
 *
 * The sequence number is assigned by the store and orders records written
 * in the same transaction; it is null until the row has been flushed.
 */
@Value
public class AuditRecord {
    UUID id;
    Long sequenceNumber;
    AuditAction action;
    UUID actorId;
    UUID transferId;
    UUID accountId;
    AuditDetail detail;
    String originAddress;
    String clientInfo;
    Instant createdAt;
}
