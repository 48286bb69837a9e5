package com.flagship.transfer_engine.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Append-only repository for audit records. Only inserts and reads are used.
 */
@Repository
public interface AuditRecordRepository extends JpaRepository<AuditRecordEntity, UUID> {

    /**
     * Full history of one transfer in the order it was written.
     */
    List<AuditRecordEntity> findByTransferIdOrderBySequenceNumberAsc(UUID transferId);

    long countByTransferId(UUID transferId);
}
