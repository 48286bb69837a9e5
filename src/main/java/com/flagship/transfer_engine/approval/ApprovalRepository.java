package com.flagship.transfer_engine.approval;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ApprovalRepository extends JpaRepository<ApprovalEntity, UUID> {

    Optional<ApprovalEntity> findByTransferId(UUID transferId);

    long countByTransferId(UUID transferId);

    long countByStatus(ApprovalStatus status);

    Optional<ApprovalEntity> findFirstByStatusOrderByCreatedAtAsc(ApprovalStatus status);
}
