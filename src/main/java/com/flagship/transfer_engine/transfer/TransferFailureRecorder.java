package com.flagship.transfer_engine.transfer;

import com.flagship.transfer_engine.approval.Approval;
import com.flagship.transfer_engine.approval.ApprovalDecision;
import com.flagship.transfer_engine.approval.ApprovalEntity;
import com.flagship.transfer_engine.approval.ApprovalRepository;
import com.flagship.transfer_engine.audit.AuditAction;
import com.flagship.transfer_engine.audit.AuditDetail;
import com.flagship.transfer_engine.audit.AuditRecorder;
import com.flagship.transfer_engine.audit.RequestMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Commits the FAILED outcome of an execution attempt after that attempt has rolled back.
 *
 * Balances are never touched here. Each method runs in its own transaction,
 * so the failure survives regardless of what happened to the money movement.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransferFailureRecorder {

    private final TransferRepository transferRepository;
    private final ApprovalRepository approvalRepository;
    private final AuditRecorder auditRecorder;

    /**
     * Auto-execute path: the transfer row did not survive the rollback, so it is written
     * directly as FAILED together with its initiation trail.
     *
     * @param attempt the PENDING transfer that was being executed
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Transfer recordInitiationFailure(Transfer attempt, String errorMessage, RequestMetadata metadata) {
        Transfer failed = attempt.fail(errorMessage);
        transferRepository.saveAndFlush(TransferEntity.fromDomain(failed));

        UUID actorId = attempt.getInitiatedBy();
        auditRecorder.record(AuditAction.TRANSFER_INITIATED, actorId, attempt.getId(), attempt.getFromAccountId(),
            TransferAuditDetails.initiated(attempt), metadata);
        auditRecorder.record(AuditAction.TRANSFER_VALIDATED, actorId, attempt.getId(), attempt.getFromAccountId(),
            TransferAuditDetails.validated(), metadata);
        auditRecorder.record(AuditAction.TRANSFER_FAILED, actorId, attempt.getId(),
            TransferAuditDetails.failed(errorMessage), metadata);

        log.warn("Recorded failed transfer: error={}", errorMessage);
        return failed;
    }

    /**
     * Approval path: the decision is kept (APPROVED) and the transfer moves on to FAILED.
     * Writes nothing when another decision already moved the transfer out of AWAITING_APPROVAL.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<Transfer> recordApprovedExecutionFailure(UUID transferId, UUID approverId, String notes,
                                                             String errorMessage, RequestMetadata metadata) {
        Optional<TransferEntity> found = transferRepository.findByIdForUpdate(transferId);
        if (found.isEmpty() || found.get().getStatus() != TransferStatus.AWAITING_APPROVAL) {
            log.warn("Skipped failure recording, transfer no longer awaiting approval: transferId={}", transferId);
            return Optional.empty();
        }

        TransferEntity entity = found.get();
        Transfer failed = entity.toDomain().approve(approverId).fail(errorMessage);
        entity.updateFromDomain(failed);
        transferRepository.saveAndFlush(entity);

        approvalRepository.findByTransferId(transferId).ifPresent(approvalEntity -> {
            Approval decided = approvalEntity.toDomain().decide(approverId, ApprovalDecision.APPROVED, notes);
            approvalEntity.updateFromDomain(decided);
            approvalRepository.save(approvalEntity);
        });

        auditRecorder.record(AuditAction.TRANSFER_APPROVED, approverId, transferId,
            TransferAuditDetails.approved(approverId, notes), metadata);
        auditRecorder.record(AuditAction.TRANSFER_FAILED, failed.getInitiatedBy(), transferId,
            TransferAuditDetails.failed(errorMessage), metadata);

        log.warn("Recorded failed approved transfer: error={}", errorMessage);
        return Optional.of(failed);
    }
}
