package com.flagship.transfer_engine.approval;

import com.flagship.transfer_engine.audit.AuditAction;
import com.flagship.transfer_engine.audit.AuditRecorder;
import com.flagship.transfer_engine.audit.RequestMetadata;
import com.flagship.transfer_engine.observability.CorrelationContext;
import com.flagship.transfer_engine.observability.TransferMetrics;
import com.flagship.transfer_engine.transfer.BalanceValidator;
import com.flagship.transfer_engine.transfer.ExecutionRoutine;
import com.flagship.transfer_engine.transfer.Transfer;
import com.flagship.transfer_engine.transfer.TransferAuditDetails;
import com.flagship.transfer_engine.transfer.TransferEntity;
import com.flagship.transfer_engine.transfer.TransferFailureRecorder;
import com.flagship.transfer_engine.transfer.TransferRepository;
import com.flagship.transfer_engine.transfer.TransferStatus;
import com.flagship.transfer_engine.transfer.exception.TransferExecutionException;
import com.flagship.transfer_engine.transfer.exception.TransferValidationException;
import com.flagship.transfer_engine.transfer.exception.WorkflowException;
import com.flagship.transfer_engine.transfer.exception.WorkflowFailure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.UUID;

/**
 * Applies a reviewer's decision to a transfer awaiting approval.
 *
 * One Decide call is one atomic transaction:
 * 1. Load and lock the transfer (TRANSFER_NOT_FOUND)
 * 2. Require AWAITING_APPROVAL (NOT_AWAITING_APPROVAL)
 * 3. Require reviewer != initiator (SELF_APPROVAL_FORBIDDEN)
 * 4. Record the decision on the approval row
 * 5. APPROVED: re-check the source balance, mark APPROVED, execute
 * 6. REJECTED: mark REJECTED; nothing is executed
 *
 * The row lock in step 1 makes concurrent decisions on one transfer serialize;
 * the later one fails step 2.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApprovalProcessor {

    private final TransferRepository transferRepository;
    private final ApprovalRepository approvalRepository;
    private final BalanceValidator balanceValidator;
    private final ExecutionRoutine executionRoutine;
    private final TransferFailureRecorder failureRecorder;
    private final AuditRecorder auditRecorder;
    private final TransactionTemplate transactionTemplate;
    private final TransferMetrics transferMetrics;

    /**
     * @return the transfer after the decision: REJECTED or COMPLETED
     * @throws WorkflowException if the decision is not allowed; nothing changes
     * @throws TransferValidationException if the source can no longer cover an approved transfer; nothing changes
     * @throws TransferExecutionException if the approved transfer failed to execute; it is recorded as FAILED
     */
    public Transfer decide(UUID transferId, UUID approverId, ApprovalDecision decision, String notes,
                           RequestMetadata metadata) {
        if (decision == null) {
            throw new IllegalArgumentException("Decision is required");
        }
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.TRANSFER_ID_MDC_KEY, String.valueOf(transferId));

        log.info("Processing approval decision: decision={}, approver={}", decision, approverId);

        try {
            Transfer result = transactionTemplate.execute(status ->
                applyDecision(transferId, approverId, decision, notes, metadata));

            transferMetrics.recordApprovalDecision(decision.name(), result.getStatus().name());
            log.info("Approval decision applied: decision={}, status={}", decision, result.getStatus());
            return result;

        } catch (WorkflowException e) {
            transferMetrics.recordApprovalDecision(decision.name(), e.getReason().name());
            log.warn("Approval decision refused: reason={}, message={}", e.getReason(), e.getMessage());
            throw e;

        } catch (TransferValidationException e) {
            transferMetrics.recordApprovalDecision(decision.name(), e.getReason().name());
            log.warn("Approved transfer no longer valid: reason={}, message={}", e.getReason(), e.getMessage());
            throw e;

        } catch (TransferExecutionException e) {
            failureRecorder.recordApprovedExecutionFailure(transferId, approverId, notes, e.getMessage(), metadata);
            transferMetrics.recordApprovalDecision(decision.name(), TransferStatus.FAILED.name());
            transferMetrics.recordExecutionFailure("approval");
            throw e;

        } finally {
            transferMetrics.recordLatency("decide", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.TRANSFER_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public Optional<Approval> getApprovalByTransferId(UUID transferId) {
        return approvalRepository.findByTransferId(transferId).map(ApprovalEntity::toDomain);
    }

    private Transfer applyDecision(UUID transferId, UUID approverId, ApprovalDecision decision, String notes,
                                   RequestMetadata metadata) {
        TransferEntity transferEntity = transferRepository.findByIdForUpdate(transferId)
            .orElseThrow(() -> new WorkflowException(WorkflowFailure.TRANSFER_NOT_FOUND, transferId,
                "Transfer not found: " + transferId));
        Transfer transfer = transferEntity.toDomain();

        if (transfer.getStatus() != TransferStatus.AWAITING_APPROVAL) {
            throw new WorkflowException(WorkflowFailure.NOT_AWAITING_APPROVAL, transferId,
                "Transfer is not awaiting approval (status: " + transfer.getStatus() + ")");
        }
        if (transfer.isInitiatedBy(approverId)) {
            throw new WorkflowException(WorkflowFailure.SELF_APPROVAL_FORBIDDEN, transferId,
                "Cannot approve or reject your own transfer");
        }

        ApprovalEntity approvalEntity = approvalRepository.findByTransferId(transferId)
            .orElseThrow(() -> new IllegalStateException("Approval record missing for transfer " + transferId));

        if (decision == ApprovalDecision.APPROVED) {
            balanceValidator.check(transfer.getFromAccountId(), transfer.getToAccountId(), transfer.getAmount());
        }

        approvalEntity.updateFromDomain(approvalEntity.toDomain().decide(approverId, decision, notes));
        approvalRepository.save(approvalEntity);

        if (decision == ApprovalDecision.REJECTED) {
            Transfer rejected = transfer.reject(approverId);
            transferEntity.updateFromDomain(rejected);
            transferRepository.saveAndFlush(transferEntity);
            auditRecorder.record(AuditAction.TRANSFER_REJECTED, approverId, transferId,
                TransferAuditDetails.rejected(approverId, notes), metadata);
            return rejected;
        }

        Transfer approved = transfer.approve(approverId);
        transferEntity.updateFromDomain(approved);
        transferRepository.saveAndFlush(transferEntity);
        auditRecorder.record(AuditAction.TRANSFER_APPROVED, approverId, transferId,
            TransferAuditDetails.approved(approverId, notes), metadata);

        return executionRoutine.execute(transferId, metadata);
    }
}
