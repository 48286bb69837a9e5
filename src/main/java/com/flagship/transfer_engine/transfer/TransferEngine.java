package com.flagship.transfer_engine.transfer;

import com.flagship.transfer_engine.approval.Approval;
import com.flagship.transfer_engine.approval.ApprovalEntity;
import com.flagship.transfer_engine.approval.ApprovalRepository;
import com.flagship.transfer_engine.audit.AuditAction;
import com.flagship.transfer_engine.audit.AuditRecorder;
import com.flagship.transfer_engine.audit.RequestMetadata;
import com.flagship.transfer_engine.observability.CorrelationContext;
import com.flagship.transfer_engine.observability.TransferMetrics;
import com.flagship.transfer_engine.transfer.exception.TransferExecutionException;
import com.flagship.transfer_engine.transfer.exception.TransferValidationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Orchestrates transfer creation.
 *
 * One Initiate call is one atomic transaction:
 * 1. Validate (amount, same account, source balance under row lock, destination)
 * 2. Persist the transfer, record TRANSFER_INITIATED and TRANSFER_VALIDATED
 * 3. Above the threshold: persist a PENDING approval and record TRANSFER_AWAITING_APPROVAL
 * 4. Otherwise: run the {@link ExecutionRoutine} inline
 *
 * A validation failure leaves nothing behind. An execution failure rolls the attempt
 * back, then the transfer is committed as FAILED and the failure is re-raised.
 */
@Service
@Slf4j
public class TransferEngine {

    private final TransferValidator transferValidator;
    private final TransferRepository transferRepository;
    private final ApprovalRepository approvalRepository;
    private final ExecutionRoutine executionRoutine;
    private final TransferFailureRecorder failureRecorder;
    private final AuditRecorder auditRecorder;
    private final TransactionTemplate transactionTemplate;
    private final TransferMetrics transferMetrics;
    private final BigDecimal approvalThreshold;

    public TransferEngine(TransferValidator transferValidator,
                          TransferRepository transferRepository,
                          ApprovalRepository approvalRepository,
                          ExecutionRoutine executionRoutine,
                          TransferFailureRecorder failureRecorder,
                          AuditRecorder auditRecorder,
                          TransactionTemplate transactionTemplate,
                          TransferMetrics transferMetrics,
                          @Value("${transfer.approval-threshold:1000000.00}") BigDecimal approvalThreshold) {
        this.transferValidator = transferValidator;
        this.transferRepository = transferRepository;
        this.approvalRepository = approvalRepository;
        this.executionRoutine = executionRoutine;
        this.failureRecorder = failureRecorder;
        this.auditRecorder = auditRecorder;
        this.transactionTemplate = transactionTemplate;
        this.transferMetrics = transferMetrics;
        this.approvalThreshold = approvalThreshold;
    }

    public BigDecimal getApprovalThreshold() {
        return approvalThreshold;
    }

    /**
     * Initiates a transfer.
     *
     * @return the transfer as committed: COMPLETED, or AWAITING_APPROVAL when above the threshold
     * @throws TransferValidationException if a business rule rejects the transfer; nothing is persisted
     * @throws TransferExecutionException if the money movement failed; the transfer is persisted as FAILED
     */
    public Transfer initiate(UUID fromAccountId, UUID toAccountId, BigDecimal amount, UUID actorId,
                             String description, RequestMetadata metadata) {
        long startTime = System.currentTimeMillis();
        Transfer transfer = Transfer.create(UUID.randomUUID(), fromAccountId, toAccountId, amount,
                actorId, description, approvalThreshold);
        MDC.put(CorrelationContext.TRANSFER_ID_MDC_KEY, transfer.getId().toString());

        log.info("Initiating transfer: from={}, to={}, amount={}, actor={}",
                fromAccountId, toAccountId, amount, actorId);

        try {
            Transfer result = transactionTemplate.execute(status -> {
                transferValidator.validate(fromAccountId, toAccountId, amount);
                return persistAndRoute(transfer, metadata);
            });

            transferMetrics.recordTransferInitiated(result.getStatus().name());
            log.info("Transfer initiated: status={}, requiresApproval={}",
                    result.getStatus(), result.isRequiresApproval());
            return result;

        } catch (TransferValidationException e) {
            transferMetrics.recordTransferInitiated("rejected_validation");
            log.warn("Transfer rejected by validation: reason={}, message={}", e.getReason(), e.getMessage());
            throw e;

        } catch (TransferExecutionException e) {
            failureRecorder.recordInitiationFailure(transfer, e.getMessage(), metadata);
            transferMetrics.recordTransferInitiated(TransferStatus.FAILED.name());
            transferMetrics.recordExecutionFailure("initiate");
            throw e;

        } finally {
            transferMetrics.recordLatency("initiate", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.TRANSFER_ID_MDC_KEY);
        }
    }

    private Transfer persistAndRoute(Transfer transfer, RequestMetadata metadata) {
        transferRepository.saveAndFlush(TransferEntity.fromDomain(transfer));

        UUID actorId = transfer.getInitiatedBy();
        auditRecorder.record(AuditAction.TRANSFER_INITIATED, actorId, transfer.getId(),
                transfer.getFromAccountId(), TransferAuditDetails.initiated(transfer), metadata);
        auditRecorder.record(AuditAction.TRANSFER_VALIDATED, actorId, transfer.getId(),
                transfer.getFromAccountId(), TransferAuditDetails.validated(), metadata);

        if (transfer.isRequiresApproval()) {
            approvalRepository.save(ApprovalEntity.fromDomain(Approval.pending(UUID.randomUUID(), transfer.getId())));
            auditRecorder.record(AuditAction.TRANSFER_AWAITING_APPROVAL, actorId, transfer.getId(),
                    TransferAuditDetails.awaitingApproval(transfer.getAmount(), approvalThreshold), metadata);
            log.info("Transfer parked for approval: amount={}, threshold={}", transfer.getAmount(), approvalThreshold);
            return transfer;
        }

        return executionRoutine.execute(transfer.getId(), metadata);
    }
}
