package com.flagship.transfer_engine.transfer;

import com.flagship.transfer_engine.account.AccountRepository;
import com.flagship.transfer_engine.audit.AuditAction;
import com.flagship.transfer_engine.audit.AuditRecorder;
import com.flagship.transfer_engine.audit.RequestMetadata;
import com.flagship.transfer_engine.transfer.exception.TransferExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Atomic balance mutation shared by the auto-execute and the approval paths.
 *
 * Runs inside the caller's transaction:
 * 1. Re-reads the transfer (must be PENDING or APPROVED)
 * 2. Debits the source, credits the destination
 * 3. Marks the transfer COMPLETED and records TRANSFER_COMPLETED
 *
 * Any failure is raised as {@link TransferExecutionException}; the caller rolls the
 * whole attempt back and records the FAILED status in a follow-up transaction.
 * Business rules are not re-checked here beyond what the store's constraints enforce.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExecutionRoutine {

    private final TransferRepository transferRepository;
    private final AccountRepository accountRepository;
    private final AuditRecorder auditRecorder;

    @Transactional(propagation = Propagation.MANDATORY)
    public Transfer execute(UUID transferId, RequestMetadata metadata) {
        TransferEntity entity = transferRepository.findById(transferId)
            .orElseThrow(() -> new IllegalStateException("Transfer not found: " + transferId));
        Transfer transfer = entity.toDomain();

        if (!transfer.getStatus().isExecutable()) {
            throw new IllegalStateException(String.format(
                "Transfer %s is %s and cannot be executed", transferId, transfer.getStatus()));
        }

        try {
            int debited = accountRepository.debit(transfer.getFromAccountId(), transfer.getAmount());
            if (debited != 1) {
                throw new IllegalStateException("Source account not found: " + transfer.getFromAccountId());
            }
            int credited = accountRepository.credit(transfer.getToAccountId(), transfer.getAmount());
            if (credited != 1) {
                throw new IllegalStateException("Destination account not found: " + transfer.getToAccountId());
            }

            Transfer completed = transfer.complete();
            entity.updateFromDomain(completed);
            transferRepository.saveAndFlush(entity);

            auditRecorder.record(
                AuditAction.TRANSFER_COMPLETED,
                transfer.getInitiatedBy(),
                transferId,
                transfer.getFromAccountId(),
                TransferAuditDetails.completed(transfer),
                metadata
            );

            log.info("Transfer executed: from={}, to={}, amount={}",
                    transfer.getFromAccountId(), transfer.getToAccountId(), transfer.getAmount());
            return completed;
        } catch (RuntimeException e) {
            String message = TransferExecutionException.describe(e);
            log.error("Transfer execution failed: error={}", message);
            throw new TransferExecutionException(transferId, message, e);
        }
    }
}
