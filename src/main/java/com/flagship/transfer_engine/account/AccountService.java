package com.flagship.transfer_engine.account;

import com.flagship.transfer_engine.audit.AuditAction;
import com.flagship.transfer_engine.audit.AuditDetail;
import com.flagship.transfer_engine.audit.AuditRecorder;
import com.flagship.transfer_engine.audit.RequestMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Account provisioning and read access.
 *
 * Balances are never written here; only the transfer execution path moves money.
 * Sensitive reads (single account, balance) are recorded in the audit trail.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;
    private final AuditRecorder auditRecorder;

    /**
     * Out-of-band provisioning of a new active account.
     */
    @Transactional
    public Account createAccount(String accountNumber, String accountName,
                                 BigDecimal initialBalance, BigDecimal minimumBalance) {
        if (accountNumber == null || accountNumber.isBlank()) {
            throw new IllegalArgumentException("Account number is required");
        }
        if (accountName == null || accountName.isBlank()) {
            throw new IllegalArgumentException("Account name is required");
        }
        BigDecimal balance = initialBalance != null ? initialBalance : BigDecimal.ZERO;
        BigDecimal floor = minimumBalance != null ? minimumBalance : BigDecimal.ZERO;
        if (balance.signum() < 0) {
            throw new IllegalArgumentException("Initial balance cannot be negative");
        }
        if (floor.signum() < 0) {
            throw new IllegalArgumentException("Minimum balance cannot be negative");
        }

        UUID id = UUID.randomUUID();
        accountRepository.insert(id, accountNumber, accountName, balance, floor);
        log.info("Created account: id={}, accountNumber={}", id, accountNumber);

        return accountRepository.findById(id)
            .orElseThrow(() -> new IllegalStateException("Account not found after insert: " + id));
    }

    /**
     * Looks up an account (active or not). When a viewer is given the lookup is
     * recorded as ACCOUNT_VIEWED.
     */
    @Transactional
    public Optional<Account> getAccount(UUID accountId, UUID viewerId, RequestMetadata metadata) {
        Optional<Account> account = accountRepository.findById(accountId);
        if (account.isPresent() && viewerId != null) {
            auditRecorder.record(AuditAction.ACCOUNT_VIEWED, viewerId, null, accountId,
                AuditDetail.builder()
                    .put("account_number", account.get().getAccountNumber())
                    .build(),
                metadata);
        }
        return account;
    }

    @Transactional(readOnly = true)
    public List<Account> listActiveAccounts() {
        return accountRepository.findAllActive();
    }

    /**
     * Current balance, recorded as BALANCE_CHECKED for the viewer.
     *
     * @throws AccountNotFoundException if no account has the id
     */
    @Transactional
    public BigDecimal getBalance(UUID accountId, UUID viewerId, RequestMetadata metadata) {
        Account account = accountRepository.findById(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
        if (viewerId != null) {
            auditRecorder.record(AuditAction.BALANCE_CHECKED, viewerId, null, accountId,
                AuditDetail.builder()
                    .put("account_number", account.getAccountNumber())
                    .put("balance", account.getBalance())
                    .build(),
                metadata);
        }
        return account.getBalance();
    }
}
