package com.flagship.transfer_engine.transfer;

import com.flagship.transfer_engine.account.Account;
import com.flagship.transfer_engine.account.AccountRepository;
import com.flagship.transfer_engine.transfer.exception.TransferValidationException;
import com.flagship.transfer_engine.transfer.exception.ValidationFailure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Decides whether a source account may be debited by an amount.
 *
 * Checks, in order:
 * 1. An active account exists with the id
 * 2. balance - amount >= 0
 * 3. balance - amount >= minimum_balance
 *
 * The account row is read with FOR UPDATE, so the balance it judged stays
 * current until the surrounding transaction commits or rolls back. Callers about
 * to move money use {@link #check(UUID, UUID, BigDecimal)}, which first locks both
 * legs of the transfer in id order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BalanceValidator {

    private final AccountRepository accountRepository;

    /**
     * @return the locked source account
     * @throws TransferValidationException ACCOUNT_NOT_FOUND, INSUFFICIENT_FUNDS or MINIMUM_BALANCE_VIOLATION
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Account check(UUID accountId, BigDecimal amount) {
        Account account = accountId != null
                ? accountRepository.findActiveByIdForUpdate(accountId).orElse(null)
                : null;
        if (account == null) {
            throw new TransferValidationException(ValidationFailure.ACCOUNT_NOT_FOUND,
                    "Account not found or inactive");
        }

        BigDecimal remaining = account.balanceAfterDebit(amount);
        if (remaining.signum() < 0) {
            log.debug("Insufficient funds: accountId={}, balance={}, amount={}",
                    accountId, account.getBalance(), amount);
            throw new TransferValidationException(ValidationFailure.INSUFFICIENT_FUNDS,
                    "Insufficient funds. Current balance: $" + account.getBalance().toPlainString());
        }
        if (remaining.compareTo(account.getMinimumBalance()) < 0) {
            throw new TransferValidationException(ValidationFailure.MINIMUM_BALANCE_VIOLATION,
                    "Transfer would violate minimum balance requirement of $"
                            + account.getMinimumBalance().toPlainString());
        }
        return account;
    }

    /**
     * Locks the source and destination rows in id order, then checks the source.
     *
     * @return the locked source account
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Account check(UUID accountId, UUID counterpartyId, BigDecimal amount) {
        accountRepository.lockInIdOrder(accountId, counterpartyId);
        return check(accountId, amount);
    }
}
