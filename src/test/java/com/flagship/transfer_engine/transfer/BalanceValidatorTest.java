package com.flagship.transfer_engine.transfer;

import com.flagship.transfer_engine.account.Account;
import com.flagship.transfer_engine.account.AccountRepository;
import com.flagship.transfer_engine.transfer.exception.TransferValidationException;
import com.flagship.transfer_engine.transfer.exception.ValidationFailure;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BalanceValidatorTest {

    @Mock
    private AccountRepository accountRepository;

    @InjectMocks
    private BalanceValidator balanceValidator;

    private final UUID accountId = UUID.randomUUID();

    private Account account(String balance, String minimum) {
        return new Account(accountId, "ACC-1", "Operating", new BigDecimal(balance), new BigDecimal(minimum),
                true, Instant.now(), Instant.now());
    }

    @Test
    @DisplayName("Debit leaving exactly the minimum balance passes")
    void debitDownToMinimumPasses() {
        when(accountRepository.findActiveByIdForUpdate(accountId)).thenReturn(Optional.of(account("10000.00", "100.00")));

        Account checked = balanceValidator.check(accountId, new BigDecimal("9900.00"));

        assertEquals(accountId, checked.getId());
    }

    @Test
    @DisplayName("Missing or inactive account fails with ACCOUNT_NOT_FOUND")
    void missingAccount() {
        when(accountRepository.findActiveByIdForUpdate(accountId)).thenReturn(Optional.empty());

        TransferValidationException e = assertThrows(TransferValidationException.class,
                () -> balanceValidator.check(accountId, BigDecimal.TEN));

        assertEquals(ValidationFailure.ACCOUNT_NOT_FOUND, e.getReason());
        assertEquals("Account not found or inactive", e.getMessage());
    }

    @Test
    @DisplayName("Debit below zero fails with INSUFFICIENT_FUNDS and reports the balance")
    void insufficientFunds() {
        when(accountRepository.findActiveByIdForUpdate(accountId)).thenReturn(Optional.of(account("1000.00", "100.00")));

        TransferValidationException e = assertThrows(TransferValidationException.class,
                () -> balanceValidator.check(accountId, new BigDecimal("5000.00")));

        assertEquals(ValidationFailure.INSUFFICIENT_FUNDS, e.getReason());
        assertEquals("Insufficient funds. Current balance: $1000.00", e.getMessage());
    }

    @Test
    @DisplayName("Debit under the floor fails with MINIMUM_BALANCE_VIOLATION")
    void minimumBalanceViolation() {
        when(accountRepository.findActiveByIdForUpdate(accountId)).thenReturn(Optional.of(account("1000.00", "100.00")));

        TransferValidationException e = assertThrows(TransferValidationException.class,
                () -> balanceValidator.check(accountId, new BigDecimal("950.00")));

        assertEquals(ValidationFailure.MINIMUM_BALANCE_VIOLATION, e.getReason());
        assertEquals("Transfer would violate minimum balance requirement of $100.00", e.getMessage());
    }

    @Test
    @DisplayName("Null account id is reported as ACCOUNT_NOT_FOUND")
    void nullAccountId() {
        TransferValidationException e = assertThrows(TransferValidationException.class,
                () -> balanceValidator.check(null, BigDecimal.ONE));

        assertEquals(ValidationFailure.ACCOUNT_NOT_FOUND, e.getReason());
    }

    @Test
    @DisplayName("Both legs are locked in id order before the source balance is read")
    void locksBothLegsBeforeReadingSource() {
        UUID destinationId = UUID.randomUUID();
        when(accountRepository.findActiveByIdForUpdate(accountId)).thenReturn(Optional.of(account("500.00", "0.00")));

        balanceValidator.check(accountId, destinationId, new BigDecimal("200.00"));

        InOrder order = inOrder(accountRepository);
        order.verify(accountRepository).lockInIdOrder(accountId, destinationId);
        order.verify(accountRepository).findActiveByIdForUpdate(accountId);
    }
}
