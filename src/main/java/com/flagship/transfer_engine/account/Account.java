package com.flagship.transfer_engine.account;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for an Account.
 * Plain value object read through JDBC; balances are fixed-point NUMERIC(15,2).
 *
 * Invariant: balance >= 0 and, after any debit, balance >= minimumBalance.
 */
@Value
public class Account {
    UUID id;
    String accountNumber;
    String accountName;
    BigDecimal balance;
    BigDecimal minimumBalance;
    boolean active;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Balance that would remain after debiting the given amount.
     */
    public BigDecimal balanceAfterDebit(BigDecimal amount) {
        return balance.subtract(amount);
    }
}
