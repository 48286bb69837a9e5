package com.flagship.transfer_engine.account;

import lombok.Getter;

import java.util.UUID;

@Getter
public class AccountNotFoundException extends RuntimeException {

    private final UUID accountId;

    public AccountNotFoundException(UUID accountId) {
        super("Account not found: " + accountId);
        this.accountId = accountId;
    }
}
