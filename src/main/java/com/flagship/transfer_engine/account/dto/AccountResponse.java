package com.flagship.transfer_engine.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.transfer_engine.account.Account;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("minimum_balance")
    BigDecimal minimumBalance;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .accountNumber(account.getAccountNumber())
            .accountName(account.getAccountName())
            .balance(account.getBalance())
            .minimumBalance(account.getMinimumBalance())
            .active(account.isActive())
            .createdAt(account.getCreatedAt())
            .updatedAt(account.getUpdatedAt())
            .build();
    }
}
