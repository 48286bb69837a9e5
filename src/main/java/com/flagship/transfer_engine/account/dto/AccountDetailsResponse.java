package com.flagship.transfer_engine.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.transfer_engine.transfer.dto.TransferResponse;
import lombok.Value;

import java.util.List;

/**
 * One account with a page of the transfers it took part in, newest first.
 */
@Value
public class AccountDetailsResponse {

    @JsonProperty("account")
    AccountResponse account;

    @JsonProperty("transfers")
    List<TransferResponse> transfers;

    @JsonProperty("total_transfers")
    long totalTransfers;
}
