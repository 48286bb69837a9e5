package com.flagship.transfer_engine.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class InitiateTransferResponse {

    @JsonProperty("transfer")
    TransferResponse transfer;

    @JsonProperty("message")
    String message;
}
