package com.flagship.transfer_engine.audit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.transfer_engine.audit.AuditAction;
import com.flagship.transfer_engine.audit.AuditDetail;
import com.flagship.transfer_engine.audit.AuditRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AuditRecordResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("sequence_number")
    Long sequenceNumber;

    @JsonProperty("action")
    AuditAction action;

    @JsonProperty("actor_id")
    UUID actorId;

    @JsonProperty("transfer_id")
    UUID transferId;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("details")
    AuditDetail details;

    @JsonProperty("origin_address")
    String originAddress;

    @JsonProperty("client_info")
    String clientInfo;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AuditRecordResponse from(AuditRecord record) {
        return AuditRecordResponse.builder()
            .id(record.getId())
            .sequenceNumber(record.getSequenceNumber())
            .action(record.getAction())
            .actorId(record.getActorId())
            .transferId(record.getTransferId())
            .accountId(record.getAccountId())
            .details(record.getDetail())
            .originAddress(record.getOriginAddress())
            .clientInfo(record.getClientInfo())
            .createdAt(record.getCreatedAt())
            .build();
    }
}
