package com.flagship.transfer_engine.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Converts audit detail payloads to and from their JSONB column form.
 */
@Component
@RequiredArgsConstructor
public class AuditDetailCodec {

    private final ObjectMapper objectMapper;

    public String encode(AuditDetail detail) {
        AuditDetail payload = detail != null ? detail : AuditDetail.empty();
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit detail payload", e);
        }
    }

    public AuditDetail decode(String json) {
        if (json == null || json.isBlank()) {
            return AuditDetail.empty();
        }
        try {
            return AuditDetail.fromJson(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored audit detail payload is not valid JSON", e);
        }
    }
}
