package com.flagship.transfer_engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.transfer_engine.approval.ApprovalDecision;
import com.flagship.transfer_engine.approval.dto.DecideApprovalRequest;
import com.flagship.transfer_engine.transfer.dto.InitiateTransferRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Request bodies are immutable value objects; the shared mapper must be able to build them.
 */
class JacksonConfigTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();

    @Test
    @DisplayName("Initiate request is read from snake_case JSON with the amount's scale intact")
    void readsInitiateRequest() throws Exception {
        UUID from = UUID.randomUUID();
        UUID to = UUID.randomUUID();
        String json = "{\"from_account_id\":\"" + from + "\",\"to_account_id\":\"" + to + "\"," +
                "\"amount\":5000.00,\"description\":\"rent\"}";

        InitiateTransferRequest request = objectMapper.readValue(json, InitiateTransferRequest.class);

        assertEquals(from, request.getFromAccountId());
        assertEquals(to, request.getToAccountId());
        assertEquals(new BigDecimal("5000.00"), request.getAmount());
        assertEquals("rent", request.getDescription());
    }

    @Test
    @DisplayName("Missing optional fields are read as null")
    void readsPartialInitiateRequest() throws Exception {
        InitiateTransferRequest request = objectMapper.readValue("{\"amount\":10}", InitiateTransferRequest.class);

        assertNull(request.getFromAccountId());
        assertNull(request.getDescription());
        assertEquals(0, BigDecimal.TEN.compareTo(request.getAmount()));
    }

    @Test
    @DisplayName("Decision request is read with its enum and notes")
    void readsDecisionRequest() throws Exception {
        DecideApprovalRequest request = objectMapper.readValue(
                "{\"decision\":\"REJECTED\",\"notes\":\"no cover\"}", DecideApprovalRequest.class);

        assertEquals(ApprovalDecision.REJECTED, request.getDecision());
        assertEquals("no cover", request.getNotes());
    }
}
