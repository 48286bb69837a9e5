package com.flagship.transfer_engine.transfer;

import com.flagship.transfer_engine.audit.AuditQueryService;
import com.flagship.transfer_engine.audit.dto.AuditRecordResponse;
import com.flagship.transfer_engine.common.PagedResult;
import com.flagship.transfer_engine.common.RequestMetadataResolver;
import com.flagship.transfer_engine.security.AccessGuard;
import com.flagship.transfer_engine.security.Principal;
import com.flagship.transfer_engine.transfer.dto.InitiateTransferRequest;
import com.flagship.transfer_engine.transfer.dto.InitiateTransferResponse;
import com.flagship.transfer_engine.transfer.dto.TransferResponse;
import com.flagship.transfer_engine.transfer.exception.WorkflowException;
import com.flagship.transfer_engine.transfer.exception.WorkflowFailure;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for initiating and reading transfers.
 *
 * Every endpoint resolves the caller from the gateway principal headers and
 * checks the role's capability before touching the engine.
 */
@RestController
@RequestMapping("/api/transfers")
@RequiredArgsConstructor
@Slf4j
public class TransferController {

    private final TransferEngine transferEngine;
    private final TransferQueryService transferQueryService;
    private final AuditQueryService auditQueryService;
    private final AccessGuard accessGuard;

    @PostMapping
    public ResponseEntity<InitiateTransferResponse> initiateTransfer(
            @Valid @RequestBody InitiateTransferRequest request,
            @RequestHeader(value = Principal.ID_HEADER, required = false) String principalId,
            @RequestHeader(value = Principal.ROLE_HEADER, required = false) String principalRole,
            HttpServletRequest httpRequest) {

        Principal principal = Principal.fromHeaders(principalId, principalRole);
        accessGuard.requireInitiate(principal);

        Transfer transfer = transferEngine.initiate(
            request.getFromAccountId(),
            request.getToAccountId(),
            request.getAmount(),
            principal.getId(),
            request.getDescription(),
            RequestMetadataResolver.resolve(httpRequest)
        );

        String message = transfer.isRequiresApproval()
            ? "Transfer requires approval. It has been submitted for review."
            : "Transfer completed successfully.";

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new InitiateTransferResponse(TransferResponse.from(transfer), message));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransferResponse> getTransfer(
            @PathVariable("id") UUID id,
            @RequestHeader(value = Principal.ID_HEADER, required = false) String principalId,
            @RequestHeader(value = Principal.ROLE_HEADER, required = false) String principalRole) {

        accessGuard.requireViewTransfers(Principal.fromHeaders(principalId, principalRole));

        return transferQueryService.getTransferById(id)
            .map(details -> ResponseEntity.ok(TransferResponse.from(details)))
            .orElseThrow(() -> new WorkflowException(WorkflowFailure.TRANSFER_NOT_FOUND, id,
                "Transfer not found: " + id));
    }

    @GetMapping
    public ResponseEntity<PagedResult<TransferResponse>> listTransfers(
            @RequestParam(value = "accountId", required = false) UUID accountId,
            @RequestParam(value = "initiatedBy", required = false) UUID initiatedBy,
            @RequestParam(value = "status", required = false) TransferStatus status,
            @RequestParam(value = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "size", required = false) Integer size,
            @RequestHeader(value = Principal.ID_HEADER, required = false) String principalId,
            @RequestHeader(value = Principal.ROLE_HEADER, required = false) String principalRole) {

        accessGuard.requireViewTransfers(Principal.fromHeaders(principalId, principalRole));

        TransferFilter filter = TransferFilter.builder()
            .accountId(accountId)
            .initiatedBy(initiatedBy)
            .status(status)
            .from(from)
            .to(to)
            .build();

        PagedResult<TransferDetails> result = transferQueryService.listTransfers(
            filter, PagedResult.normalizePage(page), PagedResult.normalizeSize(size));
        return ResponseEntity.ok(result.map(TransferResponse::from));
    }

    @GetMapping("/{id}/audit")
    public ResponseEntity<List<AuditRecordResponse>> getAuditTrail(
            @PathVariable("id") UUID id,
            @RequestHeader(value = Principal.ID_HEADER, required = false) String principalId,
            @RequestHeader(value = Principal.ROLE_HEADER, required = false) String principalRole) {

        accessGuard.requireViewAuditTrail(Principal.fromHeaders(principalId, principalRole));

        List<AuditRecordResponse> trail = auditQueryService.listAuditTrail(id)
            .stream()
            .map(AuditRecordResponse::from)
            .toList();
        return ResponseEntity.ok(trail);
    }
}
