package com.flagship.transfer_engine.audit;

import com.flagship.transfer_engine.audit.dto.AuditRecordResponse;
import com.flagship.transfer_engine.common.PagedResult;
import com.flagship.transfer_engine.common.RequestMetadataResolver;
import com.flagship.transfer_engine.security.AccessGuard;
import com.flagship.transfer_engine.security.Principal;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * Filtered audit log listing. Each lookup is itself recorded as AUDIT_LOG_VIEWED.
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditQueryService auditQueryService;
    private final AccessGuard accessGuard;

    @GetMapping
    public ResponseEntity<PagedResult<AuditRecordResponse>> listAuditRecords(
            @RequestParam(value = "actorId", required = false) UUID actorId,
            @RequestParam(value = "transferId", required = false) UUID transferId,
            @RequestParam(value = "accountId", required = false) UUID accountId,
            @RequestParam(value = "action", required = false) List<AuditAction> actions,
            @RequestParam(value = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "size", required = false) Integer size,
            @RequestHeader(value = Principal.ID_HEADER, required = false) String principalId,
            @RequestHeader(value = Principal.ROLE_HEADER, required = false) String principalRole,
            HttpServletRequest httpRequest) {

        Principal principal = Principal.fromHeaders(principalId, principalRole);
        accessGuard.requireViewAuditTrail(principal);

        AuditFilter filter = AuditFilter.builder()
            .actorId(actorId)
            .transferId(transferId)
            .accountId(accountId)
            .actions(actions == null || actions.isEmpty() ? null : EnumSet.copyOf(actions))
            .from(from)
            .to(to)
            .build();

        PagedResult<AuditRecord> result = auditQueryService.listAuditRecords(
            filter,
            PagedResult.normalizePage(page),
            PagedResult.normalizeSize(size),
            principal.getId(),
            RequestMetadataResolver.resolve(httpRequest));

        return ResponseEntity.ok(result.map(AuditRecordResponse::from));
    }
}
