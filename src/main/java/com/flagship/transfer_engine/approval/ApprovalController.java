package com.flagship.transfer_engine.approval;

import com.flagship.transfer_engine.approval.dto.DecideApprovalRequest;
import com.flagship.transfer_engine.common.RequestMetadataResolver;
import com.flagship.transfer_engine.security.AccessGuard;
import com.flagship.transfer_engine.security.Principal;
import com.flagship.transfer_engine.transfer.Transfer;
import com.flagship.transfer_engine.transfer.TransferQueryService;
import com.flagship.transfer_engine.transfer.dto.TransferResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for the approval queue and reviewer decisions.
 */
@RestController
@RequestMapping("/api/approvals")
@RequiredArgsConstructor
public class ApprovalController {

    private final ApprovalProcessor approvalProcessor;
    private final TransferQueryService transferQueryService;
    private final AccessGuard accessGuard;

    /**
     * Transfers awaiting a decision, oldest first. The caller's own requests are
     * left out unless all=true.
     */
    @GetMapping("/pending")
    public ResponseEntity<List<TransferResponse>> listPending(
            @RequestParam(value = "all", defaultValue = "false") boolean all,
            @RequestHeader(value = Principal.ID_HEADER, required = false) String principalId,
            @RequestHeader(value = Principal.ROLE_HEADER, required = false) String principalRole) {

        Principal principal = Principal.fromHeaders(principalId, principalRole);
        accessGuard.requireApprove(principal);

        List<TransferResponse> pending = (all
                ? transferQueryService.listAllPendingApprovals()
                : transferQueryService.listPendingApprovals(principal.getId()))
            .stream()
            .map(TransferResponse::from)
            .toList();
        return ResponseEntity.ok(pending);
    }

    @GetMapping("/{transferId}")
    public ResponseEntity<TransferResponse.ApprovalView> getApproval(
            @PathVariable("transferId") UUID transferId,
            @RequestHeader(value = Principal.ID_HEADER, required = false) String principalId,
            @RequestHeader(value = Principal.ROLE_HEADER, required = false) String principalRole) {

        accessGuard.requireViewTransfers(Principal.fromHeaders(principalId, principalRole));

        return approvalProcessor.getApprovalByTransferId(transferId)
            .map(approval -> ResponseEntity.ok(TransferResponse.ApprovalView.from(approval)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{transferId}/decision")
    public ResponseEntity<TransferResponse> decide(
            @PathVariable("transferId") UUID transferId,
            @Valid @RequestBody DecideApprovalRequest request,
            @RequestHeader(value = Principal.ID_HEADER, required = false) String principalId,
            @RequestHeader(value = Principal.ROLE_HEADER, required = false) String principalRole,
            HttpServletRequest httpRequest) {

        Principal principal = Principal.fromHeaders(principalId, principalRole);
        accessGuard.requireApprove(principal);

        Transfer transfer = approvalProcessor.decide(
            transferId,
            principal.getId(),
            request.getDecision(),
            request.getNotes(),
            RequestMetadataResolver.resolve(httpRequest)
        );
        return ResponseEntity.ok(TransferResponse.from(transfer));
    }
}
