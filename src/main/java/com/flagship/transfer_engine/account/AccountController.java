package com.flagship.transfer_engine.account;

import com.flagship.transfer_engine.account.dto.AccountDetailsResponse;
import com.flagship.transfer_engine.account.dto.AccountResponse;
import com.flagship.transfer_engine.account.dto.BalanceResponse;
import com.flagship.transfer_engine.common.PagedResult;
import com.flagship.transfer_engine.common.RequestMetadataResolver;
import com.flagship.transfer_engine.security.AccessGuard;
import com.flagship.transfer_engine.security.Principal;
import com.flagship.transfer_engine.transfer.TransferDetails;
import com.flagship.transfer_engine.transfer.TransferFilter;
import com.flagship.transfer_engine.transfer.TransferQueryService;
import com.flagship.transfer_engine.transfer.dto.TransferResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;
    private final TransferQueryService transferQueryService;
    private final AccessGuard accessGuard;

    @GetMapping
    public ResponseEntity<List<AccountResponse>> listAccounts(
            @RequestHeader(value = Principal.ID_HEADER, required = false) String principalId,
            @RequestHeader(value = Principal.ROLE_HEADER, required = false) String principalRole) {

        accessGuard.requireViewTransfers(Principal.fromHeaders(principalId, principalRole));

        return ResponseEntity.ok(accountService.listActiveAccounts()
            .stream()
            .map(AccountResponse::from)
            .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<AccountDetailsResponse> getAccount(
            @PathVariable("id") UUID id,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "size", required = false) Integer size,
            @RequestHeader(value = Principal.ID_HEADER, required = false) String principalId,
            @RequestHeader(value = Principal.ROLE_HEADER, required = false) String principalRole,
            HttpServletRequest httpRequest) {

        Principal principal = Principal.fromHeaders(principalId, principalRole);
        accessGuard.requireViewTransfers(principal);

        Account account = accountService.getAccount(id, principal.getId(), RequestMetadataResolver.resolve(httpRequest))
            .orElseThrow(() -> new AccountNotFoundException(id));

        PagedResult<TransferDetails> history = transferQueryService.listTransfers(
            TransferFilter.builder().accountId(id).build(),
            PagedResult.normalizePage(page),
            PagedResult.normalizeSize(size));

        return ResponseEntity.ok(new AccountDetailsResponse(
            AccountResponse.from(account),
            history.getItems().stream().map(TransferResponse::from).toList(),
            history.getTotal()));
    }

    @GetMapping("/{id}/balance")
    public ResponseEntity<BalanceResponse> getBalance(
            @PathVariable("id") UUID id,
            @RequestHeader(value = Principal.ID_HEADER, required = false) String principalId,
            @RequestHeader(value = Principal.ROLE_HEADER, required = false) String principalRole,
            HttpServletRequest httpRequest) {

        Principal principal = Principal.fromHeaders(principalId, principalRole);
        accessGuard.requireViewTransfers(principal);

        return ResponseEntity.ok(new BalanceResponse(id,
            accountService.getBalance(id, principal.getId(), RequestMetadataResolver.resolve(httpRequest))));
    }
}
