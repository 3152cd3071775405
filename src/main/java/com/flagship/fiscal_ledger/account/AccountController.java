package com.flagship.fiscal_ledger.account;

import com.flagship.fiscal_ledger.account.dto.AccountResponse;
import com.flagship.fiscal_ledger.account.dto.CreateAccountRequest;
import com.flagship.fiscal_ledger.account.dto.UpdateAccountRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/tenants/{tenantId}/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;

    @PostMapping
    public ResponseEntity<AccountResponse> create(@PathVariable("tenantId") UUID tenantId,
                                                  @Valid @RequestBody CreateAccountRequest request) {
        Account account = accountService.create(tenantId, request.getCode(), request.getName(),
            request.getType(), request.getParentId(), request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping
    public List<AccountResponse> list(@PathVariable("tenantId") UUID tenantId) {
        return accountService.listForTenant(tenantId).stream()
            .map(AccountResponse::from)
            .toList();
    }

    @GetMapping("/{accountId}")
    public AccountResponse get(@PathVariable("tenantId") UUID tenantId,
                               @PathVariable("accountId") UUID accountId) {
        return AccountResponse.from(accountService.get(tenantId, accountId));
    }

    @PutMapping("/{accountId}")
    public AccountResponse update(@PathVariable("tenantId") UUID tenantId,
                                  @PathVariable("accountId") UUID accountId,
                                  @Valid @RequestBody UpdateAccountRequest request) {
        return AccountResponse.from(accountService.update(
            tenantId, accountId, request.getName(), request.getDescription(), request.isActive()));
    }
}
