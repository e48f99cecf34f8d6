package com.flagship.revenue_ledger.account;

import com.flagship.revenue_ledger.account.dto.AccountResponse;
import com.flagship.revenue_ledger.account.dto.CreateAccountRequest;
import com.flagship.revenue_ledger.account.dto.UpdateAccountRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Chart of accounts.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        Account account = accountService.createAccount(request.getOrganizationId(), request.getCode(),
            request.getName(), request.getAccountType(), request.isSystem());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(AccountResponse.from(accountService.requireAccount(id)));
    }

    @GetMapping
    public List<AccountResponse> listAccounts(@RequestParam("organization_id") UUID organizationId) {
        return accountService.listAccounts(organizationId).stream().map(AccountResponse::from).toList();
    }

    @PatchMapping("/{id}")
    public ResponseEntity<AccountResponse> updateAccount(@PathVariable("id") UUID id,
                                                         @RequestBody UpdateAccountRequest request) {
        Account account = accountService.updateAccount(id, request.getName(), request.getAccountType(),
            request.getActive());
        return ResponseEntity.ok(AccountResponse.from(account));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteAccount(@PathVariable("id") UUID id) {
        accountService.deleteAccount(id);
        return ResponseEntity.noContent().build();
    }
}
