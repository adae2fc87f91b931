package com.transferengine.api.controller;

import com.transferengine.accounts.Account;
import com.transferengine.accounts.AccountService;
import com.transferengine.api.dto.AccountResponse;
import com.transferengine.api.dto.CreateAccountRequest;
import com.transferengine.api.dto.TransactionRecordResponse;
import com.transferengine.audit.AuditLog;
import com.transferengine.common.IdempotencyKey;
import com.transferengine.common.Money;
import com.transferengine.transactions.TransactionEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for account management.
 */
@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
@Tag(name = "Accounts", description = "Account management API")
public class AccountController {

    private final AccountService accountService;
    private final TransactionEngine transactionEngine;
    private final AuditLog auditLog;

    @PostMapping
    @Operation(summary = "Open a new account")
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        // Validated before the account is opened
        Money initialDeposit = request.getInitialDeposit() == null
            ? Money.zero(request.getCurrency())
            : Money.of(request.getInitialDeposit(), request.getCurrency());

        Account account = accountService.openAccount(request.getOwnerId(), request.getCurrency());

        // Initial funding is an ordinary audited deposit
        if (initialDeposit.isPositive()) {
            transactionEngine.deposit(account.getAccountId(), initialDeposit, IdempotencyKey.generate());
            account = accountService.getAccount(account.getAccountId());
        }

        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping("/{accountId}")
    @Operation(summary = "Get account details")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable String accountId) {
        return ResponseEntity.ok(AccountResponse.from(accountService.getAccount(accountId)));
    }

    @GetMapping("/owner/{ownerId}")
    @Operation(summary = "Get all accounts for an owner")
    public ResponseEntity<List<AccountResponse>> getAccountsByOwner(@PathVariable String ownerId) {
        List<AccountResponse> accounts = accountService.getAccountsByOwner(ownerId).stream()
            .map(AccountResponse::from)
            .toList();
        return ResponseEntity.ok(accounts);
    }

    @PostMapping("/{accountId}/close")
    @Operation(summary = "Close an account, freezing its balance")
    public ResponseEntity<AccountResponse> closeAccount(
            @PathVariable String accountId,
            @RequestParam(required = false) Long expectedVersion) {
        return ResponseEntity.ok(AccountResponse.from(accountService.closeAccount(accountId, expectedVersion)));
    }

    @GetMapping("/{accountId}/transactions")
    @Operation(summary = "Get the transaction history of an account, newest first")
    public ResponseEntity<List<TransactionRecordResponse>> getAccountTransactions(@PathVariable String accountId) {
        accountService.getAccount(accountId);
        List<TransactionRecordResponse> history = auditLog.getAccountHistory(accountId).stream()
            .map(TransactionRecordResponse::from)
            .toList();
        return ResponseEntity.ok(history);
    }
}
