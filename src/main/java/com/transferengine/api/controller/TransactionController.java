package com.transferengine.api.controller;

import com.transferengine.api.dto.AmountRequest;
import com.transferengine.api.dto.TransactionRecordResponse;
import com.transferengine.api.dto.TransferRequest;
import com.transferengine.audit.AuditLog;
import com.transferengine.transactions.BalanceResult;
import com.transferengine.transactions.TransactionEngine;
import com.transferengine.transactions.TransferResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for balance-changing operations. Every call carries the client's
 * idempotency key in the {@value #IDEMPOTENCY_HEADER} header.
 */
@RestController
@RequestMapping("/api/v1/transactions")
@RequiredArgsConstructor
@Tag(name = "Transactions", description = "Deposits, withdrawals and transfers")
public class TransactionController {

    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final TransactionEngine transactionEngine;
    private final AuditLog auditLog;

    @PostMapping("/deposit")
    @Operation(summary = "Deposit funds into an account")
    public ResponseEntity<BalanceResult> deposit(
            @RequestHeader(IDEMPOTENCY_HEADER) String idempotencyKey,
            @Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(
            transactionEngine.deposit(request.getAccountId(), request.toMoney(), idempotencyKey));
    }

    @PostMapping("/withdraw")
    @Operation(summary = "Withdraw funds from an account")
    public ResponseEntity<BalanceResult> withdraw(
            @RequestHeader(IDEMPOTENCY_HEADER) String idempotencyKey,
            @Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(
            transactionEngine.withdraw(request.getAccountId(), request.toMoney(), idempotencyKey));
    }

    @PostMapping("/transfer")
    @Operation(summary = "Transfer funds between accounts, converting currency if needed")
    public ResponseEntity<TransferResult> transfer(
            @RequestHeader(IDEMPOTENCY_HEADER) String idempotencyKey,
            @Valid @RequestBody TransferRequest request) {
        return ResponseEntity.ok(transactionEngine.transfer(
            request.getSourceAccountId(),
            request.getDestinationAccountId(),
            request.toMoney(),
            idempotencyKey));
    }

    @GetMapping
    @Operation(summary = "List every recorded attempt made under an idempotency key")
    public ResponseEntity<List<TransactionRecordResponse>> getAttempts(@RequestParam String idempotencyKey) {
        return ResponseEntity.ok(auditLog.getAttempts(idempotencyKey).stream()
            .map(TransactionRecordResponse::from)
            .toList());
    }

    @GetMapping("/{transactionId}")
    @Operation(summary = "Get the audit records of a transaction")
    public ResponseEntity<List<TransactionRecordResponse>> getTransaction(@PathVariable String transactionId) {
        List<TransactionRecordResponse> records = auditLog.getTransaction(transactionId).stream()
            .map(TransactionRecordResponse::from)
            .toList();
        if (records.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(records);
    }
}
