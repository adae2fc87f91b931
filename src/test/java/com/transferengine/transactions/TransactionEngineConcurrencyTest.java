package com.transferengine.transactions;

import com.transferengine.accounts.AccountService;
import com.transferengine.audit.AuditLog;
import com.transferengine.common.Currency;
import com.transferengine.common.IdempotencyKey;
import com.transferengine.common.Money;
import com.transferengine.common.exception.InsufficientFundsException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrency tests: many transactions in flight on the engine's worker pool
 * against a handful of accounts.
 */
@SpringBootTest
@ActiveProfiles("test")
class TransactionEngineConcurrencyTest {

    @Autowired
    private TransactionEngine transactionEngine;

    @Autowired
    private AccountService accountService;

    @Autowired
    private AuditLog auditLog;

    @Test
    void testConcurrentDepositsAreNeverLost() throws Exception {
        String account = open(Currency.USD, "100.00");

        List<CompletableFuture<BalanceResult>> deposits = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            deposits.add(transactionEngine.submitDeposit(account, usd("10.00"), IdempotencyKey.generate()));
        }
        CompletableFuture.allOf(deposits.toArray(new CompletableFuture[0])).get(120, TimeUnit.SECONDS);

        assertEquals(usd("10100.00"), balanceOf(account));
        assertEquals(usd("10100.00"), auditLog.reconstructBalance(account, Currency.USD));
    }

    @Test
    void testOppositeDirectionTransfersAllComplete() throws Exception {
        String a = open(Currency.USD, "1000.00");
        String b = open(Currency.USD, "1000.00");

        List<CompletableFuture<TransferResult>> transfers = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            transfers.add(transactionEngine.submitTransfer(a, b, usd("1.00"), IdempotencyKey.generate()));
            transfers.add(transactionEngine.submitTransfer(b, a, usd("1.00"), IdempotencyKey.generate()));
        }
        CompletableFuture.allOf(transfers.toArray(new CompletableFuture[0])).get(120, TimeUnit.SECONDS);

        assertEquals(usd("1000.00"), balanceOf(a));
        assertEquals(usd("1000.00"), balanceOf(b));
    }

    @Test
    void testConcurrentTransfersConserveValue() throws Exception {
        List<String> accounts = List.of(
            open(Currency.USD, "500.00"),
            open(Currency.USD, "500.00"),
            open(Currency.USD, "500.00"),
            open(Currency.USD, "500.00"));

        List<CompletableFuture<TransferResult>> transfers = new ArrayList<>();
        for (int i = 0; i < 400; i++) {
            String source = accounts.get(i % 4);
            String destination = accounts.get((i + 1 + (i / 4) % 3) % 4);
            transfers.add(transactionEngine.submitTransfer(source, destination, usd("3.25"),
                IdempotencyKey.generate()));
        }
        // Some may fail for lack of funds; those must leave no trace in the balances.
        for (CompletableFuture<TransferResult> transfer : transfers) {
            try {
                transfer.get(120, TimeUnit.SECONDS);
            } catch (ExecutionException e) {
                assertInstanceOf(InsufficientFundsException.class, e.getCause());
            }
        }

        Money total = Money.zero(Currency.USD);
        for (String account : accounts) {
            Money balance = balanceOf(account);
            assertFalse(balance.isNegative());
            assertEquals(balance, auditLog.reconstructBalance(account, Currency.USD));
            total = total.add(balance);
        }
        assertEquals(usd("2000.00"), total);
    }

    @Test
    void testSameKeySubmittedConcurrentlyCommitsOnce() throws Exception {
        String a = open(Currency.USD, "100.00");
        String b = open(Currency.USD, "0");
        String key = IdempotencyKey.generate();

        List<CompletableFuture<TransferResult>> attempts = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            attempts.add(transactionEngine.submitTransfer(a, b, usd("10.00"), key));
        }
        CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0])).get(60, TimeUnit.SECONDS);

        Set<String> transactionIds = attempts.stream()
            .map(CompletableFuture::join)
            .map(TransferResult::getTransactionId)
            .collect(Collectors.toSet());
        assertEquals(1, transactionIds.size());
        assertEquals(usd("90.00"), balanceOf(a));
        assertEquals(usd("10.00"), balanceOf(b));
    }

    private String open(Currency currency, String initial) {
        String accountId = accountService.openAccount("concurrency-owner", currency).getAccountId();
        Money amount = Money.of(initial, currency);
        if (amount.isPositive()) {
            transactionEngine.deposit(accountId, amount, IdempotencyKey.generate());
        }
        return accountId;
    }

    private Money balanceOf(String accountId) {
        return accountService.getAccount(accountId).getBalance();
    }

    private static Money usd(String amount) {
        return Money.of(amount, Currency.USD);
    }
}
