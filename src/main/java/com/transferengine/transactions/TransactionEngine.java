package com.transferengine.transactions;

import com.transferengine.accounts.Account;
import com.transferengine.accounts.AccountService;
import com.transferengine.audit.AuditLog;
import com.transferengine.audit.AuditRecord;
import com.transferengine.common.Currency;
import com.transferengine.common.IdempotencyKey;
import com.transferengine.common.Money;
import com.transferengine.common.exception.InvalidTransferException;
import com.transferengine.ledger.AccountLedger;
import com.transferengine.ledger.LedgerBalances;
import com.transferengine.providers.ExchangeRate;
import com.transferengine.providers.FXProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Executes deposits, withdrawals and transfers.
 *
 * Transfer flow:
 * 1. Replay a committed result if the idempotency key already committed
 * 2. Validate amount and accounts
 * 3. Resolve the exchange rate if the currencies differ (no locks held)
 * 4. Lock both accounts in ascending id order
 * 5. Re-check idempotency and balance, debit source, credit destination
 * 6. Append the audit record in the same database transaction and commit
 *
 * Any failure before commit leaves balances untouched and is audited as FAILED.
 */
@Service
@Slf4j
public class TransactionEngine {

    private final AccountService accountService;
    private final AccountLedger accountLedger;
    private final FXProvider fxProvider;
    private final AuditLog auditLog;
    private final Executor transactionExecutor;
    private final Clock clock;

    public TransactionEngine(AccountService accountService,
                             AccountLedger accountLedger,
                             FXProvider fxProvider,
                             AuditLog auditLog,
                             @Qualifier("transactionExecutor") Executor transactionExecutor) {
        this.accountService = accountService;
        this.accountLedger = accountLedger;
        this.fxProvider = fxProvider;
        this.auditLog = auditLog;
        this.transactionExecutor = transactionExecutor;
        this.clock = Clock.systemUTC();
    }

    /**
     * Credits an account. An amount in another currency is converted into the
     * account's currency first.
     */
    public BalanceResult deposit(String accountId, Money amount, String idempotencyKey) {
        requireRequest(amount, idempotencyKey);
        Objects.requireNonNull(accountId, "accountId");
        Optional<AuditRecord> prior = auditLog.findCommitted(idempotencyKey);
        if (prior.isPresent()) {
            return BalanceResult.from(verifyReplay(prior.get(), TransactionType.DEPOSIT, null, accountId, amount));
        }

        TransactionAttempt attempt = new TransactionAttempt(TransactionType.DEPOSIT, null, accountId, amount,
            idempotencyKey);
        try {
            requirePositive(accountId, amount);
            Account account = accountService.getOpenAccount(accountId);

            Money credit = amount;
            if (amount.getCurrency() != account.getCurrency()) {
                ExchangeRate rate = fxProvider.getRate(amount.getCurrency(), account.getCurrency());
                credit = convert(accountId, amount, rate, account.getCurrency());
                attempt.rateResolved(rate);
                requireConvertedPositive(accountId, amount, credit);
            }
            attempt.setCredit(credit);

            AuditRecord record = accountLedger.executeLocked(List.of(accountId), () -> {
                attempt.locked();
                Optional<AuditRecord> committed = auditLog.findCommitted(idempotencyKey);
                if (committed.isPresent()) {
                    return verifyReplay(committed.get(), TransactionType.DEPOSIT, null, accountId, amount);
                }
                Money balance = accountLedger.deposit(accountId, attempt.getCredit());
                return auditLog.recordCommitted(attempt.committedRecord(null, balance));
            });

            attempt.committed();
            log.info("Deposit {} COMMITTED: account={}, amount={}, credited={}",
                record.getTransactionId(), accountId, amount, record.getCredit());
            return BalanceResult.from(record);

        } catch (RuntimeException e) {
            recordFailure(attempt, e);
            throw e;
        }
    }

    /**
     * Debits an account. The amount must be in the account's currency.
     */
    public BalanceResult withdraw(String accountId, Money amount, String idempotencyKey) {
        requireRequest(amount, idempotencyKey);
        Objects.requireNonNull(accountId, "accountId");
        Optional<AuditRecord> prior = auditLog.findCommitted(idempotencyKey);
        if (prior.isPresent()) {
            return BalanceResult.from(verifyReplay(prior.get(), TransactionType.WITHDRAWAL, accountId, null, amount));
        }

        TransactionAttempt attempt = new TransactionAttempt(TransactionType.WITHDRAWAL, accountId, null, amount,
            idempotencyKey);
        try {
            requirePositive(accountId, amount);
            Account account = accountService.getOpenAccount(accountId);
            requireAccountCurrency(account, amount);

            AuditRecord record = accountLedger.executeLocked(List.of(accountId), () -> {
                attempt.locked();
                Optional<AuditRecord> committed = auditLog.findCommitted(idempotencyKey);
                if (committed.isPresent()) {
                    return verifyReplay(committed.get(), TransactionType.WITHDRAWAL, accountId, null, amount);
                }
                Money balance = accountLedger.withdraw(accountId, amount);
                return auditLog.recordCommitted(attempt.committedRecord(balance, null));
            });

            attempt.committed();
            log.info("Withdrawal {} COMMITTED: account={}, amount={}",
                record.getTransactionId(), accountId, amount);
            return BalanceResult.from(record);

        } catch (RuntimeException e) {
            recordFailure(attempt, e);
            throw e;
        }
    }

    /**
     * Moves {@code amount}, denominated in the source account's currency, from
     * source to destination. Cross-currency credits are rounded HALF_EVEN to
     * the destination currency; the source is debited the exact amount.
     */
    public TransferResult transfer(String sourceId, String destinationId, Money amount, String idempotencyKey) {
        requireRequest(amount, idempotencyKey);
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(destinationId, "destinationId");

        Optional<AuditRecord> prior = auditLog.findCommitted(idempotencyKey);
        if (prior.isPresent()) {
            return TransferResult.from(
                verifyReplay(prior.get(), TransactionType.TRANSFER, sourceId, destinationId, amount));
        }

        TransactionAttempt attempt = new TransactionAttempt(TransactionType.TRANSFER, sourceId, destinationId,
            amount, idempotencyKey);
        try {
            requirePositive(sourceId, amount);
            if (sourceId.equals(destinationId)) {
                throw new InvalidTransferException("Cannot transfer to the same account", sourceId,
                    amount.getAmount());
            }
            Account source = accountService.getOpenAccount(sourceId);
            Account destination = accountService.getOpenAccount(destinationId);
            requireAccountCurrency(source, amount);

            Money credit = amount;
            ExchangeRate rate = ExchangeRate.identity(source.getCurrency(), clock.instant());
            if (source.getCurrency() != destination.getCurrency()) {
                rate = fxProvider.getRate(source.getCurrency(), destination.getCurrency());
                credit = convert(destinationId, amount, rate, destination.getCurrency());
                requireConvertedPositive(destinationId, amount, credit);
            }
            attempt.rateResolved(rate);
            attempt.setCredit(credit);

            AuditRecord record = accountLedger.executeLocked(List.of(sourceId, destinationId), () -> {
                attempt.locked();
                Optional<AuditRecord> committed = auditLog.findCommitted(idempotencyKey);
                if (committed.isPresent()) {
                    return verifyReplay(committed.get(), TransactionType.TRANSFER, sourceId, destinationId, amount);
                }
                LedgerBalances balances = accountLedger.transferLocked(sourceId, destinationId, amount,
                    attempt.getCredit());
                return auditLog.recordCommitted(
                    attempt.committedRecord(balances.getSourceBalance(), balances.getDestinationBalance()));
            });

            attempt.committed();
            log.info("Transfer {} COMMITTED: {} -> {}, debited={}, credited={}, rate={}",
                record.getTransactionId(), sourceId, destinationId, record.getDebit(), record.getCredit(),
                record.getExchangeRate());
            return TransferResult.from(record);

        } catch (RuntimeException e) {
            recordFailure(attempt, e);
            throw e;
        }
    }

    /**
     * Runs a transfer on the engine's worker pool.
     */
    public CompletableFuture<TransferResult> submitTransfer(String sourceId, String destinationId, Money amount,
                                                            String idempotencyKey) {
        return CompletableFuture.supplyAsync(
            () -> transfer(sourceId, destinationId, amount, idempotencyKey), transactionExecutor);
    }

    /**
     * Runs a deposit on the engine's worker pool.
     */
    public CompletableFuture<BalanceResult> submitDeposit(String accountId, Money amount, String idempotencyKey) {
        return CompletableFuture.supplyAsync(
            () -> deposit(accountId, amount, idempotencyKey), transactionExecutor);
    }

    private AuditRecord verifyReplay(AuditRecord prior, TransactionType type, String sourceId,
                                     String destinationId, Money requested) {
        boolean sameRequest = prior.getType() == type
            && Objects.equals(prior.getSourceAccountId(), sourceId)
            && Objects.equals(prior.getDestinationAccountId(), destinationId)
            && prior.getRequested().equals(requested);
        if (!sameRequest) {
            throw new InvalidTransferException(
                "Idempotency key " + prior.getIdempotencyKey() + " was already used for a different request");
        }
        log.info("Replaying committed {} {} for idempotency key {}",
            type, prior.getTransactionId(), prior.getIdempotencyKey());
        return prior;
    }

    private void recordFailure(TransactionAttempt attempt, RuntimeException failure) {
        attempt.failed();
        log.warn("{} {} FAILED at {}: {}", attempt.getType(), attempt.getTransactionId(),
            attempt.getStageReached(), failure.getMessage());
        try {
            auditLog.recordFailed(attempt.failedRecord(failure));
        } catch (RuntimeException auditFailure) {
            log.error("Could not audit failed {} {}", attempt.getType(), attempt.getTransactionId(), auditFailure);
            failure.addSuppressed(auditFailure);
        }
    }

    private static void requireRequest(Money amount, String idempotencyKey) {
        IdempotencyKey.validate(idempotencyKey);
        if (amount == null) {
            throw new InvalidTransferException("Amount is required");
        }
    }

    private static void requirePositive(String accountId, Money amount) {
        if (!amount.isPositive()) {
            throw new InvalidTransferException("Amount must be positive: " + amount, accountId, amount.getAmount());
        }
    }

    private static void requireAccountCurrency(Account account, Money amount) {
        if (account.getCurrency() != amount.getCurrency()) {
            throw new InvalidTransferException(
                String.format("Amount currency %s does not match account currency %s",
                    amount.getCurrency(), account.getCurrency()),
                account.getAccountId(), amount.getAmount());
        }
    }

    private static Money convert(String accountId, Money amount, ExchangeRate rate, Currency target) {
        try {
            return amount.convert(rate.getRate(), target);
        } catch (IllegalArgumentException e) {
            throw new InvalidTransferException(
                String.format("%s at rate %s cannot be credited: %s", amount, rate.getRate(), e.getMessage()),
                accountId, amount.getAmount());
        }
    }

    private static void requireConvertedPositive(String accountId, Money amount, Money converted) {
        if (!converted.isPositive()) {
            throw new InvalidTransferException(
                String.format("%s converts to %s, which rounds to nothing", amount, converted),
                accountId, amount.getAmount());
        }
    }
}
