package com.transferengine.ledger;

import com.transferengine.accounts.Account;
import com.transferengine.accounts.AccountRepository;
import com.transferengine.common.Money;
import com.transferengine.common.exception.AccountClosedException;
import com.transferengine.common.exception.AccountNotFoundException;
import com.transferengine.common.exception.AccountStoreException;
import com.transferengine.common.exception.ConcurrencyConflictException;
import com.transferengine.common.exception.InsufficientFundsException;
import com.transferengine.common.exception.InvalidTransferException;
import com.transferengine.common.exception.TransactionStage;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

/**
 * Owner of account balances.
 *
 * Every balance change happens inside {@link #executeLocked}: the locks of the
 * accounts involved are taken first (ascending id order), then a database
 * transaction is opened, the work runs, the transaction commits, and only then
 * are the locks released. The mutation primitives refuse to run outside such a
 * section, so nothing can read-modify-write a balance without exclusive access.
 */
@Service
@Slf4j
public class AccountLedger {

    private final AccountRepository accountRepository;
    private final AccountLockManager lockManager;
    private final TransactionTemplate transactionTemplate;
    private final Retry storeRetry;

    public AccountLedger(AccountRepository accountRepository,
                         AccountLockManager lockManager,
                         @Qualifier("ledgerTransactionTemplate") TransactionTemplate transactionTemplate,
                         @Qualifier("ledgerStoreRetry") Retry storeRetry) {
        this.accountRepository = accountRepository;
        this.lockManager = lockManager;
        this.transactionTemplate = transactionTemplate;
        this.storeRetry = storeRetry;
    }

    /**
     * Runs {@code work} as one atomic unit while holding the locks of the given
     * accounts. Either everything the work wrote is committed or none of it is.
     *
     * Once the locks are granted the unit runs to completion; it is not
     * interrupted part way. Transient store failures roll the unit back and it is
     * retried from the start, still under the same locks.
     */
    public <T> T executeLocked(Collection<String> accountIds, Supplier<T> work) {
        return lockManager.withLocks(accountIds, () -> {
            Supplier<T> unit = () -> transactionTemplate.execute(status -> work.get());
            try {
                return Retry.decorateSupplier(storeRetry, unit).get();
            } catch (OptimisticLockingFailureException e) {
                String accountId = accountIds.isEmpty() ? null : accountIds.iterator().next();
                throw new ConcurrencyConflictException(accountId,
                    "Account was modified concurrently outside the ledger: " + accountIds,
                    TransactionStage.MUTATION, e);
            } catch (TransientDataAccessException | TransactionException e) {
                throw new AccountStoreException("Account store failure while mutating " + accountIds,
                    TransactionStage.MUTATION, e);
            } catch (DataAccessException e) {
                throw new AccountStoreException("Account store rejected the mutation of " + accountIds,
                    TransactionStage.MUTATION, e);
            }
        });
    }

    /**
     * Credits an account. Must run inside {@link #executeLocked}.
     *
     * @return the new balance
     */
    public Money deposit(String accountId, Money amount) {
        requirePositive(accountId, amount);
        Account account = loadLocked(accountId);
        requireCurrency(account, amount);
        requireHeadroom(account, amount);
        account.credit(amount);
        accountRepository.saveAndFlush(account);
        log.debug("Credited {} to account {}, balance now {}", amount, accountId, account.getBalance());
        return account.getBalance();
    }

    /**
     * Debits an account. Must run inside {@link #executeLocked}.
     *
     * @return the new balance
     * @throws InsufficientFundsException if the balance is below {@code amount}
     */
    public Money withdraw(String accountId, Money amount) {
        requirePositive(accountId, amount);
        Account account = loadLocked(accountId);
        requireCurrency(account, amount);
        account.debit(amount);
        accountRepository.saveAndFlush(account);
        log.debug("Debited {} from account {}, balance now {}", amount, accountId, account.getBalance());
        return account.getBalance();
    }

    /**
     * Moves value between two accounts whose locks the caller holds. Both
     * accounts are checked before either is touched, and any failure rolls back
     * the surrounding unit, so no partial transfer is ever observable.
     */
    public LedgerBalances transferLocked(String sourceId, String destinationId, Money debit, Money credit) {
        if (sourceId.equals(destinationId)) {
            throw new InvalidTransferException("Source and destination accounts must differ", sourceId,
                debit.getAmount());
        }
        if (debit.isNegative() || credit.isNegative()) {
            throw new InvalidTransferException("Transfer amounts must not be negative", sourceId,
                debit.getAmount());
        }

        // Row locks in the same global order as the in-process locks.
        Account source = null;
        Account destination = null;
        for (String accountId : AccountLockManager.lockOrder(List.of(sourceId, destinationId))) {
            Account account = loadLocked(accountId);
            if (accountId.equals(sourceId)) {
                source = account;
            } else {
                destination = account;
            }
        }

        if (!source.isOpen()) {
            throw new AccountClosedException(sourceId, TransactionStage.MUTATION);
        }
        if (!destination.isOpen()) {
            throw new AccountClosedException(destinationId, TransactionStage.MUTATION);
        }
        requireCurrency(source, debit);
        requireCurrency(destination, credit);
        requireHeadroom(destination, credit);
        if (!source.hasSufficientBalance(debit)) {
            throw new InsufficientFundsException(sourceId, debit, source.getBalance());
        }

        source.debit(debit);
        destination.credit(credit);
        accountRepository.saveAll(List.of(source, destination));
        accountRepository.flush();

        log.debug("Moved {} from {} to {} as {}", debit, sourceId, destinationId, credit);
        return new LedgerBalances(source.getBalance(), destination.getBalance());
    }

    /**
     * Closes an account, freezing its balance. Must run inside {@link #executeLocked}.
     *
     * @param expectedVersion version the caller last read, or null to skip the check
     */
    public Account close(String accountId, Long expectedVersion) {
        Account account = loadLocked(accountId);
        if (expectedVersion != null) {
            account.ensureVersion(expectedVersion);
        }
        account.close();
        return accountRepository.saveAndFlush(account);
    }

    private Account loadLocked(String accountId) {
        if (!lockManager.isHeldByCurrentThread(accountId)) {
            throw new IllegalStateException("Lock on account " + accountId + " is not held by this thread");
        }
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("Ledger mutations require an active transaction");
        }
        return accountRepository.findForUpdate(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    private static void requirePositive(String accountId, Money amount) {
        if (amount == null || !amount.isPositive()) {
            throw new InvalidTransferException("Amount must be positive",
                accountId, amount == null ? null : amount.getAmount());
        }
    }

    private static void requireHeadroom(Account account, Money credit) {
        if (!Money.isWithinRange(account.getBalance().getAmount().add(credit.getAmount()))) {
            throw new InvalidTransferException(
                String.format("Crediting %s would take account %s past the maximum balance",
                    credit, account.getAccountId()),
                account.getAccountId(), credit.getAmount());
        }
    }

    private static void requireCurrency(Account account, Money amount) {
        if (account.getCurrency() != amount.getCurrency()) {
            throw new InvalidTransferException(
                String.format("Amount currency %s does not match account currency %s",
                    amount.getCurrency(), account.getCurrency()),
                account.getAccountId(), amount.getAmount());
        }
    }
}
