package com.transferengine.accounts;

import com.transferengine.common.Currency;
import com.transferengine.common.exception.AccountClosedException;
import com.transferengine.common.exception.AccountNotFoundException;
import com.transferengine.common.exception.TransactionStage;
import com.transferengine.ledger.AccountLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service for managing accounts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;
    private final AccountLedger accountLedger;

    /**
     * Opens an account with a zero balance. Funding goes through a deposit so
     * that it is audited like any other balance change.
     */
    @Transactional
    public Account openAccount(String ownerId, Currency currency) {
        Account account = accountRepository.save(new Account(ownerId, currency));
        log.info("Opened account {} for owner {} in {}", account.getAccountId(), ownerId, currency);
        return account;
    }

    @Transactional(readOnly = true)
    public Account getAccount(String accountId) {
        return accountRepository.findByAccountId(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    /**
     * Loads an account and fails unless it is open.
     */
    @Transactional(readOnly = true)
    public Account getOpenAccount(String accountId) {
        Account account = getAccount(accountId);
        if (!account.isOpen()) {
            throw new AccountClosedException(accountId, TransactionStage.VALIDATION);
        }
        return account;
    }

    @Transactional(readOnly = true)
    public List<Account> getAccountsByOwner(String ownerId) {
        return accountRepository.findByOwnerIdOrderByCreatedAtAsc(ownerId);
    }

    /**
     * Closes an account. When {@code expectedVersion} is given the close only
     * goes through if nobody changed the account since the caller read it.
     *
     * @throws AccountNotFoundException if no such account exists; no lock is taken
     */
    public Account closeAccount(String accountId, Long expectedVersion) {
        getAccount(accountId);
        Account closed = accountLedger.executeLocked(List.of(accountId),
            () -> accountLedger.close(accountId, expectedVersion));
        log.info("Closed account {} with final balance {}", accountId, closed.getBalance());
        return closed;
    }
}
