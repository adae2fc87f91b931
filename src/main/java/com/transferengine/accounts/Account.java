package com.transferengine.accounts;

import com.transferengine.common.Currency;
import com.transferengine.common.Money;
import com.transferengine.common.exception.AccountClosedException;
import com.transferengine.common.exception.ConcurrencyConflictException;
import com.transferengine.common.exception.InsufficientFundsException;
import com.transferengine.common.exception.TransactionStage;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A balance-holding account.
 *
 * The currency is fixed when the account is opened and the balance never goes
 * negative. Balance mutations are meant to be made by the ledger only, while it
 * holds the account's lock; {@link #version} is bumped by every committed change
 * so readers outside the lock path can detect stale copies.
 */
@Entity
@Table(name = "accounts", indexes = {
    @Index(name = "idx_accounts_owner_id", columnList = "owner_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Account {

    @Id
    @Column(name = "account_id", length = 36)
    private String accountId;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount",
            column = @Column(name = "balance_amount", nullable = false, precision = 19, scale = 4)),
        @AttributeOverride(name = "currency",
            column = @Column(name = "balance_currency", nullable = false, length = 3))
    })
    private Money balance;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private AccountStatus status;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Account(String ownerId, Currency currency) {
        this.accountId = UUID.randomUUID().toString();
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.balance = Money.zero(Objects.requireNonNull(currency, "currency"));
        this.status = AccountStatus.OPEN;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public Currency getCurrency() {
        return balance.getCurrency();
    }

    public boolean isOpen() {
        return status == AccountStatus.OPEN;
    }

    public void credit(Money amount) {
        ensureOpen();
        ensureNotNegative(amount);
        this.balance = balance.add(amount);
        this.updatedAt = Instant.now();
    }

    public void debit(Money amount) {
        ensureOpen();
        ensureNotNegative(amount);
        if (balance.isLessThan(amount)) {
            throw new InsufficientFundsException(accountId, amount, balance);
        }
        this.balance = balance.subtract(amount);
        this.updatedAt = Instant.now();
    }

    public boolean hasSufficientBalance(Money amount) {
        return balance.isGreaterThanOrEqual(amount);
    }

    public void close() {
        ensureOpen();
        this.status = AccountStatus.CLOSED;
        this.updatedAt = Instant.now();
    }

    /**
     * Fails if this copy is not at the version the caller last observed.
     */
    public void ensureVersion(long expectedVersion) {
        if (version == null || version != expectedVersion) {
            throw new ConcurrencyConflictException(accountId,
                String.format("Account %s is at version %s, expected %d", accountId, version, expectedVersion),
                TransactionStage.MUTATION);
        }
    }

    private void ensureOpen() {
        if (!isOpen()) {
            throw new AccountClosedException(accountId, TransactionStage.MUTATION);
        }
    }

    private static void ensureNotNegative(Money amount) {
        if (amount.isNegative()) {
            throw new IllegalArgumentException("Ledger amounts must not be negative: " + amount);
        }
    }
}
