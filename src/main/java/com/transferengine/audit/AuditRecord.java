package com.transferengine.audit;

import com.transferengine.common.Currency;
import com.transferengine.common.Money;
import com.transferengine.providers.RateSourceType;
import com.transferengine.transactions.TransactionStatus;
import com.transferengine.transactions.TransactionType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of a committed or failed transaction.
 *
 * Holds enough to replay the balance change it describes: what left the source,
 * what reached the destination, the rate applied and both resulting balances.
 * Records are never updated once written.
 */
@Entity
@Table(name = "audit_records", indexes = {
    @Index(name = "idx_audit_idempotency_key", columnList = "idempotency_key"),
    @Index(name = "idx_audit_source_account", columnList = "source_account_id"),
    @Index(name = "idx_audit_destination_account", columnList = "destination_account_id"),
    @Index(name = "idx_audit_created_at", columnList = "created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AuditRecord {

    static final int RATE_SCALE = 10;

    @Id
    @Column(name = "record_id", length = 36)
    private String recordId;

    @Column(name = "transaction_id", nullable = false, length = 36, updatable = false)
    private String transactionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 12, updatable = false)
    private TransactionType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 12, updatable = false)
    private TransactionStatus status;

    @Column(name = "source_account_id", length = 36, updatable = false)
    private String sourceAccountId;

    @Column(name = "destination_account_id", length = 36, updatable = false)
    private String destinationAccountId;

    @Column(name = "requested_amount", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal requestedAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "requested_currency", nullable = false, length = 3, updatable = false)
    private Currency requestedCurrency;

    @Column(name = "debit_amount", precision = 19, scale = 4, updatable = false)
    private BigDecimal debitAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "debit_currency", length = 3, updatable = false)
    private Currency debitCurrency;

    @Column(name = "credit_amount", precision = 19, scale = 4, updatable = false)
    private BigDecimal creditAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "credit_currency", length = 3, updatable = false)
    private Currency creditCurrency;

    @Column(name = "exchange_rate", precision = 24, scale = RATE_SCALE, updatable = false)
    private BigDecimal exchangeRate;

    @Enumerated(EnumType.STRING)
    @Column(name = "rate_source", length = 10, updatable = false)
    private RateSourceType rateSource;

    @Column(name = "source_balance_after", precision = 19, scale = 4, updatable = false)
    private BigDecimal sourceBalanceAfter;

    @Column(name = "destination_balance_after", precision = 19, scale = 4, updatable = false)
    private BigDecimal destinationBalanceAfter;

    @Column(name = "idempotency_key", nullable = false, length = 100, updatable = false)
    private String idempotencyKey;

    /**
     * Copy of the idempotency key on COMMITTED records only. The unique constraint
     * guarantees a key commits at most once; FAILED records leave it null.
     */
    @Column(name = "committed_key", length = 100, unique = true, updatable = false)
    private String committedKey;

    @Column(name = "failure_reason", length = 500, updatable = false)
    private String failureReason;

    @Column(name = "failure_stage", length = 20, updatable = false)
    private String failureStage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Builder
    private AuditRecord(String transactionId, TransactionType type, TransactionStatus status,
                        String sourceAccountId, String destinationAccountId, Money requested,
                        Money debit, Money credit, BigDecimal exchangeRate, RateSourceType rateSource,
                        Money sourceBalanceAfter, Money destinationBalanceAfter, String idempotencyKey,
                        String failureReason, String failureStage) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Only committed or failed transactions are audited: " + status);
        }
        this.recordId = UUID.randomUUID().toString();
        this.transactionId = transactionId;
        this.type = type;
        this.status = status;
        this.sourceAccountId = sourceAccountId;
        this.destinationAccountId = destinationAccountId;
        this.requestedAmount = requested.getAmount();
        this.requestedCurrency = requested.getCurrency();
        if (debit != null) {
            this.debitAmount = debit.getAmount();
            this.debitCurrency = debit.getCurrency();
        }
        if (credit != null) {
            this.creditAmount = credit.getAmount();
            this.creditCurrency = credit.getCurrency();
        }
        this.exchangeRate = exchangeRate == null ? null : exchangeRate.setScale(RATE_SCALE, RoundingMode.HALF_EVEN);
        this.rateSource = rateSource;
        this.sourceBalanceAfter = sourceBalanceAfter == null ? null : sourceBalanceAfter.getAmount();
        this.destinationBalanceAfter = destinationBalanceAfter == null ? null : destinationBalanceAfter.getAmount();
        this.idempotencyKey = idempotencyKey;
        this.committedKey = status == TransactionStatus.COMMITTED ? idempotencyKey : null;
        this.failureReason = truncate(failureReason, 500);
        this.failureStage = failureStage;
        this.createdAt = Instant.now();
    }

    public boolean isCommitted() {
        return status == TransactionStatus.COMMITTED;
    }

    public Money getRequested() {
        return Money.of(requestedAmount, requestedCurrency);
    }

    public Money getDebit() {
        return debitAmount == null ? null : Money.of(debitAmount, debitCurrency);
    }

    public Money getCredit() {
        return creditAmount == null ? null : Money.of(creditAmount, creditCurrency);
    }

    public Money getSourceBalance() {
        return sourceBalanceAfter == null ? null : Money.of(sourceBalanceAfter, debitCurrency);
    }

    public Money getDestinationBalance() {
        return destinationBalanceAfter == null ? null : Money.of(destinationBalanceAfter, creditCurrency);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
