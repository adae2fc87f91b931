package com.transferengine.transactions;

import com.transferengine.audit.AuditRecord;
import com.transferengine.common.Money;
import com.transferengine.common.exception.TransferEngineException;
import com.transferengine.providers.ExchangeRate;
import com.transferengine.providers.RateSourceType;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * In-flight state of one transaction while the engine works on it. Tracks how
 * far it got through PENDING, RATE_RESOLVED and LOCKED so a failure can be
 * audited with the stage it reached.
 */
@Getter
class TransactionAttempt {

    private final String transactionId = UUID.randomUUID().toString();
    private final TransactionType type;
    private final String sourceAccountId;
    private final String destinationAccountId;
    private final Money requested;
    private final String idempotencyKey;

    private volatile TransactionStatus status = TransactionStatus.PENDING;
    private volatile TransactionStatus stageReached = TransactionStatus.PENDING;
    private volatile Money credit;
    private volatile BigDecimal appliedRate;
    private volatile RateSourceType rateSource;

    TransactionAttempt(TransactionType type, String sourceAccountId, String destinationAccountId,
                       Money requested, String idempotencyKey) {
        this.type = type;
        this.sourceAccountId = sourceAccountId;
        this.destinationAccountId = destinationAccountId;
        this.requested = requested;
        this.idempotencyKey = idempotencyKey;
    }

    void setCredit(Money credit) {
        this.credit = credit;
    }

    void rateResolved(ExchangeRate rate) {
        this.appliedRate = rate.getRate();
        this.rateSource = rate.getSource();
        if (rate.getSource() != RateSourceType.IDENTITY) {
            advance(TransactionStatus.RATE_RESOLVED);
        }
    }

    void locked() {
        advance(TransactionStatus.LOCKED);
    }

    void committed() {
        advance(TransactionStatus.COMMITTED);
    }

    void failed() {
        if (status == TransactionStatus.COMMITTED) {
            throw new IllegalStateException("Transaction " + transactionId + " already committed");
        }
        this.status = TransactionStatus.FAILED;
    }

    AuditRecord committedRecord(Money sourceBalance, Money destinationBalance) {
        return AuditRecord.builder()
            .transactionId(transactionId)
            .type(type)
            .status(TransactionStatus.COMMITTED)
            .sourceAccountId(sourceAccountId)
            .destinationAccountId(destinationAccountId)
            .requested(requested)
            .debit(sourceAccountId == null ? null : requested)
            .credit(destinationAccountId == null ? null : credit)
            .exchangeRate(appliedRate)
            .rateSource(rateSource)
            .sourceBalanceAfter(sourceBalance)
            .destinationBalanceAfter(destinationBalance)
            .idempotencyKey(idempotencyKey)
            .build();
    }

    AuditRecord failedRecord(RuntimeException failure) {
        String reason = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        if (failure instanceof TransferEngineException) {
            reason = failure.getClass().getSimpleName() + ": " + reason;
        }
        return AuditRecord.builder()
            .transactionId(transactionId)
            .type(type)
            .status(TransactionStatus.FAILED)
            .sourceAccountId(sourceAccountId)
            .destinationAccountId(destinationAccountId)
            .requested(requested)
            .credit(credit)
            .exchangeRate(appliedRate)
            .rateSource(rateSource)
            .idempotencyKey(idempotencyKey)
            .failureReason(reason)
            .failureStage(stageReached.name())
            .build();
    }

    private void advance(TransactionStatus next) {
        this.status = next;
        this.stageReached = next;
    }
}
