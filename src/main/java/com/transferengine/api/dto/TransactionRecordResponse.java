package com.transferengine.api.dto;

import com.transferengine.audit.AuditRecord;
import com.transferengine.common.Money;
import com.transferengine.providers.RateSourceType;
import com.transferengine.transactions.TransactionStatus;
import com.transferengine.transactions.TransactionType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One entry of an account's transaction history.
 */
@Value
public class TransactionRecordResponse {
    String transactionId;
    TransactionType type;
    TransactionStatus status;
    String sourceAccountId;
    String destinationAccountId;
    Money requested;
    Money debited;
    Money credited;
    BigDecimal exchangeRate;
    RateSourceType rateSource;
    String failureReason;
    Instant createdAt;

    public static TransactionRecordResponse from(AuditRecord record) {
        return new TransactionRecordResponse(
            record.getTransactionId(),
            record.getType(),
            record.getStatus(),
            record.getSourceAccountId(),
            record.getDestinationAccountId(),
            record.getRequested(),
            record.getDebit(),
            record.getCredit(),
            record.getExchangeRate(),
            record.getRateSource(),
            record.getFailureReason(),
            record.getCreatedAt()
        );
    }
}
