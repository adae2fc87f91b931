package com.transferengine.transactions;

import com.transferengine.audit.AuditRecord;
import com.transferengine.common.Money;
import com.transferengine.providers.RateSourceType;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of a committed transfer. Built from the audit record, so a replay of
 * the same idempotency key yields an equal result.
 */
@Value
public class TransferResult {
    String transactionId;
    String sourceAccountId;
    String destinationAccountId;
    Money debited;
    Money credited;
    BigDecimal appliedRate;
    RateSourceType rateSource;
    Money sourceBalance;
    Money destinationBalance;

    public static TransferResult from(AuditRecord record) {
        return new TransferResult(
            record.getTransactionId(),
            record.getSourceAccountId(),
            record.getDestinationAccountId(),
            record.getDebit(),
            record.getCredit(),
            record.getExchangeRate(),
            record.getRateSource(),
            record.getSourceBalance(),
            record.getDestinationBalance()
        );
    }
}
