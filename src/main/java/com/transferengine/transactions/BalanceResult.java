package com.transferengine.transactions;

import com.transferengine.audit.AuditRecord;
import com.transferengine.common.Money;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of a committed deposit or withdrawal.
 */
@Value
public class BalanceResult {
    String transactionId;
    String accountId;
    TransactionType type;
    Money amount;
    BigDecimal appliedRate;
    Money newBalance;

    public static BalanceResult from(AuditRecord record) {
        boolean deposit = record.getType() == TransactionType.DEPOSIT;
        return new BalanceResult(
            record.getTransactionId(),
            deposit ? record.getDestinationAccountId() : record.getSourceAccountId(),
            record.getType(),
            deposit ? record.getCredit() : record.getDebit(),
            record.getExchangeRate(),
            deposit ? record.getDestinationBalance() : record.getSourceBalance()
        );
    }
}
