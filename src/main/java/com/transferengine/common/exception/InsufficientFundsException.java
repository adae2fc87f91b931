package com.transferengine.common.exception;

import com.transferengine.common.Money;

/**
 * Thrown when an account has insufficient funds for a debit.
 */
public class InsufficientFundsException extends TransferEngineException {

    private final Money required;
    private final Money available;

    public InsufficientFundsException(String accountId, Money required, Money available) {
        super(String.format("Insufficient funds in account %s. Required: %s, Available: %s",
                accountId, required, available),
            accountId, required.getAmount(), TransactionStage.MUTATION);
        this.required = required;
        this.available = available;
    }

    public Money getRequired() {
        return required;
    }

    public Money getAvailable() {
        return available;
    }
}
