package com.transferengine.common.exception;

import java.math.BigDecimal;

/**
 * Base exception for all transfer engine exceptions.
 *
 * Carries the account and amount involved, when known, and the stage the
 * transaction had reached so callers can build user-facing messages.
 */
public class TransferEngineException extends RuntimeException {

    private final String accountId;
    private final BigDecimal amount;
    private final TransactionStage stage;

    public TransferEngineException(String message) {
        this(message, null, null, null, null);
    }

    public TransferEngineException(String message, Throwable cause) {
        this(message, null, null, null, cause);
    }

    public TransferEngineException(String message, String accountId, BigDecimal amount,
                                   TransactionStage stage) {
        this(message, accountId, amount, stage, null);
    }

    public TransferEngineException(String message, String accountId, BigDecimal amount,
                                   TransactionStage stage, Throwable cause) {
        super(message, cause);
        this.accountId = accountId;
        this.amount = amount;
        this.stage = stage;
    }

    public String getAccountId() {
        return accountId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public TransactionStage getStage() {
        return stage;
    }

    /**
     * Whether retrying the same request later may succeed.
     */
    public boolean isRetryable() {
        return false;
    }
}
