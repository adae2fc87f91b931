package com.transferengine.common.exception;

/**
 * Thrown when an account changed underneath a caller (stale version) or its
 * lock could not be obtained in time. Nothing was mutated.
 */
public class ConcurrencyConflictException extends TransferEngineException {

    public ConcurrencyConflictException(String accountId, String message, TransactionStage stage) {
        super(message, accountId, null, stage);
    }

    public ConcurrencyConflictException(String accountId, String message, TransactionStage stage,
                                        Throwable cause) {
        super(message, accountId, null, stage, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
