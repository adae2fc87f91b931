package com.transferengine.common.exception;

/**
 * Thrown when the account store kept failing with transient errors after the
 * bounded retries were used up.
 */
public class AccountStoreException extends TransferEngineException {

    public AccountStoreException(String message, TransactionStage stage, Throwable cause) {
        super(message, null, null, stage, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
