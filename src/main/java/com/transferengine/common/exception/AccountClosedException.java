package com.transferengine.common.exception;

/**
 * Thrown when a mutation targets an account whose balance is frozen.
 */
public class AccountClosedException extends TransferEngineException {

    public AccountClosedException(String accountId, TransactionStage stage) {
        super("Account is closed: " + accountId, accountId, null, stage);
    }
}
