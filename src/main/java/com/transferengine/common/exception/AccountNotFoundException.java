package com.transferengine.common.exception;

/**
 * Thrown when an account is not found.
 */
public class AccountNotFoundException extends TransferEngineException {

    public AccountNotFoundException(String accountId) {
        super("Account not found: " + accountId, accountId, null, TransactionStage.VALIDATION);
    }
}
