package com.transferengine.common.exception;

import java.math.BigDecimal;

/**
 * Thrown for requests that can never succeed as submitted: non-positive
 * amounts, self transfers, currency mismatches, reused idempotency keys.
 */
public class InvalidTransferException extends TransferEngineException {

    public InvalidTransferException(String message) {
        super(message, null, null, TransactionStage.VALIDATION);
    }

    public InvalidTransferException(String message, String accountId, BigDecimal amount) {
        super(message, accountId, amount, TransactionStage.VALIDATION);
    }
}
