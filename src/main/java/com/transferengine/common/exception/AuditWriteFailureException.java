package com.transferengine.common.exception;

/**
 * Thrown when the audit record of a mutation could not be written. The
 * mutation it belonged to has been rolled back.
 */
public class AuditWriteFailureException extends TransferEngineException {

    public AuditWriteFailureException(String transactionId, Throwable cause) {
        super("Failed to write audit record for transaction " + transactionId,
            null, null, TransactionStage.AUDIT, cause);
    }
}
