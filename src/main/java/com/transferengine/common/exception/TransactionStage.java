package com.transferengine.common.exception;

/**
 * Point in the processing of a transaction at which an error was raised.
 */
public enum TransactionStage {
    VALIDATION,
    RATE_RESOLUTION,
    LOCKING,
    MUTATION,
    AUDIT
}
