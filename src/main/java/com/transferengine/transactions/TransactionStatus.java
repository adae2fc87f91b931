package com.transferengine.transactions;

/**
 * Lifecycle of a transaction inside the engine.
 *
 * PENDING -> (RATE_RESOLVED, cross-currency only) -> LOCKED -> COMMITTED,
 * or FAILED from any state before COMMITTED. Only COMMITTED and FAILED are
 * ever persisted.
 */
public enum TransactionStatus {
    PENDING,
    RATE_RESOLVED,
    LOCKED,
    COMMITTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMMITTED || this == FAILED;
    }
}
