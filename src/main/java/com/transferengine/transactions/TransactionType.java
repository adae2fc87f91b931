package com.transferengine.transactions;

/**
 * Kinds of transactions the engine executes.
 */
public enum TransactionType {
    DEPOSIT,
    WITHDRAWAL,
    TRANSFER
}
