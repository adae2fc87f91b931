package com.transferengine.accounts;

/**
 * Lifecycle of an account. Accounts are never deleted; closing freezes the balance.
 */
public enum AccountStatus {
    OPEN,
    CLOSED
}
