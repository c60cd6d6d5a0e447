package com.ledgerengine.accounts;

/**
 * Types of accounts an account holder can open.
 */
public enum AccountType {
    CHECKING,
    SAVINGS
}
