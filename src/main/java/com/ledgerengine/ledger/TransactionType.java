package com.ledgerengine.ledger;

/**
 * Direction of a ledger transaction relative to the account it is scoped to.
 */
public enum TransactionType {
    /**
     * Money into the account named by {@code toAccountId}.
     */
    CREDIT,

    /**
     * Money out of the account named by {@code fromAccountId}.
     */
    DEBIT
}
