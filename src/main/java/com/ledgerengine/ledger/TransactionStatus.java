package com.ledgerengine.ledger;

/**
 * Outcome recorded on a ledger transaction.
 */
public enum TransactionStatus {
    /**
     * Counts towards the account balance.
     */
    APPROVED,

    /**
     * Kept for the audit trail only. Never counts towards a balance or a statement total.
     */
    DECLINED
}
