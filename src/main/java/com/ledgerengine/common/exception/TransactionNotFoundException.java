package com.ledgerengine.common.exception;

/**
 * Thrown when a transaction is not found, or is not visible from the requested account.
 */
public class TransactionNotFoundException extends LedgerEngineException {

    public TransactionNotFoundException(String transactionId) {
        super("Transaction not found: " + transactionId);
    }
}
