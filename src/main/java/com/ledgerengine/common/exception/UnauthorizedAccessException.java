package com.ledgerengine.common.exception;

/**
 * Thrown when an account holder addresses an account owned by someone else.
 */
public class UnauthorizedAccessException extends LedgerEngineException {

    public UnauthorizedAccessException(String accountId) {
        super("Account holder does not have access to account " + accountId);
    }
}
