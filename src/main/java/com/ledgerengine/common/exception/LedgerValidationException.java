package com.ledgerengine.common.exception;

/**
 * Thrown when a request is malformed or misuses a resource.
 *
 * Raised before anything is written to the ledger. Business declines such as
 * insufficient funds are not validation errors; they are returned as results.
 */
public class LedgerValidationException extends LedgerEngineException {

    public LedgerValidationException(String message) {
        super(message);
    }
}
