package com.ledgerengine.common.exception;

/**
 * Base exception for all ledger engine exceptions.
 */
public class LedgerEngineException extends RuntimeException {

    public LedgerEngineException(String message) {
        super(message);
    }

    public LedgerEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
