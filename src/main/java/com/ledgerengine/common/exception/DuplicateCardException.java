package com.ledgerengine.common.exception;

/**
 * Thrown when issuing a card for an account that already has one.
 */
public class DuplicateCardException extends LedgerEngineException {

    public DuplicateCardException(String accountId) {
        super("Account " + accountId + " already has a card");
    }
}
