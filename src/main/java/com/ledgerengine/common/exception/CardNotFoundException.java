package com.ledgerengine.common.exception;

/**
 * Thrown when a card is not found.
 */
public class CardNotFoundException extends LedgerEngineException {

    public CardNotFoundException(String cardId) {
        super("Card not found: " + cardId);
    }

    public static CardNotFoundException forAccount(String accountId) {
        return new CardNotFoundException("no card issued for account " + accountId);
    }
}
