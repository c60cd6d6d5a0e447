package com.ledgerengine.cards;

/**
 * Lifecycle states for a card.
 */
public enum CardState {
    /**
     * Card can be used for debits.
     */
    ACTIVE,

    /**
     * Card is temporarily frozen. Can be unfrozen.
     */
    FROZEN,

    /**
     * Card is permanently closed. Cannot be reactivated.
     */
    CLOSED
}
