package com.ledgerengine.ledger;

/**
 * Reasons attached to declined results.
 */
public final class DeclineReasons {

    private DeclineReasons() {
    }

    public static String insufficientFunds(long requestedCents, long availableCents) {
        return String.format("Insufficient funds: requested %d cents, available %d cents",
            requestedCents, availableCents);
    }
}
