package com.ledgerengine.ledger;

import com.ledgerengine.common.Currency;
import lombok.Value;

/**
 * Cached versus computed balance for one account.
 *
 * A mismatch is a diagnostic signal, not an error: the computed value is
 * authoritative.
 */
@Value
public class BalanceCheck {
    String accountId;
    long cachedBalanceCents;
    long computedBalanceCents;
    boolean match;
    Currency currency;

    public static BalanceCheck of(String accountId, long cachedBalanceCents,
                                  long computedBalanceCents, Currency currency) {
        return new BalanceCheck(accountId, cachedBalanceCents, computedBalanceCents,
            cachedBalanceCents == computedBalanceCents, currency);
    }
}
