package com.ledgerengine.statement;

import com.ledgerengine.ledger.LedgerTransaction;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Monthly statement for one account, derived from the ledger on request.
 *
 * Totals cover approved transactions only; {@code transactions} lists every
 * record of the period, declined ones included, oldest first.
 */
@Value
@Builder
public class StatementView {
    String accountId;
    int year;
    int month;
    long openingBalanceCents;
    long closingBalanceCents;
    long totalCreditsCents;
    long totalDebitsCents;
    List<LedgerTransaction> transactions;

    public int getTransactionCount() {
        return transactions.size();
    }
}
