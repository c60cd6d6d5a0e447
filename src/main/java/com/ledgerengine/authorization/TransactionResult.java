package com.ledgerengine.authorization;

import com.ledgerengine.ledger.LedgerTransaction;
import com.ledgerengine.ledger.TransactionStatus;
import lombok.Value;

/**
 * Outcome of an authorization. Both outcomes have been committed to the ledger.
 */
@Value
public class TransactionResult {
    TransactionStatus status;
    LedgerTransaction transaction;
    String declineReason;

    public static TransactionResult approved(LedgerTransaction transaction) {
        return new TransactionResult(TransactionStatus.APPROVED, transaction, null);
    }

    public static TransactionResult declined(LedgerTransaction transaction, String reason) {
        return new TransactionResult(TransactionStatus.DECLINED, transaction, reason);
    }

    public boolean isApproved() {
        return status == TransactionStatus.APPROVED;
    }
}
