package com.ledgerengine.transfer;

import com.ledgerengine.ledger.LedgerTransaction;
import com.ledgerengine.ledger.TransactionStatus;
import lombok.Value;

/**
 * Outcome of a transfer.
 *
 * Approved: both legs present and sharing {@code transferPairId}.
 * Declined: only the declined debit on the source; no pair id, no credit leg.
 */
@Value
public class TransferResult {
    TransactionStatus status;
    String transferPairId;
    String fromAccountId;
    String toAccountId;
    long amountCents;
    LedgerTransaction debitTransaction;
    LedgerTransaction creditTransaction;
    String declineReason;

    public static TransferResult approved(String transferPairId, String toAccountId,
                                          LedgerTransaction debit, LedgerTransaction credit) {
        return new TransferResult(TransactionStatus.APPROVED, transferPairId, debit.getFromAccountId(),
            toAccountId, debit.getAmountCents(), debit, credit, null);
    }

    public static TransferResult declined(String toAccountId, LedgerTransaction declinedDebit, String reason) {
        return new TransferResult(TransactionStatus.DECLINED, null, declinedDebit.getFromAccountId(),
            toAccountId, declinedDebit.getAmountCents(), declinedDebit, null, reason);
    }

    public boolean isApproved() {
        return status == TransactionStatus.APPROVED;
    }
}
