package com.ledgerengine.ledger;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable ledger record of one credit or one debit.
 *
 * A debit names only {@code fromAccountId}; a credit names only
 * {@code toAccountId}. A transfer is two records, one per account, joined by a
 * shared {@code transferPairId}, so a leg never shows up twice in one account's
 * history.
 *
 * Records are append-only. Declined attempts are stored too and are never
 * counted in a balance.
 */
@Entity
@Immutable
@Table(name = "transactions", indexes = {
    @Index(name = "idx_txn_from_account", columnList = "from_account_id, created_at"),
    @Index(name = "idx_txn_to_account", columnList = "to_account_id, created_at"),
    @Index(name = "idx_txn_transfer_pair", columnList = "transfer_pair_id"),
    @Index(name = "idx_txn_card_id", columnList = "card_id")
})
@Check(constraints = "amount_cents > 0")
@Getter
@ToString
@NoArgsConstructor
public class LedgerTransaction {

    public static final int MAX_DESCRIPTION_LENGTH = 255;

    @Id
    @Column(name = "transaction_id", length = 36)
    private String transactionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 6)
    private TransactionType type;

    @Column(name = "amount_cents", nullable = false, updatable = false)
    private long amountCents;

    @Column(name = "from_account_id", updatable = false, length = 36)
    private String fromAccountId;

    @Column(name = "to_account_id", updatable = false, length = 36)
    private String toAccountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 8)
    private TransactionStatus status;

    @Column(updatable = false, length = MAX_DESCRIPTION_LENGTH)
    private String description;

    @Column(name = "transfer_pair_id", updatable = false, length = 36)
    private String transferPairId;

    @Column(name = "card_id", updatable = false, length = 36)
    private String cardId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private LedgerTransaction(TransactionType type, long amountCents, String fromAccountId,
                              String toAccountId, TransactionStatus status, String description,
                              String transferPairId, String cardId, Instant createdAt) {
        this.transactionId = UUID.randomUUID().toString();
        this.type = type;
        this.amountCents = amountCents;
        this.fromAccountId = fromAccountId;
        this.toAccountId = toAccountId;
        this.status = status;
        this.description = description;
        this.transferPairId = transferPairId;
        this.cardId = cardId;
        this.createdAt = createdAt;
    }

    public static LedgerTransaction debit(String fromAccountId, long amountCents, TransactionStatus status,
                                          String description, String transferPairId, String cardId,
                                          Instant createdAt) {
        return new LedgerTransaction(TransactionType.DEBIT, amountCents, fromAccountId, null,
            status, description, transferPairId, cardId, createdAt);
    }

    public static LedgerTransaction credit(String toAccountId, long amountCents, TransactionStatus status,
                                           String description, String transferPairId,
                                           Instant createdAt) {
        return new LedgerTransaction(TransactionType.CREDIT, amountCents, null, toAccountId,
            status, description, transferPairId, null, createdAt);
    }

    /**
     * The account this record belongs to: the debited account for a debit, the credited one for a credit.
     */
    public String getAccountId() {
        return type == TransactionType.DEBIT ? fromAccountId : toAccountId;
    }

    public boolean isApproved() {
        return status == TransactionStatus.APPROVED;
    }

    public boolean touches(String accountId) {
        return accountId.equals(fromAccountId) || accountId.equals(toAccountId);
    }
}
