package com.ledgerengine.accounts;

import com.ledgerengine.common.Currency;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Check;

import java.time.Instant;
import java.util.UUID;

/**
 * A bank account owned by exactly one account holder.
 *
 * The account does not own its balance. The balance is whatever the approved
 * transactions in the ledger add up to; {@code cachedBalanceCents} is a
 * convenience copy rewritten from the ledger by the authorizer and the transfer
 * coordinator while they hold this account's row lock. The check constraint
 * keeps the cached copy from ever being written below zero.
 */
@Entity
@Table(name = "accounts", indexes = {
    @Index(name = "idx_accounts_holder_id", columnList = "account_holder_id")
})
@Check(constraints = "cached_balance_cents >= 0")
@Getter
@ToString
@NoArgsConstructor
public class Account {

    @Id
    @Column(name = "account_id", length = 36)
    private String accountId;

    @Column(name = "account_holder_id", nullable = false, updatable = false)
    private String accountHolderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false, updatable = false)
    private AccountType accountType;

    @Column(name = "account_number", nullable = false, unique = true, updatable = false, length = 10)
    private String accountNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private Currency currency;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "cached_balance_cents", nullable = false)
    private long cachedBalanceCents;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Account(String accountHolderId, AccountType accountType, String accountNumber,
                   Currency currency, Instant now) {
        this.accountId = UUID.randomUUID().toString();
        this.accountHolderId = accountHolderId;
        this.accountType = accountType;
        this.accountNumber = accountNumber;
        this.currency = currency;
        this.active = true;
        this.cachedBalanceCents = 0L;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public boolean isOwnedBy(String accountHolderId) {
        return this.accountHolderId.equals(accountHolderId);
    }

    /**
     * Overwrite the cached balance. Caller must hold the row lock.
     */
    public void updateCachedBalance(long balanceCents, Instant now) {
        this.cachedBalanceCents = balanceCents;
        this.updatedAt = now;
    }
}
