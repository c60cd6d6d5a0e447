package com.ledgerengine.cards;

import com.ledgerengine.common.exception.InvalidCardStateException;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.time.YearMonth;
import java.util.UUID;

/**
 * Debit card linked to a single account.
 *
 * Cards never hold money; a card-linked transaction debits the linked account.
 * Only the last four digits are kept here. Issuing and vaulting the full card
 * number belongs to the card issuer.
 */
@Entity
@Table(name = "cards")
@Getter
@ToString
@NoArgsConstructor
public class Card {

    @Id
    @Column(name = "card_id", length = 36)
    private String cardId;

    @Column(name = "account_id", nullable = false, unique = true, updatable = false, length = 36)
    private String accountId;

    @Column(nullable = false, updatable = false, length = 4)
    private String last4;

    @Column(name = "expiration_month", nullable = false, updatable = false)
    private int expirationMonth;

    @Column(name = "expiration_year", nullable = false, updatable = false)
    private int expirationYear;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CardState state;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Card(String accountId, String last4, YearMonth expiration, Instant now) {
        this.cardId = UUID.randomUUID().toString();
        this.accountId = accountId;
        this.last4 = last4;
        this.expirationMonth = expiration.getMonthValue();
        this.expirationYear = expiration.getYear();
        this.state = CardState.ACTIVE;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public void freeze(Instant now) {
        if (state == CardState.CLOSED) {
            throw new InvalidCardStateException(cardId, state.name(), "freeze");
        }
        this.state = CardState.FROZEN;
        this.updatedAt = now;
    }

    public void unfreeze(Instant now) {
        if (state != CardState.FROZEN) {
            throw new InvalidCardStateException(cardId, state.name(), "unfreeze");
        }
        this.state = CardState.ACTIVE;
        this.updatedAt = now;
    }

    public void close(Instant now) {
        if (state == CardState.CLOSED) {
            throw new InvalidCardStateException(cardId, state.name(), "close");
        }
        this.state = CardState.CLOSED;
        this.updatedAt = now;
    }

    public boolean isActive() {
        return state == CardState.ACTIVE;
    }

    /**
     * A card is valid through the last day of its expiration month.
     */
    public boolean isExpired(YearMonth current) {
        return current.isAfter(YearMonth.of(expirationYear, expirationMonth));
    }
}
