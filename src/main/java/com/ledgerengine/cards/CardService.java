package com.ledgerengine.cards;

import com.ledgerengine.accounts.Account;
import com.ledgerengine.accounts.AccountService;
import com.ledgerengine.common.exception.CardNotFoundException;
import com.ledgerengine.common.exception.DuplicateCardException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.YearMonth;

/**
 * Service for managing card lifecycle.
 *
 * An account has at most one card.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CardService {

    private final CardRepository cardRepository;
    private final AccountService accountService;
    private final Clock clock;

    private final SecureRandom random = new SecureRandom();

    @Value("${ledger-engine.cards.validity-years:3}")
    private int validityYears;

    @Transactional
    public Card issueCard(String accountId, String accountHolderId) {
        Account account = accountService.getAccount(accountId, accountHolderId);
        if (cardRepository.existsByAccountId(accountId)) {
            throw new DuplicateCardException(accountId);
        }

        String last4 = String.format("%04d", random.nextInt(10_000));
        YearMonth expiration = YearMonth.now(clock).plusYears(validityYears);
        Card card = cardRepository.save(new Card(account.getAccountId(), last4, expiration, clock.instant()));

        log.info("Issued card {} ending {} for account {}, expires {}",
            card.getCardId(), last4, accountId, expiration);
        return card;
    }

    @Transactional(readOnly = true)
    public Card getCard(String cardId) {
        return cardRepository.findById(cardId)
            .orElseThrow(() -> new CardNotFoundException(cardId));
    }

    @Transactional(readOnly = true)
    public Card getCardForAccount(String accountId, String accountHolderId) {
        accountService.getAccount(accountId, accountHolderId);
        return cardRepository.findByAccountId(accountId)
            .orElseThrow(() -> CardNotFoundException.forAccount(accountId));
    }

    @Transactional
    public Card freezeCard(String accountId, String accountHolderId) {
        Card card = getCardForAccount(accountId, accountHolderId);
        card.freeze(clock.instant());
        log.info("Froze card {}", card.getCardId());
        return cardRepository.save(card);
    }

    @Transactional
    public Card unfreezeCard(String accountId, String accountHolderId) {
        Card card = getCardForAccount(accountId, accountHolderId);
        card.unfreeze(clock.instant());
        log.info("Unfroze card {}", card.getCardId());
        return cardRepository.save(card);
    }

    @Transactional
    public Card closeCard(String accountId, String accountHolderId) {
        Card card = getCardForAccount(accountId, accountHolderId);
        card.close(clock.instant());
        log.info("Closed card {}", card.getCardId());
        return cardRepository.save(card);
    }

    /**
     * Whether the card can be used today.
     */
    public boolean isUsable(Card card) {
        return card.isActive() && !card.isExpired(YearMonth.now(clock));
    }
}
