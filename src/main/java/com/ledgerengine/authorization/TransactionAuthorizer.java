package com.ledgerengine.authorization;

import com.ledgerengine.accounts.Account;
import com.ledgerengine.cards.Card;
import com.ledgerengine.cards.CardService;
import com.ledgerengine.common.RequestValidator;
import com.ledgerengine.common.exception.LedgerValidationException;
import com.ledgerengine.common.exception.UnauthorizedAccessException;
import com.ledgerengine.ledger.BalanceEvaluator;
import com.ledgerengine.ledger.DeclineReasons;
import com.ledgerengine.ledger.LedgerStore;
import com.ledgerengine.ledger.LedgerTransaction;
import com.ledgerengine.ledger.TransactionStatus;
import com.ledgerengine.ledger.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Authorizes single-account credits and debits.
 *
 * Authorization flow:
 * 1. Validate the request (nothing is written for an invalid request)
 * 2. Lock the account row and check ownership
 * 3. Validate the card, if one was presented
 * 4. Compute the balance from the ledger
 * 5. Append an approved or declined record and return the matching result
 *
 * A decline is a normal, committed outcome. Only exceptions roll the unit of work back.
 * Each call runs in its own transaction, suspending any the caller has open, so
 * the outcome is committed even if the caller later rolls back its own work.
 * A caller must therefore not hold a lock on the account itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionAuthorizer {

    private final LedgerStore ledgerStore;
    private final BalanceEvaluator balanceEvaluator;
    private final CardService cardService;
    private final RequestValidator requestValidator;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public TransactionResult authorize(TransactionRequest request) {
        requestValidator.validate(request);
        if (request.getCardId() != null && request.getType() == TransactionType.CREDIT) {
            throw new LedgerValidationException("Cards cannot be used for credit transactions");
        }

        String accountId = request.getAccountId();
        long amount = request.getAmountCents();

        log.info("Processing {} of {} cents on account {}", request.getType(), amount, accountId);

        Account account = ledgerStore.lockAccount(accountId);
        if (!account.isOwnedBy(request.getAccountHolderId())) {
            throw new UnauthorizedAccessException(accountId);
        }
        if (request.getCardId() != null) {
            validateCard(request.getCardId(), accountId);
        }

        Instant now = clock.instant();
        long available = balanceEvaluator.computeBalance(accountId);
        LedgerTransaction transaction;
        if (request.getType() == TransactionType.DEBIT) {
            if (amount > available) {
                return decline(request, available, now);
            }
            transaction = LedgerTransaction.debit(accountId, amount, TransactionStatus.APPROVED,
                request.getDescription(), null, request.getCardId(), now);
        } else {
            transaction = LedgerTransaction.credit(accountId, amount, TransactionStatus.APPROVED,
                request.getDescription(), null, now);
        }

        ledgerStore.append(transaction);
        ledgerStore.applyToCachedBalance(account, transaction, available);

        log.info("Transaction {} APPROVED: {} {} cents on account {}",
            transaction.getTransactionId(), transaction.getType(), amount, accountId);
        return TransactionResult.approved(transaction);
    }

    private void validateCard(String cardId, String accountId) {
        Card card = cardService.getCard(cardId);
        if (!card.getAccountId().equals(accountId)) {
            throw new LedgerValidationException("Card does not belong to this account");
        }
        if (!cardService.isUsable(card)) {
            throw new LedgerValidationException(card.isActive()
                ? "Card is expired"
                : "Card is not active: " + card.getState());
        }
    }

    private TransactionResult decline(TransactionRequest request, long available, Instant now) {
        LedgerTransaction declined = ledgerStore.append(LedgerTransaction.debit(
            request.getAccountId(), request.getAmountCents(), TransactionStatus.DECLINED,
            request.getDescription(), null, request.getCardId(), now));

        String reason = DeclineReasons.insufficientFunds(request.getAmountCents(), available);
        log.info("Transaction {} DECLINED on account {}: {}",
            declined.getTransactionId(), request.getAccountId(), reason);
        return TransactionResult.declined(declined, reason);
    }
}
