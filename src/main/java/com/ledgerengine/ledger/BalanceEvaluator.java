package com.ledgerengine.ledger;

import com.ledgerengine.accounts.Account;
import com.ledgerengine.accounts.AccountRepository;
import com.ledgerengine.common.exception.AccountNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Derives balances from the ledger.
 *
 * balance = sum of approved credits to the account - sum of approved debits from it.
 * Declined records contribute nothing.
 *
 * {@link #computeBalance} is deliberately not transactional on its own: callers that
 * act on the result call it inside their unit of work, after taking the row lock.
 */
@Service
@RequiredArgsConstructor
public class BalanceEvaluator {

    private final LedgerTransactionRepository transactionRepository;
    private final AccountRepository accountRepository;

    public long computeBalance(String accountId) {
        long credits = transactionRepository.sumIncoming(
            accountId, TransactionType.CREDIT, TransactionStatus.APPROVED);
        long debits = transactionRepository.sumOutgoing(
            accountId, TransactionType.DEBIT, TransactionStatus.APPROVED);
        return credits - debits;
    }

    /**
     * Balance made up of approved transactions created strictly before {@code instant}.
     */
    public long computeBalanceBefore(String accountId, Instant instant) {
        long credits = transactionRepository.sumIncomingBefore(
            accountId, TransactionType.CREDIT, TransactionStatus.APPROVED, instant);
        long debits = transactionRepository.sumOutgoingBefore(
            accountId, TransactionType.DEBIT, TransactionStatus.APPROVED, instant);
        return credits - debits;
    }

    @Transactional(readOnly = true)
    public BalanceCheck checkIntegrity(String accountId) {
        Account account = accountRepository.findById(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
        return BalanceCheck.of(accountId, account.getCachedBalanceCents(),
            computeBalance(accountId), account.getCurrency());
    }
}
