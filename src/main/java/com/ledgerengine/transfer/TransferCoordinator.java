package com.ledgerengine.transfer;

import com.ledgerengine.accounts.Account;
import com.ledgerengine.common.RequestValidator;
import com.ledgerengine.common.exception.LedgerValidationException;
import com.ledgerengine.common.exception.UnauthorizedAccessException;
import com.ledgerengine.ledger.BalanceEvaluator;
import com.ledgerengine.ledger.DeclineReasons;
import com.ledgerengine.ledger.LedgerStore;
import com.ledgerengine.ledger.LedgerTransaction;
import com.ledgerengine.ledger.TransactionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Moves money between two accounts as one unit of work.
 *
 * Transfer flow:
 * 1. Validate the request (source and destination must differ)
 * 2. Lock both account rows in ascending id order, whatever the direction
 * 3. Check the source belongs to the caller and compute its balance
 * 4a. Insufficient: append one declined debit on the source and commit
 * 4b. Sufficient: append the debit and credit legs under a new pair id,
 *     update both cached balances, commit
 *
 * Any exception between the two legs rolls back both of them. Like the
 * authorizer, each transfer runs in its own transaction so that its outcome
 * does not depend on whether the caller commits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferCoordinator {

    private final LedgerStore ledgerStore;
    private final BalanceEvaluator balanceEvaluator;
    private final RequestValidator requestValidator;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public TransferResult transfer(TransferRequest request) {
        requestValidator.validate(request);
        String fromAccountId = request.getFromAccountId();
        String toAccountId = request.getToAccountId();
        if (fromAccountId.equals(toAccountId)) {
            throw new LedgerValidationException("Cannot transfer to the same account");
        }
        long amount = request.getAmountCents();

        log.info("Processing transfer of {} cents from {} to {}", amount, fromAccountId, toAccountId);

        Map<String, Account> locked = ledgerStore.lockAccounts(List.of(fromAccountId, toAccountId));
        Account source = locked.get(fromAccountId);
        Account destination = locked.get(toAccountId);
        if (!source.isOwnedBy(request.getAccountHolderId())) {
            throw new UnauthorizedAccessException(fromAccountId);
        }

        Instant now = clock.instant();
        long available = balanceEvaluator.computeBalance(fromAccountId);
        if (amount > available) {
            LedgerTransaction declined = ledgerStore.append(LedgerTransaction.debit(
                fromAccountId, amount, TransactionStatus.DECLINED, request.getDescription(), null, null, now));
            String reason = DeclineReasons.insufficientFunds(amount, available);
            log.info("Transfer from {} to {} DECLINED: {}", fromAccountId, toAccountId, reason);
            return TransferResult.declined(toAccountId, declined, reason);
        }

        long destinationBalance = balanceEvaluator.computeBalance(toAccountId);
        String transferPairId = UUID.randomUUID().toString();
        LedgerTransaction debit = ledgerStore.append(LedgerTransaction.debit(
            fromAccountId, amount, TransactionStatus.APPROVED, request.getDescription(),
            transferPairId, null, now));
        LedgerTransaction credit = ledgerStore.append(LedgerTransaction.credit(
            toAccountId, amount, TransactionStatus.APPROVED, request.getDescription(),
            transferPairId, now));

        ledgerStore.applyToCachedBalance(source, debit, available);
        ledgerStore.applyToCachedBalance(destination, credit, destinationBalance);

        log.info("Transfer {} APPROVED: {} cents from {} to {}",
            transferPairId, amount, fromAccountId, toAccountId);
        return TransferResult.approved(transferPairId, toAccountId, debit, credit);
    }
}
