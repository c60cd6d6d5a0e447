package com.ledgerengine.ledger;

import com.ledgerengine.accounts.Account;
import com.ledgerengine.common.exception.AccountNotFoundException;
import com.ledgerengine.common.exception.LockContentionException;
import com.ledgerengine.common.locking.OrderedLocking;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.PessimisticLockException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.Map;

/**
 * Write side of the ledger.
 *
 * All methods must run inside the caller's unit of work: row locks are held
 * until that unit commits or rolls back, and appended rows become visible only
 * on commit. Locking outside a transaction is rejected by the persistence
 * provider.
 *
 * Locking rules:
 * - an account row is locked with {@code PESSIMISTIC_WRITE} and a bounded wait
 * - several accounts are always locked through {@link OrderedLocking}
 * - the cached balance is only changed on an account this unit has locked
 * - the wait is bounded by {@link LockTimeoutStatement} and the JPA lock timeout hint
 */
@Component
@Slf4j
public class LedgerStore {

    static final String LOCK_TIMEOUT_HINT = "jakarta.persistence.lock.timeout";

    private final EntityManager entityManager;
    private final LockTimeoutStatement lockTimeoutStatement;
    private final Clock clock;
    private final long lockTimeoutMs;

    public LedgerStore(EntityManager entityManager, LockTimeoutStatement lockTimeoutStatement, Clock clock,
                       @Value("${ledger-engine.locking.timeout-ms:5000}") long lockTimeoutMs) {
        this.entityManager = entityManager;
        this.lockTimeoutStatement = lockTimeoutStatement;
        this.clock = clock;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    /**
     * Lock one account row for the rest of the unit of work.
     *
     * @throws AccountNotFoundException if no such account exists
     * @throws LockContentionException  if the lock is not granted in time
     */
    public Account lockAccount(String accountId) {
        Account account = tryLock(accountId);
        if (account == null) {
            throw new AccountNotFoundException(accountId);
        }
        return account;
    }

    /**
     * Lock several account rows in ascending id order.
     *
     * All locks are taken before existence is checked, so a missing account is
     * reported only after the present ones are locked; the unit of work is
     * expected to roll back on the exception.
     *
     * @return the locked accounts keyed by id
     */
    public Map<String, Account> lockAccounts(Collection<String> accountIds) {
        Map<String, Account> locked = OrderedLocking.acquireInOrder(accountIds, this::tryLock);
        locked.forEach((accountId, account) -> {
            if (account == null) {
                throw new AccountNotFoundException(accountId);
            }
        });
        return locked;
    }

    public LedgerTransaction append(LedgerTransaction transaction) {
        entityManager.persist(transaction);
        log.debug("Appended {} {} {} cents for account {}",
            transaction.getStatus(), transaction.getType(), transaction.getAmountCents(),
            transaction.getAccountId());
        return transaction;
    }

    /**
     * Rewrite the cached balance of a locked account after an approved transaction.
     *
     * The new value is the ledger balance computed before the transaction plus its
     * effect, so a cache that has drifted is replaced rather than adjusted.
     *
     * @param computedBeforeCents balance from {@link BalanceEvaluator} taken under the same lock
     */
    public void applyToCachedBalance(Account account, LedgerTransaction transaction, long computedBeforeCents) {
        if (!transaction.isApproved()) {
            throw new IllegalArgumentException("Only approved transactions move the cached balance");
        }
        if (!account.getAccountId().equals(transaction.getAccountId())) {
            throw new IllegalArgumentException(String.format(
                "Transaction %s does not belong to account %s",
                transaction.getTransactionId(), account.getAccountId()));
        }
        if (account.getCachedBalanceCents() != computedBeforeCents) {
            log.warn("Cached balance of account {} was {} cents, ledger has {}; resetting from ledger",
                account.getAccountId(), account.getCachedBalanceCents(), computedBeforeCents);
        }
        long delta = transaction.getType() == TransactionType.CREDIT
            ? transaction.getAmountCents()
            : -transaction.getAmountCents();
        account.updateCachedBalance(Math.addExact(computedBeforeCents, delta), clock.instant());
    }

    private Account tryLock(String accountId) {
        log.debug("Locking account {}", accountId);
        lockTimeoutStatement.apply(entityManager);
        try {
            return entityManager.find(Account.class, accountId, LockModeType.PESSIMISTIC_WRITE,
                Map.of(LOCK_TIMEOUT_HINT, lockTimeoutMs));
        } catch (LockTimeoutException | PessimisticLockException e) {
            log.warn("Lock on account {} not granted within {} ms", accountId, lockTimeoutMs);
            throw new LockContentionException(accountId, e);
        }
    }
}
