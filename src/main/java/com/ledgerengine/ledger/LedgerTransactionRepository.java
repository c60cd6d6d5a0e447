package com.ledgerengine.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for ledger transactions.
 *
 * Insert-only: new rows are appended through {@link LedgerStore}.
 */
@Repository
public interface LedgerTransactionRepository
        extends JpaRepository<LedgerTransaction, String>, JpaSpecificationExecutor<LedgerTransaction> {

    @Query("select coalesce(sum(t.amountCents), 0L) from LedgerTransaction t "
        + "where t.toAccountId = :accountId and t.type = :type and t.status = :status")
    Long sumIncoming(@Param("accountId") String accountId,
                     @Param("type") TransactionType type,
                     @Param("status") TransactionStatus status);

    @Query("select coalesce(sum(t.amountCents), 0L) from LedgerTransaction t "
        + "where t.fromAccountId = :accountId and t.type = :type and t.status = :status")
    Long sumOutgoing(@Param("accountId") String accountId,
                     @Param("type") TransactionType type,
                     @Param("status") TransactionStatus status);

    @Query("select coalesce(sum(t.amountCents), 0L) from LedgerTransaction t "
        + "where t.toAccountId = :accountId and t.type = :type and t.status = :status "
        + "and t.createdAt < :before")
    Long sumIncomingBefore(@Param("accountId") String accountId,
                           @Param("type") TransactionType type,
                           @Param("status") TransactionStatus status,
                           @Param("before") Instant before);

    @Query("select coalesce(sum(t.amountCents), 0L) from LedgerTransaction t "
        + "where t.fromAccountId = :accountId and t.type = :type and t.status = :status "
        + "and t.createdAt < :before")
    Long sumOutgoingBefore(@Param("accountId") String accountId,
                           @Param("type") TransactionType type,
                           @Param("status") TransactionStatus status,
                           @Param("before") Instant before);

    @Query("select t from LedgerTransaction t "
        + "where (t.fromAccountId = :accountId or t.toAccountId = :accountId) "
        + "and t.createdAt >= :from and t.createdAt < :to "
        + "order by t.createdAt asc, t.transactionId asc")
    List<LedgerTransaction> findAccountHistoryBetween(@Param("accountId") String accountId,
                                                      @Param("from") Instant from,
                                                      @Param("to") Instant to);

    List<LedgerTransaction> findByTransferPairId(String transferPairId);

    List<LedgerTransaction> findByCardIdOrderByCreatedAtDesc(String cardId);
}
