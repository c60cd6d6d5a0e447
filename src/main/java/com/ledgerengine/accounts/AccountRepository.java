package com.ledgerengine.accounts;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for account persistence.
 *
 * Plain reads only. Locked reads go through {@link com.ledgerengine.ledger.LedgerStore}.
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, String> {

    List<Account> findByAccountHolderIdOrderByCreatedAtAsc(String accountHolderId);

    Optional<Account> findByAccountNumber(String accountNumber);

    boolean existsByAccountNumber(String accountNumber);
}
