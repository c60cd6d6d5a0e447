package com.ledgerengine.ledger;

import org.springframework.data.jpa.domain.Specification;

/**
 * Optional filters for ledger listings.
 */
final class LedgerTransactionSpecifications {

    private LedgerTransactionSpecifications() {
    }

    static Specification<LedgerTransaction> touchesAccount(String accountId) {
        return (root, query, cb) -> cb.or(
            cb.equal(root.get("fromAccountId"), accountId),
            cb.equal(root.get("toAccountId"), accountId));
    }

    static Specification<LedgerTransaction> hasStatus(TransactionStatus status) {
        return status == null ? null : (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    static Specification<LedgerTransaction> hasType(TransactionType type) {
        return type == null ? null : (root, query, cb) -> cb.equal(root.get("type"), type);
    }
}
