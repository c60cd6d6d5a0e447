package com.ledgerengine.ledger;

import com.ledgerengine.accounts.AccountService;
import com.ledgerengine.common.exception.LedgerValidationException;
import com.ledgerengine.common.exception.TransactionNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;

import static com.ledgerengine.ledger.LedgerTransactionSpecifications.hasStatus;
import static com.ledgerengine.ledger.LedgerTransactionSpecifications.hasType;
import static com.ledgerengine.ledger.LedgerTransactionSpecifications.touchesAccount;

/**
 * Read access to the ledger.
 *
 * Listings are newest first and include declined records.
 */
@Service
@RequiredArgsConstructor
public class LedgerService {

    static final int MAX_PAGE_SIZE = 100;

    private static final Sort NEWEST_FIRST =
        Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by(Sort.Direction.DESC, "transactionId"));

    private final LedgerTransactionRepository transactionRepository;
    private final AccountService accountService;

    /**
     * One page of an account's history, optionally filtered by status and/or type.
     */
    @Transactional(readOnly = true)
    public List<LedgerTransaction> getAccountTransactions(String accountHolderId, String accountId,
                                                          TransactionStatus status, TransactionType type,
                                                          int page, int size) {
        accountService.getAccount(accountId, accountHolderId);
        Specification<LedgerTransaction> filter = Specification.where(touchesAccount(accountId))
            .and(hasStatus(status))
            .and(hasType(type));
        return transactionRepository.findAll(filter, pageOf(page, size)).getContent();
    }

    @Transactional(readOnly = true)
    public LedgerTransaction getTransaction(String accountHolderId, String accountId, String transactionId) {
        accountService.getAccount(accountId, accountHolderId);
        return transactionRepository.findById(transactionId)
            .filter(txn -> txn.touches(accountId))
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }

    /**
     * Both legs of a transfer, debit first.
     */
    @Transactional(readOnly = true)
    public List<LedgerTransaction> getTransferLegs(String transferPairId) {
        List<LedgerTransaction> legs = transactionRepository.findByTransferPairId(transferPairId);
        if (legs.isEmpty()) {
            throw new TransactionNotFoundException("transfer pair " + transferPairId);
        }
        return legs.stream()
            .sorted(Comparator.comparing(leg -> leg.getType() != TransactionType.DEBIT))
            .toList();
    }

    @Transactional(readOnly = true)
    public List<LedgerTransaction> getCardTransactions(String cardId) {
        return transactionRepository.findByCardIdOrderByCreatedAtDesc(cardId);
    }

    /**
     * Organisation-wide audit listing. Access gating belongs to the caller.
     */
    @Transactional(readOnly = true)
    public List<LedgerTransaction> getAllTransactions(TransactionStatus status, TransactionType type,
                                                      int page, int size) {
        Specification<LedgerTransaction> filter = Specification.where(hasStatus(status)).and(hasType(type));
        return transactionRepository.findAll(filter, pageOf(page, size)).getContent();
    }

    private static Pageable pageOf(int page, int size) {
        if (page < 0) {
            throw new LedgerValidationException("page must not be negative");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new LedgerValidationException("size must be between 1 and " + MAX_PAGE_SIZE);
        }
        return PageRequest.of(page, size, NEWEST_FIRST);
    }
}
