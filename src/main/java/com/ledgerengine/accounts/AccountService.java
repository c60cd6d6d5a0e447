package com.ledgerengine.accounts;

import com.ledgerengine.common.Currency;
import com.ledgerengine.common.exception.AccountNotFoundException;
import com.ledgerengine.common.exception.LedgerValidationException;
import com.ledgerengine.common.exception.UnauthorizedAccessException;
import com.ledgerengine.ledger.BalanceCheck;
import com.ledgerengine.ledger.BalanceEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;

/**
 * Service for opening and reading accounts.
 *
 * Every holder-facing read is scoped by the caller's account holder id; an
 * account that exists but belongs to someone else raises
 * {@link UnauthorizedAccessException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private static final int ACCOUNT_NUMBER_LENGTH = 10;
    private static final int ACCOUNT_NUMBER_ATTEMPTS = 10;

    private final AccountRepository accountRepository;
    private final BalanceEvaluator balanceEvaluator;
    private final Clock clock;

    private final SecureRandom random = new SecureRandom();

    @Value("${ledger-engine.accounts.default-currency:USD}")
    private Currency defaultCurrency;

    @Transactional
    public Account openAccount(String accountHolderId, AccountType accountType) {
        if (accountHolderId == null || accountHolderId.isBlank()) {
            throw new LedgerValidationException("Account holder id is required");
        }
        AccountType type = accountType != null ? accountType : AccountType.CHECKING;

        Account account = new Account(accountHolderId, type, nextAccountNumber(),
            defaultCurrency, clock.instant());
        account = accountRepository.save(account);

        log.info("Opened {} account {} ({}) for holder {}",
            type, account.getAccountId(), account.getAccountNumber(), accountHolderId);
        return account;
    }

    @Transactional(readOnly = true)
    public Account getAccount(String accountId, String accountHolderId) {
        Account account = accountRepository.findById(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
        if (!account.isOwnedBy(accountHolderId)) {
            throw new UnauthorizedAccessException(accountId);
        }
        return account;
    }

    @Transactional(readOnly = true)
    public List<Account> getAccounts(String accountHolderId) {
        return accountRepository.findByAccountHolderIdOrderByCreatedAtAsc(accountHolderId);
    }

    @Transactional(readOnly = true)
    public AccountLookup lookupByAccountNumber(String accountNumber) {
        return accountRepository.findByAccountNumber(accountNumber)
            .map(AccountLookup::of)
            .orElseThrow(() -> new AccountNotFoundException("number " + accountNumber));
    }

    /**
     * Cached and computed balance side by side for one of the holder's accounts.
     */
    @Transactional(readOnly = true)
    public BalanceCheck getBalance(String accountId, String accountHolderId) {
        getAccount(accountId, accountHolderId);
        return balanceEvaluator.checkIntegrity(accountId);
    }

    private String nextAccountNumber() {
        for (int attempt = 0; attempt < ACCOUNT_NUMBER_ATTEMPTS; attempt++) {
            StringBuilder number = new StringBuilder(ACCOUNT_NUMBER_LENGTH);
            for (int i = 0; i < ACCOUNT_NUMBER_LENGTH; i++) {
                number.append(random.nextInt(10));
            }
            String candidate = number.toString();
            if (!accountRepository.existsByAccountNumber(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Failed to generate a unique account number");
    }
}
