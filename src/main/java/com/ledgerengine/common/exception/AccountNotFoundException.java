package com.ledgerengine.common.exception;

/**
 * Thrown when an account is not found.
 */
public class AccountNotFoundException extends LedgerEngineException {

    private final String accountId;

    public AccountNotFoundException(String accountId) {
        super("Account not found: " + accountId);
        this.accountId = accountId;
    }

    public String getAccountId() {
        return accountId;
    }
}
