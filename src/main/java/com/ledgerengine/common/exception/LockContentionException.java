package com.ledgerengine.common.exception;

/**
 * Thrown when an account row lock cannot be acquired within the configured wait.
 *
 * The unit of work is rolled back in full. Callers may retry the request.
 */
public class LockContentionException extends LedgerEngineException {

    private final String accountId;

    public LockContentionException(String accountId, Throwable cause) {
        super("Timed out waiting for lock on account " + accountId, cause);
        this.accountId = accountId;
    }

    public String getAccountId() {
        return accountId;
    }

    public boolean isRetryable() {
        return true;
    }
}
