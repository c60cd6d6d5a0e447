package com.ledgerengine.accounts;

import lombok.Value;

/**
 * Minimal account view returned by account-number lookup.
 * Carries no balance and no owner so it can be shown to any holder preparing a transfer.
 */
@Value
public class AccountLookup {
    String accountId;
    AccountType accountType;
    String accountNumber;

    static AccountLookup of(Account account) {
        return new AccountLookup(account.getAccountId(), account.getAccountType(), account.getAccountNumber());
    }
}
