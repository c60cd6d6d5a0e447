package com.ledgerengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Ledger Engine.
 *
 * Ledger Engine owns account balances and the append-only transaction ledger:
 * single-account credits and debits, atomic two-leg transfers, balance integrity
 * checks and monthly statements. Authentication, role gating and transport are
 * provided by the embedding application.
 */
@SpringBootApplication
public class LedgerEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerEngineApplication.class, args);
    }
}
