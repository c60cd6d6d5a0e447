package com.ledgerengine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans.
 */
@Configuration
public class LedgerEngineConfig {

    /**
     * Source of every timestamp written to the ledger.
     */
    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }
}
