package com.ledgerengine.ledger;

import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.Session;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.sql.Statement;

/**
 * Bounds how long the current transaction waits for a row lock.
 *
 * Hibernate does not render the JPA lock timeout hint for every dialect, so the
 * bound is set on the transaction's own connection before locking:
 * - PostgreSQL: {@code SET LOCAL lock_timeout}, dropped when the transaction ends
 * - H2: {@code SET LOCK_TIMEOUT}, a session setting that does not commit
 *
 * Other databases rely on the hint alone.
 */
@Component
@Slf4j
public class LockTimeoutStatement {

    private final long lockTimeoutMs;

    public LockTimeoutStatement(@Value("${ledger-engine.locking.timeout-ms:5000}") long lockTimeoutMs) {
        this.lockTimeoutMs = lockTimeoutMs;
    }

    public void apply(EntityManager entityManager) {
        entityManager.unwrap(Session.class).doWork(connection -> {
            String sql = forDatabase(connection.getMetaData().getDatabaseProductName());
            if (sql == null) {
                return;
            }
            try (Statement statement = connection.createStatement()) {
                statement.execute(sql);
            }
        });
    }

    /**
     * The statement that sets the lock wait on the named database, or {@code null} if there is none.
     */
    String forDatabase(String databaseProductName) {
        if (databaseProductName == null) {
            return null;
        }
        if (databaseProductName.contains("PostgreSQL")) {
            return "SET LOCAL lock_timeout = '" + lockTimeoutMs + "ms'";
        }
        if (databaseProductName.contains("H2")) {
            return "SET LOCK_TIMEOUT " + lockTimeoutMs;
        }
        log.debug("No lock timeout statement for {}; relying on the query hint", databaseProductName);
        return null;
    }
}
