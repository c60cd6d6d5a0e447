package com.ledgerengine.config;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;

/**
 * Keeps pooled connections alive after a lock wait timeout.
 *
 * H2 reports a lock timeout as an {@link java.sql.SQLTimeoutException}, which
 * Hikari otherwise treats as a broken connection and closes before the
 * transaction can roll back.
 */
public class LockTimeoutExceptionOverride implements SQLExceptionOverride {

    static final int H2_LOCK_TIMEOUT = 50200;

    @java.lang.Override
    public Override adjudicate(SQLException sqlException) {
        return sqlException.getErrorCode() == H2_LOCK_TIMEOUT
            ? Override.DO_NOT_EVICT
            : Override.CONTINUE_EVICT;
    }
}
