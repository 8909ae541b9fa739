package com.tabledesigner.config;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

/**
 * HikariCP SQL exception override that keeps pooled SQLite connections alive for statement-level
 * errors.
 *
 * <p>Ad-hoc SQL and rejected DDL routinely fail with syntax, constraint or type errors; these say
 * nothing about the health of the connection.
 */
public class SqliteExceptionOverride implements SQLExceptionOverride {
    private static final int SQLITE_ERROR = 1;
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;
    private static final int SQLITE_CONSTRAINT = 19;
    private static final int SQLITE_MISMATCH = 20;
    private static final int SQLITE_RANGE = 25;

    /**
     * Decide whether Hikari should evict a connection based on the exception.
     *
     * @param sqlException SQL exception
     * @return override decision
     */
    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }

        // extended result codes keep the primary code in the low byte
        int primaryCode = sqlException.getErrorCode() & 0xff;
        return switch (primaryCode) {
            case SQLITE_ERROR, SQLITE_BUSY, SQLITE_LOCKED, SQLITE_CONSTRAINT, SQLITE_MISMATCH, SQLITE_RANGE ->
                    Override.DO_NOT_EVICT;
            default -> Override.CONTINUE_EVICT;
        };
    }
}
