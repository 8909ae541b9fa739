package com.tabledesigner.error;

import java.sql.SQLException;

/**
 * Thrown when the storage engine rejects a statement. Nothing was persisted to the design store.
 */
public class SchemaOperationFailedException extends DesignerException {
    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause engine error
     */
    public SchemaOperationFailedException(String message, SQLException cause) {
        super(ErrorKind.SCHEMA_OPERATION_FAILED, message + ": " + cause.getMessage(), cause);
    }

    /**
     * SQLSTATE reported by the engine, if any.
     *
     * @return sql state or null
     */
    public String getSqlState() {
        return getCause() instanceof SQLException sqlException ? sqlException.getSQLState() : null;
    }
}
