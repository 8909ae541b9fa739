package com.tabledesigner.error;

/**
 * Thrown when the live schema was changed but recording the matching design failed.
 *
 * <p>The live schema and the design store disagree after this error; {@code reconcile} rebuilds the
 * design record from the live table.
 */
public class DesignPersistenceFailedException extends DesignerException {
    private final String tableName;

    /**
     * Create a new exception.
     *
     * @param tableName table whose design record is now stale
     * @param message error message
     * @param cause store failure
     */
    public DesignPersistenceFailedException(String tableName, String message, Throwable cause) {
        super(ErrorKind.DESIGN_PERSISTENCE_FAILED, message, cause);
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
