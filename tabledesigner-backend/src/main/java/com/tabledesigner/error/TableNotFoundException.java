package com.tabledesigner.error;

/**
 * Thrown when the live catalog has no table with the requested name.
 */
public class TableNotFoundException extends DesignerException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public TableNotFoundException(String message) {
        super(ErrorKind.TABLE_NOT_FOUND, message);
    }
}
