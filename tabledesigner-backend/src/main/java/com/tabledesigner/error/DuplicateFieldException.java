package com.tabledesigner.error;

/**
 * Thrown when a field name is already taken in the target table.
 */
public class DuplicateFieldException extends DesignerException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public DuplicateFieldException(String message) {
        super(ErrorKind.DUPLICATE_FIELD, message);
    }
}
