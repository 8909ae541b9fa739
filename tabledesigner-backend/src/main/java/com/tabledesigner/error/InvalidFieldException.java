package com.tabledesigner.error;

/**
 * Thrown when a single field definition is malformed.
 */
public class InvalidFieldException extends DesignerException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public InvalidFieldException(String message) {
        super(ErrorKind.INVALID_FIELD, message);
    }
}
