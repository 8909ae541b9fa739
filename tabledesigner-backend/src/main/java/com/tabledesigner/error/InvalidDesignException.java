package com.tabledesigner.error;

/**
 * Thrown when a table design is malformed: blank name, no fields, blank or repeated field names.
 */
public class InvalidDesignException extends DesignerException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public InvalidDesignException(String message) {
        super(ErrorKind.INVALID_DESIGN, message);
    }
}
