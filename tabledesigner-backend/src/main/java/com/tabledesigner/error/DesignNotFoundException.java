package com.tabledesigner.error;

/**
 * Thrown when a table has no recorded design, typically because it was created outside the designer.
 */
public class DesignNotFoundException extends DesignerException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public DesignNotFoundException(String message) {
        super(ErrorKind.DESIGN_NOT_FOUND, message);
    }
}
