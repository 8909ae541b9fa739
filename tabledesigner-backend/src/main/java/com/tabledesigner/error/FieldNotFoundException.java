package com.tabledesigner.error;

/**
 * Thrown when the recorded design has no field with the requested name.
 */
public class FieldNotFoundException extends DesignerException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public FieldNotFoundException(String message) {
        super(ErrorKind.FIELD_NOT_FOUND, message);
    }
}
