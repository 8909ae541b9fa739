package com.tabledesigner.error;

/**
 * Originating kind of a failed designer operation, reported to callers next to the message.
 */
public enum ErrorKind {
    INVALID_DESIGN,
    INVALID_FIELD,
    TABLE_NOT_FOUND,
    DESIGN_NOT_FOUND,
    FIELD_NOT_FOUND,
    DUPLICATE_FIELD,
    SCHEMA_OPERATION_FAILED,
    DESIGN_PERSISTENCE_FAILED
}
