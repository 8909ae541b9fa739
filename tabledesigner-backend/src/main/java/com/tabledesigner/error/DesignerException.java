package com.tabledesigner.error;

/**
 * Base class for every failure surfaced by the design-to-schema synchronization path.
 */
public abstract class DesignerException extends RuntimeException {
    private final ErrorKind kind;

    protected DesignerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected DesignerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
