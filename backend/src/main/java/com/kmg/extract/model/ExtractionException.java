package com.kmg.extract.model;

/**
 * Failure raised by an external collaborator, already classified into an {@link ErrorKind}.
 */
public class ExtractionException extends RuntimeException {
    private final ErrorKind kind;

    public ExtractionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExtractionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public ClassifiedError toClassifiedError() {
        return new ClassifiedError(kind, getMessage());
    }
}
