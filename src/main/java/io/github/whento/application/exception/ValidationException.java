package io.github.whento.application.exception;

/** Rejected input at the write boundary. Mapped to 400. */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
