package io.github.whento.application.exception;

/** The write collides with existing data (duplicate entry, overlapping recurrence). Mapped to 409. */
public class ConflictException extends RuntimeException {
    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
