package io.github.whento.application.exception;

/** Stored calendar configuration could not be read. */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
