package org.neuralchilli.sentinel.backend;

/**
 * Thrown when a round trip to the task queue backend fails.
 * The whole check should be retried by the caller, not the individual call.
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
