package org.neuralchilli.sentinel.domain;

/**
 * Thrown when a job specification is malformed or refers to a step it does not define.
 */
public class InvalidJobSpecException extends RuntimeException {

    public InvalidJobSpecException(String message) {
        super(message);
    }

    public InvalidJobSpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
