package org.neuralchilli.sentinel.backend;

/**
 * Thrown at startup when {@code monitor.backend} names a backend that has no implementation.
 */
public class UnsupportedBackendException extends RuntimeException {

    public UnsupportedBackendException(String message) {
        super(message);
    }
}
