package org.neuralchilli.sentinel.core;

/**
 * Thrown when a monitor run is aborted through its {@link CancellationToken} or by interruption.
 */
public class MonitorCancelledException extends RuntimeException {

    public MonitorCancelledException(String message) {
        super(message);
    }

    public MonitorCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
