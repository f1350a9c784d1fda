package org.neuralchilli.sentinel.core;

/**
 * Thrown when no expected worker showed up within the polling budget.
 * Terminal: the job cannot make progress, so monitoring should stop.
 */
public class NoWorkersAvailableException extends RuntimeException {

    private final int attempts;

    public NoWorkersAvailableException(String message, int attempts) {
        super(message);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
