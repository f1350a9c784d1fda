package org.neuralchilli.sentinel.core;

import java.time.Duration;

/**
 * Fixed-interval retry budget: counts failed attempts and pauses between them.
 * The pause observes a {@link CancellationToken} and thread interruption.
 * One instance covers one retry cycle.
 */
public final class RetryBackoff {

    private final int maxAttempts;
    private final Duration sleep;
    private final CancellationToken token;
    private int attempts = 0;

    public RetryBackoff(int maxAttempts, Duration sleep, CancellationToken token) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("Max attempts must be > 0");
        }
        if (sleep == null || sleep.isNegative()) {
            throw new IllegalArgumentException("Sleep must be a non-negative duration");
        }
        this.maxAttempts = maxAttempts;
        this.sleep = sleep;
        this.token = token != null ? token : CancellationToken.create();
    }

    /**
     * Record a failed attempt.
     *
     * @return true if another attempt is allowed, false once the budget is spent
     */
    public boolean recordFailure() {
        attempts++;
        return attempts < maxAttempts;
    }

    /**
     * Pause before the next attempt. Returns early, by throwing, if cancelled.
     *
     * @throws MonitorCancelledException if cancelled or interrupted during the pause
     */
    public void pause() {
        try {
            if (token.await(sleep)) {
                throw new MonitorCancelledException(
                        "Cancelled while waiting between attempts (" + attempts + "/" + maxAttempts + ")");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MonitorCancelledException("Interrupted while waiting between attempts", e);
        }
    }

    public void checkCancelled() {
        token.throwIfCancelled();
        if (Thread.currentThread().isInterrupted()) {
            throw new MonitorCancelledException("Interrupted before attempt " + (attempts + 1));
        }
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean exhausted() {
        return attempts >= maxAttempts;
    }
}
