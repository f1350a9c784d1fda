package org.neuralchilli.sentinel.core;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cancellation signal shared between a monitor run and whoever supervises it.
 * Waiting on the token returns as soon as it is cancelled, so a sleeping monitor
 * reacts to shutdown without sitting out its full pause.
 */
public final class CancellationToken {

    private final Lock lock = new ReentrantLock();
    private final Condition cancelledSignal = lock.newCondition();
    private volatile boolean cancelled = false;

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        lock.lock();
        try {
            cancelled = true;
            cancelledSignal.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Wait up to {@code timeout} for cancellation.
     *
     * @return true if the token was cancelled, false if the full timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            long remaining = timeout.toNanos();
            while (!cancelled && remaining > 0) {
                remaining = cancelledSignal.awaitNanos(remaining);
            }
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new MonitorCancelledException("Monitor run cancelled");
        }
    }
}
