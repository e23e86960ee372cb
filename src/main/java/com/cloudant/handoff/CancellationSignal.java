package com.cloudant.handoff;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.log4j.Logger;

/**
 * A token that fires once and then stays fired. Callers of
 * {@link ConcurrentList#takeAllBlock(CancellationSignal)} use it to abandon the
 * wait.
 */
public final class CancellationSignal {

    private static final Logger logger = Logger.getLogger("handoff.signal");

    /**
     * Handle returned by {@link CancellationSignal#onCancel(Runnable)}. Closing
     * it removes the listener; closing it twice is harmless.
     */
    public interface Registration extends AutoCloseable {

        @Override
        void close();

    }

    private static final Registration NO_REGISTRATION = () -> {
    };

    private final Lock lock = new ReentrantLock();

    private final Condition fired = lock.newCondition();

    private final LinkedHashSet<Runnable> listeners = new LinkedHashSet<Runnable>();

    private boolean cancelled;

    /**
     * Returns a signal that fires after the given delay, unless something else
     * fires it first, in which case the scheduled task is cancelled.
     */
    public static CancellationSignal cancelAfter(final long delay, final TimeUnit unit,
            final ScheduledExecutorService scheduledExecutor) {
        if (unit == null) {
            throw new NullPointerException("unit cannot be null");
        }
        if (scheduledExecutor == null) {
            throw new NullPointerException("scheduledExecutor cannot be null");
        }
        final CancellationSignal signal = new CancellationSignal();
        final ScheduledFuture<?> timeout = scheduledExecutor.schedule(signal::cancel, delay, unit);
        signal.onCancel(() -> timeout.cancel(false));
        return signal;
    }

    /**
     * Fires the signal.
     *
     * @return true if this call fired it, false if it had already fired
     */
    public boolean cancel() {
        final List<Runnable> toRun;
        final Lock lock = this.lock;
        lock.lock();
        try {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = new ArrayList<Runnable>(listeners);
            listeners.clear();
            fired.signalAll();
        } finally {
            lock.unlock();
        }

        for (final Runnable listener : toRun) {
            runListener(listener);
        }
        return true;
    }

    public boolean isCancelled() {
        final Lock lock = this.lock;
        lock.lock();
        try {
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the signal fires.
     */
    public void await() throws InterruptedException {
        final Lock lock = this.lock;
        lock.lock();
        try {
            while (!cancelled) {
                fired.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers a listener to run once, in the cancelling thread, when the
     * signal fires. If it has already fired the listener runs now, in the
     * calling thread.
     */
    public Registration onCancel(final Runnable listener) {
        if (listener == null) {
            throw new NullPointerException("listener cannot be null");
        }
        final Lock lock = this.lock;
        lock.lock();
        try {
            if (!cancelled) {
                listeners.add(listener);
                return () -> removeListener(listener);
            }
        } finally {
            lock.unlock();
        }

        runListener(listener);
        return NO_REGISTRATION;
    }

    int listenerCount() {
        final Lock lock = this.lock;
        lock.lock();
        try {
            return listeners.size();
        } finally {
            lock.unlock();
        }
    }

    private void removeListener(final Runnable listener) {
        final Lock lock = this.lock;
        lock.lock();
        try {
            listeners.remove(listener);
        } finally {
            lock.unlock();
        }
    }

    private void runListener(final Runnable listener) {
        try {
            listener.run();
        } catch (final RuntimeException e) {
            logger.warn(this + " cancellation listener failed", e);
        }
    }

    @Override
    public String toString() {
        return String.format("CancellationSignal(cancelled=%s)", isCancelled());
    }

}
