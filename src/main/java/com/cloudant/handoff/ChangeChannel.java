package com.cloudant.handoff;

import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO of change events used to wake a thread blocked in
 * {@link ConcurrentList#takeAllBlock(CancellationSignal)}. Offers never block:
 * an event that does not fit is dropped.
 */
public final class ChangeChannel {

    private final ArrayDeque<ChangeType> events;

    private final int capacity;

    private final Lock lock = new ReentrantLock();

    private final Condition changed = lock.newCondition();

    private boolean closed;

    public ChangeChannel(final int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, was " + capacity);
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<ChangeType>(capacity);
    }

    /**
     * Queues an event without blocking. When the channel is full an
     * {@link ChangeType#ADD} takes the place of the oldest queued
     * {@link ChangeType#REMOVE}; any other event is dropped.
     *
     * @return false if the event was dropped because the channel is full or
     *         closed
     */
    public boolean offer(final ChangeType type) {
        if (type == null) {
            throw new NullPointerException("type cannot be null");
        }
        final Lock lock = this.lock;
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            if (events.size() >= capacity) {
                // a waiter only wakes for ADD, so it must never be lost behind a REMOVE
                if (type != ChangeType.ADD || !events.removeFirstOccurrence(ChangeType.REMOVE)) {
                    return false;
                }
            }
            events.add(type);
            changed.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Throws away queued events.
     *
     * @return how many were discarded
     */
    public int discardPending() {
        final Lock lock = this.lock;
        lock.lock();
        try {
            final int discarded = events.size();
            events.clear();
            return discarded;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for the next event.
     *
     * @return the event, or null if the signal fired or the channel was closed
     *         before one arrived
     */
    public ChangeType receive(final CancellationSignal cancellation) throws InterruptedException {
        if (cancellation == null) {
            throw new NullPointerException("cancellation cannot be null");
        }
        final Lock lock = this.lock;
        lock.lock();
        try {
            while (true) {
                if (closed || cancellation.isCancelled()) {
                    return null;
                }
                final ChangeType next = events.poll();
                if (next != null) {
                    return next;
                }
                changed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wakes every thread in {@link #receive(CancellationSignal)} so that it
     * re-checks its cancellation signal.
     */
    public void wakeUp() {
        final Lock lock = this.lock;
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        final Lock lock = this.lock;
        lock.lock();
        try {
            closed = true;
            events.clear();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        final Lock lock = this.lock;
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        final Lock lock = this.lock;
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return String.format("ChangeChannel(capacity=%d,pending=%d,closed=%s)", capacity, size(), isClosed());
    }

}
