package com.cloudant.handoff;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiPredicate;

import org.apache.log4j.Logger;

import com.codahale.metrics.Timer;

/**
 * An ordered, unbounded list shared between producer and consumer threads.
 * Producers append without blocking. A consumer either reads and removes
 * elements one by one or parks in {@link #takeAllBlock(CancellationSignal)}
 * until something is added and then takes everything at once.
 * <p>
 * Every mutation is followed, outside the lock, by a best-effort event on a
 * small {@link ChangeChannel}; the event only wakes the blocked consumer and
 * never carries data.
 */
public final class ConcurrentList<T> implements AutoCloseable {

    private static final Logger logger = Logger.getLogger("handoff.list");

    public static final int DEFAULT_SIGNAL_CAPACITY = 1;

    private final Lock lock = new ReentrantLock();

    private List<T> items = new ArrayList<T>();

    private final ChangeChannel changes;

    private final BiPredicate<? super T, ? super T> equivalence;

    private final ListMetrics metrics;

    public ConcurrentList() {
        this(DEFAULT_SIGNAL_CAPACITY, Objects::equals, ListMetrics.unregistered());
    }

    public ConcurrentList(final BiPredicate<? super T, ? super T> equivalence) {
        this(DEFAULT_SIGNAL_CAPACITY, equivalence, ListMetrics.unregistered());
    }

    public ConcurrentList(final int signalCapacity, final BiPredicate<? super T, ? super T> equivalence,
            final ListMetrics metrics) {
        if (equivalence == null) {
            throw new NullPointerException("equivalence cannot be null");
        }
        if (metrics == null) {
            throw new NullPointerException("metrics cannot be null");
        }
        this.changes = new ChangeChannel(signalCapacity);
        this.equivalence = equivalence;
        this.metrics = metrics;
    }

    public void add(final T value) {
        final Lock lock = this.lock;
        lock.lock();
        try {
            items.add(value);
        } finally {
            lock.unlock();
        }
        metrics.added.inc();
        notifyChanged(ChangeType.ADD);
    }

    /**
     * Appends all values in iteration order, as one mutation.
     */
    public void addAll(final Collection<? extends T> values) {
        if (values == null) {
            throw new NullPointerException("values cannot be null");
        }
        final int count;
        final Lock lock = this.lock;
        lock.lock();
        try {
            count = values.size();
            items.addAll(values);
        } finally {
            lock.unlock();
        }
        metrics.added.inc(count);
        notifyChanged(ChangeType.ADD);
    }

    /**
     * Empties the list. Pending change events are discarded before the list
     * lock is released, so none of them can wake a consumer onto the emptied
     * list.
     */
    public void clear() {
        final int cleared;
        final int discarded;
        final Lock lock = this.lock;
        lock.lock();
        try {
            cleared = items.size();
            items = new ArrayList<T>();
            discarded = changes.discardPending();
        } finally {
            lock.unlock();
        }
        if (logger.isDebugEnabled()) {
            logger.debug(String.format("%s cleared %d items, discarded %d pending events", this, cleared, discarded));
        }
        metrics.removed.inc(cleared);
        notifyChanged(ChangeType.REMOVE);
    }

    /**
     * Removes the first element equivalent to {@code value}. Later equivalent
     * elements are left in place. A {@link ChangeType#REMOVE} event is sent
     * even when nothing matched.
     *
     * @return true if an element was removed
     */
    public boolean remove(final T value) {
        final boolean removed;
        final Lock lock = this.lock;
        lock.lock();
        try {
            removed = removeFirstMatch(value);
        } finally {
            lock.unlock();
        }
        if (removed) {
            metrics.removed.inc();
        }
        notifyChanged(ChangeType.REMOVE);
        return removed;
    }

    /**
     * Removes {@code count} contiguous elements starting at {@code index}.
     *
     * @throws ListIndexOutOfBoundsException if the range is not fully inside
     *             the list; nothing is removed in that case
     */
    public void removeRange(final int index, final int count) {
        final Lock lock = this.lock;
        lock.lock();
        try {
            final int length = items.size();
            if (index < 0 || count < 0 || index > length - count) {
                throw new ListIndexOutOfBoundsException(index, count, length);
            }
            items.subList(index, index + count).clear();
        } finally {
            lock.unlock();
        }
        metrics.removed.inc(count);
        notifyChanged(ChangeType.REMOVE);
    }

    /**
     * @throws ListIndexOutOfBoundsException if {@code index} is not within
     *             {@code [0, size())}
     */
    public T get(final int index) {
        final Lock lock = this.lock;
        lock.lock();
        try {
            return getWithoutLock(index);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a copy of the current elements, in order.
     */
    public List<T> getAll() {
        final Lock lock = this.lock;
        lock.lock();
        try {
            return new ArrayList<T>(items);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        final Lock lock = this.lock;
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Reads and removes the element at {@code index} under a single lock
     * acquisition. The element removed is the one at {@code index}, even if an
     * equivalent element sits before it; unlike {@link #remove(Object)} this
     * does not search for the first equivalent match, so the remaining
     * elements keep their order when the list holds duplicates.
     *
     * @throws ListIndexOutOfBoundsException if {@code index} is not within
     *             {@code [0, size())}
     * @throws InternalConsistencyException if the element removed is not the
     *             one just read
     */
    public T take(final int index) {
        final T result;
        final Lock lock = this.lock;
        lock.lock();
        try {
            result = getWithoutLock(index);
            final T removed = items.remove(index);
            if (removed != result) {
                items.add(index, removed);
                final String message = String.format("list of length %d removed %s at index %d after reading %s",
                        items.size(), removed, index, result);
                logger.error(message);
                throw new InternalConsistencyException(message);
            }
        } finally {
            lock.unlock();
        }
        metrics.removed.inc();
        notifyChanged(ChangeType.REMOVE);
        return result;
    }

    /**
     * Removes and returns every element, in order, as one mutation.
     */
    public List<T> takeAll() {
        final List<T> result;
        final Lock lock = this.lock;
        lock.lock();
        try {
            result = items;
            items = new ArrayList<T>();
        } finally {
            lock.unlock();
        }
        metrics.removed.inc(result.size());
        notifyChanged(ChangeType.REMOVE);
        return result;
    }

    /**
     * Parks the calling thread until an element is added, then takes
     * everything in the list. {@link ChangeType#REMOVE} events do not end the
     * wait, and neither does an {@link ChangeType#ADD} whose elements were
     * already taken by someone else.
     * <p>
     * No thread is started: the signal wakes the waiter through a listener
     * that is unregistered before this method returns.
     *
     * @return the taken elements, or an unsuccessful result with no elements
     *         if {@code cancellation} fired or the list was closed first
     */
    public DrainResult<T> takeAllBlock(final CancellationSignal cancellation) throws InterruptedException {
        if (cancellation == null) {
            throw new NullPointerException("cancellation cannot be null");
        }
        final ChangeChannel changes = this.changes;
        try (CancellationSignal.Registration registration = cancellation.onCancel(changes::wakeUp);
                Timer.Context waiting = metrics.drainWait.time()) {
            while (true) {
                final ChangeType change = changes.receive(cancellation);
                if (change == null) {
                    metrics.drainsCancelled.inc();
                    if (logger.isDebugEnabled()) {
                        logger.debug(this + " drain cancelled");
                    }
                    return DrainResult.cancelled();
                }
                if (change == ChangeType.ADD) {
                    final List<T> taken = takeAll();
                    if (!taken.isEmpty()) {
                        metrics.drains.inc();
                        return DrainResult.drained(taken);
                    }
                }
            }
        }
    }

    /**
     * Closes the change channel. Blocked and future calls to
     * {@link #takeAllBlock(CancellationSignal)} return an unsuccessful
     * result; all other operations keep working.
     */
    @Override
    public void close() {
        changes.close();
    }

    public boolean isClosed() {
        return changes.isClosed();
    }

    public ListMetrics getMetrics() {
        return metrics;
    }

    ChangeChannel changes() {
        return changes;
    }

    private T getWithoutLock(final int index) {
        final int length = items.size();
        if (index < 0 || index >= length) {
            throw new ListIndexOutOfBoundsException(index, length);
        }
        return items.get(index);
    }

    private boolean removeFirstMatch(final T value) {
        for (int i = 0; i < items.size(); i++) {
            if (equivalence.test(items.get(i), value)) {
                items.remove(i);
                return true;
            }
        }
        return false;
    }

    private void notifyChanged(final ChangeType type) {
        if (!changes.offer(type)) {
            metrics.signalsDropped.inc();
            if (logger.isDebugEnabled()) {
                logger.debug(String.format("%s dropped %s event", this, type));
            }
        }
    }

    @Override
    public String toString() {
        return String.format("ConcurrentList(size=%d,changes=%s)", size(), changes);
    }

}
