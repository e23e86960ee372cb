package com.cloudant.handoff;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of {@link ConcurrentList#takeAllBlock(CancellationSignal)}.
 */
public final class DrainResult<T> {

    private static final DrainResult<?> CANCELLED = new DrainResult<Object>(false, Collections.emptyList());

    private final boolean success;
    private final List<T> items;

    private DrainResult(final boolean success, final List<T> items) {
        this.success = success;
        this.items = items;
    }

    static <T> DrainResult<T> drained(final List<T> items) {
        return new DrainResult<T>(true, Collections.unmodifiableList(items));
    }

    @SuppressWarnings("unchecked")
    static <T> DrainResult<T> cancelled() {
        return (DrainResult<T>) CANCELLED;
    }

    /**
     * @return false if the wait was cancelled or the list closed
     */
    public boolean isSuccess() {
        return success;
    }

    /**
     * Items taken from the list, in order; empty when not successful.
     */
    public List<T> getItems() {
        return items;
    }

    @Override
    public String toString() {
        return String.format("DrainResult(success=%s,items=%d)", success, items.size());
    }

}
