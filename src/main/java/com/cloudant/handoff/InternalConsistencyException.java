package com.cloudant.handoff;

/**
 * Thrown when a {@link ConcurrentList} operation finds its own invariant
 * broken, e.g. an element read under the lock could not then be removed.
 */
public final class InternalConsistencyException extends IllegalStateException {

    private static final long serialVersionUID = -2147695829101731560L;

    public InternalConsistencyException(final String message) {
        super(message);
    }

}
