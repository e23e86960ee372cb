package com.cloudant.handoff;

/**
 * Thrown when an index or range does not fall within a {@link ConcurrentList}.
 * The list is left untouched.
 */
public final class ListIndexOutOfBoundsException extends IndexOutOfBoundsException {

    private static final long serialVersionUID = 4310956783422580191L;

    private final int index;
    private final int count;
    private final int length;

    public ListIndexOutOfBoundsException(final int index, final int length) {
        this(index, 1, length);
    }

    public ListIndexOutOfBoundsException(final int index, final int count, final int length) {
        super();
        this.index = index;
        this.count = count;
        this.length = length;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Number of elements requested; 1 for single element access.
     */
    public int getCount() {
        return count;
    }

    /**
     * Length of the list when the request was rejected.
     */
    public int getLength() {
        return length;
    }

    @Override
    public String getMessage() {
        if (count == 1) {
            return String.format("index: %d out of bound, length: %d", index, length);
        }
        return String.format("range: [%d, %d+%d) out of bound, length: %d", index, index, count, length);
    }

}
