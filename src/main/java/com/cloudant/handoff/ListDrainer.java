package com.cloudant.handoff;

import java.util.List;

import org.apache.log4j.Logger;

/**
 * Consumer loop: waits in {@link ConcurrentList#takeAllBlock(CancellationSignal)}
 * and hands every drained batch to a {@link Sink} until {@link #stop()} is
 * called. Whatever is left in the list when it stops is handed over in one
 * last batch.
 */
public final class ListDrainer<T> implements Runnable {

    private static final Logger logger = Logger.getLogger("handoff.drainer");

    public interface Sink<T> {

        void accept(List<? extends T> batch) throws Exception;

    }

    private final ConcurrentList<T> list;
    private final Sink<? super T> sink;
    private final int batchLogThreshold;
    private final CancellationSignal stopSignal = new CancellationSignal();

    public ListDrainer(final ConcurrentList<T> list, final Sink<? super T> sink, final int batchLogThreshold) {
        if (list == null) {
            throw new NullPointerException("list cannot be null");
        }
        if (sink == null) {
            throw new NullPointerException("sink cannot be null");
        }
        this.list = list;
        this.sink = sink;
        this.batchLogThreshold = batchLogThreshold;
    }

    @Override
    public void run() {
        try {
            while (true) {
                final DrainResult<T> result = list.takeAllBlock(stopSignal);
                if (!result.isSuccess()) {
                    break;
                }
                deliver(result.getItems());
            }
        } catch (final InterruptedException e) {
            logger.warn(this + " interrupted");
            Thread.currentThread().interrupt();
            return;
        }

        final List<T> remaining = list.takeAll();
        if (!remaining.isEmpty()) {
            deliver(remaining);
        }
        logger.info(this + " stopped");
    }

    /**
     * Makes {@link #run()} return after delivering what is left in the list.
     */
    public void stop() {
        stopSignal.cancel();
    }

    public boolean isStopped() {
        return stopSignal.isCancelled();
    }

    private void deliver(final List<T> batch) {
        if (batch.size() >= batchLogThreshold) {
            logger.info(String.format("%s delivering batch of %d items", this, batch.size()));
        }
        try {
            sink.accept(batch);
        } catch (final Exception e) {
            logger.error(String.format("%s sink failed on batch of %d items", this, batch.size()), e);
        }
    }

    @Override
    public String toString() {
        return String.format("ListDrainer(%s)", list);
    }

}
