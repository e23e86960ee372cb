package com.cloudant.handoff;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Counters and timers kept for one {@link ConcurrentList}.
 */
public final class ListMetrics {

    public static final String DEFAULT_PREFIX = "com.cloudant.handoff";

    final Counter added;
    final Counter removed;
    final Counter signalsDropped;
    final Counter drains;
    final Counter drainsCancelled;
    final Timer drainWait;

    public ListMetrics(final MetricRegistry metricRegistry, final String prefix, final String scope) {
        if (metricRegistry == null) {
            throw new NullPointerException("metricRegistry cannot be null");
        }
        if (prefix == null) {
            throw new NullPointerException("prefix cannot be null");
        }
        if (scope == null) {
            throw new NullPointerException("scope cannot be null");
        }
        added = metricRegistry.counter(name(prefix, scope, "added"));
        removed = metricRegistry.counter(name(prefix, scope, "removed"));
        signalsDropped = metricRegistry.counter(name(prefix, scope, "signals.dropped"));
        drains = metricRegistry.counter(name(prefix, scope, "drains"));
        drainsCancelled = metricRegistry.counter(name(prefix, scope, "drains.cancelled"));
        drainWait = metricRegistry.timer(name(prefix, scope, "drain.wait"));
    }

    /**
     * Metrics kept in a private registry, for lists nobody reports on.
     */
    public static ListMetrics unregistered() {
        return new ListMetrics(new MetricRegistry(), DEFAULT_PREFIX, "anonymous");
    }

    public static String name(final String prefix, final String scope, final String metric) {
        return String.format("%s:type=ConcurrentList,scope=%s,name=%s", prefix, scope, metric);
    }

    public long getAdded() {
        return added.getCount();
    }

    public long getRemoved() {
        return removed.getCount();
    }

    public long getSignalsDropped() {
        return signalsDropped.getCount();
    }

    public long getDrains() {
        return drains.getCount();
    }

    public long getDrainsCancelled() {
        return drainsCancelled.getCount();
    }

}
