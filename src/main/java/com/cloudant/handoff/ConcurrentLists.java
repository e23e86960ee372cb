package com.cloudant.handoff;

import java.util.Objects;
import java.util.function.BiPredicate;

import org.apache.commons.configuration.Configuration;

import com.codahale.metrics.MetricRegistry;

/**
 * Creates {@link ConcurrentList}s configured from a {@link Configuration} and
 * reporting to a shared {@link MetricRegistry}.
 */
public final class ConcurrentLists {

    public ConcurrentLists(final Configuration config, final MetricRegistry metricRegistry) {
        if (config == null) {
            throw new NullPointerException("config cannot be null");
        }
        if (metricRegistry == null) {
            throw new NullPointerException("metricRegistry cannot be null");
        }
        this.config = config;
        this.metricRegistry = metricRegistry;
    }

    public final Configuration config;

    public final MetricRegistry metricRegistry;

    public <T> ConcurrentList<T> create(final String name) {
        return create(name, Objects::equals);
    }

    public <T> ConcurrentList<T> create(final String name, final BiPredicate<? super T, ? super T> equivalence) {
        if (name == null) {
            throw new NullPointerException("name cannot be null");
        }
        final int signalCapacity = config.getInt("handoff.signal_capacity", ConcurrentList.DEFAULT_SIGNAL_CAPACITY);
        final String prefix = config.getString("handoff.metrics_prefix", ListMetrics.DEFAULT_PREFIX);
        return new ConcurrentList<T>(signalCapacity, equivalence, new ListMetrics(metricRegistry, prefix, name));
    }

    public <T> ListDrainer<T> drainer(final ConcurrentList<T> list, final ListDrainer.Sink<? super T> sink) {
        final int batchLogThreshold = config.getInt("handoff.drain_batch_log_threshold", 1000);
        return new ListDrainer<T>(list, sink, batchLogThreshold);
    }

}
