package org.kvplane.metric;

import org.kvplane.enums.KvMetricType;

/**
 * Monitor used when no meter registry is available
 */
public class NoOpKvMonitor implements KvMonitor {

    private static final NoOpKvMonitor INSTANCE = new NoOpKvMonitor();

    public static NoOpKvMonitor getInstance() {
        return INSTANCE;
    }

    @Override
    public void register(String metricName, KvMetricType metricType) {
        // No-op
    }

    @Override
    public void report(String metricName, double value) {
        // No-op
    }

    @Override
    public void report(String metricName, MetricTags metricsTags, double value) {
        // No-op
    }

    @Override
    public String toString() {
        return "NoOpKvMonitor";
    }
}
