package org.kvplane.metric;

import org.kvplane.enums.KvMetricType;

/**
 * KvMonitor - unified metrics interface
 */
public interface KvMonitor {

    /**
     * Register a metric
     *
     * @param metricName metric name
     * @param metricType metric type
     */
    void register(String metricName, KvMetricType metricType);

    /**
     * Report a value without tags
     *
     * @param metricName metric name
     * @param value      metric value
     */
    void report(String metricName, double value);

    /**
     * Report a value
     *
     * @param metricName  metric name
     * @param metricsTags tags
     * @param value       metric value
     */
    void report(String metricName, MetricTags metricsTags, double value);
}
