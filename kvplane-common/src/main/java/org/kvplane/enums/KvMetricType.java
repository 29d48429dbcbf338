package org.kvplane.enums;

/**
 * KvMetricType - metric kinds understood by the monitor
 */
public enum KvMetricType {

    /**
     * Instant value, may go up and down
     */
    GAUGE,
    /**
     * Accumulated count, only increases
     */
    COUNTER,
    /**
     * Events per second, reported one event at a time
     */
    QPS
}
