package org.kvplane.planner.metrics;

import com.google.common.collect.EvictingQueue;
import org.kvplane.planner.domain.MetricsSample;

import java.util.ArrayList;
import java.util.List;

/**
 * Sliding window of interval samples, oldest evicted first
 */
public class MetricsWindow {

    private final EvictingQueue<MetricsSample> samples;

    private final int capacity;

    public MetricsWindow(int capacity) {
        this.capacity = capacity;
        this.samples = EvictingQueue.create(capacity);
    }

    public synchronized void add(MetricsSample sample) {
        samples.add(sample);
    }

    /**
     * @return samples oldest first
     */
    public synchronized List<MetricsSample> snapshot() {
        return new ArrayList<>(samples);
    }

    public synchronized int size() {
        return samples.size();
    }

    public int capacity() {
        return capacity;
    }
}
