package org.kvplane.metric;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import lombok.extern.slf4j.Slf4j;
import org.kvplane.enums.KvMetricType;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * {@link KvMonitor} backed by a Micrometer registry. Gauges keep the last reported value per tag set, counters and
 * QPS metrics accumulate the reported values.
 */
@Slf4j
public class MicrometerKvMonitor implements KvMonitor {

    private final MeterRegistry registry;

    private final Map<String, KvMetricType> metricTypes = new ConcurrentHashMap<>();

    private final Map<MeterKey, AtomicDouble> gaugeValues = new ConcurrentHashMap<>();

    private final Map<MeterKey, Counter> counters = new ConcurrentHashMap<>();

    public MicrometerKvMonitor(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void register(String metricName, KvMetricType metricType) {
        metricTypes.put(metricName, metricType);
    }

    @Override
    public void report(String metricName, double value) {
        report(metricName, MetricTags.of(), value);
    }

    @Override
    public void report(String metricName, MetricTags metricsTags, double value) {
        KvMetricType type = metricTypes.get(metricName);
        if (type == null) {
            log.debug("metric {} reported before registration, treated as gauge", metricName);
            type = KvMetricType.GAUGE;
        }
        MeterKey key = new MeterKey(metricName, metricsTags);
        if (type == KvMetricType.GAUGE) {
            gaugeValues.computeIfAbsent(key, this::newGauge).set(value);
        } else {
            counters.computeIfAbsent(key, this::newCounter).increment(value);
        }
    }

    private AtomicDouble newGauge(MeterKey key) {
        AtomicDouble holder = new AtomicDouble();
        Gauge.builder(key.name(), holder, AtomicDouble::get)
                .tags(toTags(key.tags()))
                .register(registry);
        return holder;
    }

    private Counter newCounter(MeterKey key) {
        return Counter.builder(key.name())
                .tags(toTags(key.tags()))
                .register(registry);
    }

    private static List<Tag> toTags(MetricTags tags) {
        return tags.getTags().entrySet().stream()
                .map(e -> Tag.of(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }

    private record MeterKey(String name, MetricTags tags) {
    }
}
