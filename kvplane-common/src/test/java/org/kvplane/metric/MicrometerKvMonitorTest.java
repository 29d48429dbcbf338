package org.kvplane.metric;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.kvplane.enums.KvMetricType;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MicrometerKvMonitorTest {

    private SimpleMeterRegistry registry;

    private MicrometerKvMonitor monitor;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        monitor = new MicrometerKvMonitor(registry);
    }

    @Test
    void should_keep_last_value_for_gauges() {
        monitor.register("test.gauge", KvMetricType.GAUGE);

        monitor.report("test.gauge", MetricTags.of("role", "prefill"), 3);
        monitor.report("test.gauge", MetricTags.of("role", "prefill"), 5);
        monitor.report("test.gauge", MetricTags.of("role", "decode"), 7);

        assertEquals(5.0, registry.get("test.gauge").tag("role", "prefill").gauge().value());
        assertEquals(7.0, registry.get("test.gauge").tag("role", "decode").gauge().value());
    }

    @Test
    void should_accumulate_qps_metrics() {
        monitor.register("test.qps", KvMetricType.QPS);

        monitor.report("test.qps", 1.0);
        monitor.report("test.qps", 1.0);
        monitor.report("test.qps", 2.0);

        assertEquals(4.0, registry.get("test.qps").counter().count());
    }

    @Test
    void should_reject_odd_tag_arguments() {
        assertThrows(IllegalArgumentException.class, () -> MetricTags.of("lonely"));
    }
}
