package org.kvplane.planner.metrics;

import org.junit.jupiter.api.Test;
import org.kvplane.planner.domain.MetricsSample;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MetricsWindowTest {

    @Test
    void should_evict_oldest_sample_when_full() {
        MetricsWindow window = new MetricsWindow(3);
        for (int i = 1; i <= 5; i++) {
            window.add(MetricsSample.builder().requestCount(i).build());
        }

        List<Double> counts = window.snapshot().stream()
                .map(MetricsSample::getRequestCount)
                .collect(Collectors.toList());

        assertEquals(List.of(3.0, 4.0, 5.0), counts);
        assertEquals(3, window.size());
    }
}
