package org.kvplane.planner.metrics;

import org.kvplane.planner.domain.MetricPoint;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Time series backend the planner samples traffic from
 */
public interface MetricsSource {

    /**
     * Query the points of one metric expression in {@code [start, end]}.
     *
     * @param metric metric name or expression understood by the backend
     * @return the points, empty when the series has no data; fails with
     * {@link org.kvplane.exception.MetricsSourceException}
     */
    Mono<List<MetricPoint>> queryRange(String metric, Instant start, Instant end);
}
