package org.kvplane.planner.metrics;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.config.PlannerConfig;
import org.kvplane.enums.StatusEnum;
import org.kvplane.exception.MetricsSourceException;
import org.kvplane.planner.domain.MetricPoint;
import org.kvplane.planner.domain.MetricsSample;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Builds one {@link MetricsSample} per adjustment interval from the five configured traffic series
 */
@Slf4j
public class TrafficMetricsCollector {

    private final MetricsSource metricsSource;

    private final PlannerConfig config;

    public TrafficMetricsCollector(MetricsSource metricsSource, PlannerConfig config) {
        this.metricsSource = metricsSource;
        this.config = config;
    }

    /**
     * Sample {@code [now - interval, now]}. Blocks the calling thread.
     *
     * @throws org.kvplane.exception.MetricsSourceException when any query fails or times out
     */
    public MetricsSample collect(Instant now) {
        Instant start = now.minusSeconds(config.getAdjustmentIntervalSecs());
        Mono<MetricsSample> sample = Mono.zip(
                        average(config.getRequestCountQuery(), start, now),
                        average(config.getInputLenQuery(), start, now),
                        average(config.getOutputLenQuery(), start, now),
                        average(config.getTtftQuery(), start, now),
                        average(config.getItlQuery(), start, now))
                .map(values -> MetricsSample.builder()
                        .timestamp(now)
                        .requestCount(values.getT1())
                        .inputLen(values.getT2())
                        .outputLen(values.getT3())
                        .ttftMs(values.getT4())
                        .itlMs(values.getT5())
                        .build())
                .timeout(Duration.ofMillis(config.getMetricsQueryTimeoutMs()))
                .onErrorMap(e -> !(e instanceof MetricsSourceException),
                        e -> StatusEnum.METRICS_SOURCE_ERROR.toException("collect traffic sample failed", e));
        MetricsSample result = sample.block();
        log.info("collected traffic sample: {}", result);
        return result;
    }

    private Mono<Double> average(String metric, Instant start, Instant end) {
        return metricsSource.queryRange(metric, start, end).map(TrafficMetricsCollector::mean);
    }

    static double mean(List<MetricPoint> points) {
        if (points == null || points.isEmpty()) {
            return 0;
        }
        return points.stream().mapToDouble(MetricPoint::getValue).average().orElse(0);
    }
}
