package org.kvplane.planner.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.kvplane.enums.StatusEnum;
import org.kvplane.exception.MetricsSourceException;
import org.kvplane.planner.domain.MetricPoint;
import org.kvplane.util.JsonUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads range vectors from a Prometheus compatible {@code /api/v1/query_range} endpoint
 */
@Slf4j
public class PrometheusMetricsSource implements MetricsSource {

    static final String QUERY_RANGE_PATH = "/api/v1/query_range";

    private final WebClient webClient;

    private final Duration step;

    private final Duration timeout;

    public PrometheusMetricsSource(WebClient webClient, Duration step, Duration timeout) {
        this.webClient = webClient;
        this.step = step;
        this.timeout = timeout;
    }

    @Override
    public Mono<List<MetricPoint>> queryRange(String metric, Instant start, Instant end) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder.path(QUERY_RANGE_PATH)
                        .queryParam("query", "{query}")
                        .queryParam("start", start.getEpochSecond())
                        .queryParam("end", end.getEpochSecond())
                        .queryParam("step", Math.max(1, step.getSeconds()) + "s")
                        .build(metric))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .map(PrometheusMetricsSource::parseMatrix)
                .onErrorMap(e -> !(e instanceof MetricsSourceException), e -> {
                    if (e instanceof WebClientResponseException) {
                        WebClientResponseException responseException = (WebClientResponseException) e;
                        return StatusEnum.METRICS_SOURCE_ERROR.toException(
                                "query " + metric + " returned " + responseException.getRawStatusCode(), e);
                    }
                    return StatusEnum.METRICS_SOURCE_ERROR.toException("query " + metric + " failed", e);
                });
    }

    /**
     * Flatten every series of a {@code matrix} result into one time ordered list. NaN and infinite samples are
     * dropped.
     */
    static List<MetricPoint> parseMatrix(String body) {
        JsonNode root = JsonUtils.toTreeNode(body);
        String status = root.path("status").asText();
        if (!"success".equals(status)) {
            throw StatusEnum.METRICS_SOURCE_ERROR.toException(
                    "status " + status + ", error " + root.path("error").asText());
        }
        JsonNode data = root.path("data");
        String resultType = data.path("resultType").asText();
        if (!"matrix".equals(resultType)) {
            throw StatusEnum.METRICS_SOURCE_ERROR.toException("unexpected result type " + resultType);
        }
        List<MetricPoint> points = new ArrayList<>();
        for (JsonNode series : data.path("result")) {
            for (JsonNode value : series.path("values")) {
                if (!value.isArray() || value.size() < 2) {
                    continue;
                }
                double sample;
                try {
                    sample = Double.parseDouble(value.get(1).asText());
                } catch (NumberFormatException e) {
                    log.warn("skip malformed sample {}", value);
                    continue;
                }
                if (Double.isNaN(sample) || Double.isInfinite(sample)) {
                    continue;
                }
                long millis = Math.round(value.get(0).asDouble() * 1000);
                points.add(new MetricPoint(Instant.ofEpochMilli(millis), sample));
            }
        }
        points.sort(Comparator.comparing(MetricPoint::getTimestamp));
        return points;
    }
}
