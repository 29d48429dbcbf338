package org.kvplane.service.monitor;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.enums.KvMetricType;
import org.kvplane.enums.RouterMode;
import org.kvplane.metric.KvMonitor;
import org.kvplane.metric.MetricTags;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;

import static org.kvplane.constant.MetricConstant.ROUTING_ABANDONED_QPS;
import static org.kvplane.constant.MetricConstant.ROUTING_ACTIVE_DECODE_BLOCKS;
import static org.kvplane.constant.MetricConstant.ROUTING_ACTIVE_PREFILL_TOKENS;
import static org.kvplane.constant.MetricConstant.ROUTING_FAILURE_QPS;
import static org.kvplane.constant.MetricConstant.ROUTING_FALLBACK_QPS;
import static org.kvplane.constant.MetricConstant.ROUTING_LIVE_WORKERS;
import static org.kvplane.constant.MetricConstant.ROUTING_QUEUE_LENGTH;
import static org.kvplane.constant.MetricConstant.ROUTING_QUEUE_REJECTED_QPS;
import static org.kvplane.constant.MetricConstant.ROUTING_QUEUE_WAIT_TIME_MS;
import static org.kvplane.constant.MetricConstant.ROUTING_SUCCESS_QPS;

/**
 * Scheduler queue and routing outcome metrics
 */
@Slf4j
@Component
public class RoutingReporter {

    private final KvMonitor monitor;

    private final MetricTags tags = MetricTags.of();

    public RoutingReporter(KvMonitor monitor) {
        this.monitor = monitor;
    }

    @PostConstruct
    public void init() {
        monitor.register(ROUTING_QUEUE_LENGTH, KvMetricType.GAUGE);
        monitor.register(ROUTING_QUEUE_WAIT_TIME_MS, KvMetricType.GAUGE);
        monitor.register(ROUTING_QUEUE_REJECTED_QPS, KvMetricType.QPS);
        monitor.register(ROUTING_ABANDONED_QPS, KvMetricType.QPS);

        monitor.register(ROUTING_SUCCESS_QPS, KvMetricType.QPS);
        monitor.register(ROUTING_FAILURE_QPS, KvMetricType.QPS);
        monitor.register(ROUTING_FALLBACK_QPS, KvMetricType.QPS);

        monitor.register(ROUTING_ACTIVE_DECODE_BLOCKS, KvMetricType.GAUGE);
        monitor.register(ROUTING_ACTIVE_PREFILL_TOKENS, KvMetricType.GAUGE);
        monitor.register(ROUTING_LIVE_WORKERS, KvMetricType.GAUGE);
        log.info("RoutingReporter initialized and metrics registered");
    }

    public void reportQueueSize(long queueSize) {
        monitor.report(ROUTING_QUEUE_LENGTH, tags, queueSize);
    }

    public void reportQueueWaitTime(long waitTimeMs) {
        monitor.report(ROUTING_QUEUE_WAIT_TIME_MS, tags, waitTimeMs);
    }

    public void reportRejected() {
        monitor.report(ROUTING_QUEUE_REJECTED_QPS, tags, 1.0);
    }

    /**
     * A command whose caller gave up before or while it ran
     */
    public void reportAbandoned() {
        monitor.report(ROUTING_ABANDONED_QPS, tags, 1.0);
    }

    public void reportRoutingSuccess() {
        monitor.report(ROUTING_SUCCESS_QPS, tags, 1.0);
    }

    public void reportRoutingFailure(int code) {
        monitor.report(ROUTING_FAILURE_QPS, MetricTags.of("code", String.valueOf(code)), 1.0);
    }

    public void reportFallback(RouterMode fallbackMode) {
        monitor.report(ROUTING_FALLBACK_QPS, MetricTags.of("mode", fallbackMode.name()), 1.0);
    }

    public void reportActiveLoad(long decodeBlocks, long prefillTokens) {
        monitor.report(ROUTING_ACTIVE_DECODE_BLOCKS, tags, decodeBlocks);
        monitor.report(ROUTING_ACTIVE_PREFILL_TOKENS, tags, prefillTokens);
    }

    public void reportLiveWorkers(int workers) {
        monitor.report(ROUTING_LIVE_WORKERS, tags, workers);
    }
}
