package org.kvplane.cache.monitor;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.dao.cache.KvCacheAction;
import org.kvplane.dao.worker.WorkerRef;
import org.kvplane.enums.KvMetricType;
import org.kvplane.metric.KvMonitor;
import org.kvplane.metric.MetricTags;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;

import static org.kvplane.constant.MetricConstant.CACHE_EVENTS_APPLIED_QPS;
import static org.kvplane.constant.MetricConstant.CACHE_EVENTS_DROPPED_QPS;
import static org.kvplane.constant.MetricConstant.CACHE_INDEXED_BLOCKS;
import static org.kvplane.constant.MetricConstant.CACHE_OVERLAP_RATIO;
import static org.kvplane.constant.MetricConstant.CACHE_SNAPSHOT_ADDED_BLOCKS;
import static org.kvplane.constant.MetricConstant.CACHE_SNAPSHOT_REMOVED_BLOCKS;
import static org.kvplane.constant.MetricConstant.CACHE_WORKER_EVICTED_QPS;

/**
 * Registers and reports every indexer metric
 */
@Slf4j
@Component
public class CacheMetricsReporter {

    private final KvMonitor monitor;

    public CacheMetricsReporter(KvMonitor monitor) {
        this.monitor = monitor;
    }

    @PostConstruct
    public void init() {
        monitor.register(CACHE_INDEXED_BLOCKS, KvMetricType.GAUGE);
        monitor.register(CACHE_EVENTS_APPLIED_QPS, KvMetricType.QPS);
        monitor.register(CACHE_EVENTS_DROPPED_QPS, KvMetricType.QPS);
        monitor.register(CACHE_WORKER_EVICTED_QPS, KvMetricType.QPS);
        monitor.register(CACHE_SNAPSHOT_ADDED_BLOCKS, KvMetricType.GAUGE);
        monitor.register(CACHE_SNAPSHOT_REMOVED_BLOCKS, KvMetricType.GAUGE);
        monitor.register(CACHE_OVERLAP_RATIO, KvMetricType.GAUGE);
        log.info("CacheMetricsReporter initialized and metrics registered");
    }

    public void reportEventApplied(KvCacheAction action) {
        monitor.report(CACHE_EVENTS_APPLIED_QPS, MetricTags.of("action", action.name()), 1.0);
    }

    public void reportEventDropped() {
        monitor.report(CACHE_EVENTS_DROPPED_QPS, 1.0);
    }

    public void reportWorkerEvicted() {
        monitor.report(CACHE_WORKER_EVICTED_QPS, 1.0);
    }

    public void reportSnapshotDiff(WorkerRef worker, int addedBlocks, int removedBlocks) {
        MetricTags tags = MetricTags.of("worker", worker.toString());
        monitor.report(CACHE_SNAPSHOT_ADDED_BLOCKS, tags, addedBlocks);
        monitor.report(CACHE_SNAPSHOT_REMOVED_BLOCKS, tags, removedBlocks);
    }

    public void reportIndexSize(long mappings) {
        monitor.report(CACHE_INDEXED_BLOCKS, mappings);
    }

    /**
     * @param ratio matched blocks of the chosen worker divided by request blocks
     */
    public void reportOverlapRatio(double ratio) {
        monitor.report(CACHE_OVERLAP_RATIO, ratio);
    }
}
