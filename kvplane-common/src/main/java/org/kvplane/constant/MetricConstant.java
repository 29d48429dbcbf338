package org.kvplane.constant;

public class MetricConstant {

    /*------------------------------------------------ indexer ------------------------------------------------------*/

    public static final String CACHE_INDEXED_BLOCKS = "kvplane.cache.indexed.blocks";

    public static final String CACHE_EVENTS_APPLIED_QPS = "kvplane.cache.events.applied.qps";

    public static final String CACHE_EVENTS_DROPPED_QPS = "kvplane.cache.events.dropped.qps";

    public static final String CACHE_WORKER_EVICTED_QPS = "kvplane.cache.worker.evicted.qps";

    public static final String CACHE_SNAPSHOT_ADDED_BLOCKS = "kvplane.cache.snapshot.added.blocks";

    public static final String CACHE_SNAPSHOT_REMOVED_BLOCKS = "kvplane.cache.snapshot.removed.blocks";

    public static final String CACHE_OVERLAP_RATIO = "kvplane.cache.overlap.ratio";

    /*------------------------------------------------ routing ------------------------------------------------------*/

    public static final String ROUTING_QUEUE_LENGTH = "kvplane.routing.queue.length";

    public static final String ROUTING_QUEUE_WAIT_TIME_MS = "kvplane.routing.queue.wait.time.ms";

    public static final String ROUTING_QUEUE_REJECTED_QPS = "kvplane.routing.queue.rejected.qps";

    public static final String ROUTING_ABANDONED_QPS = "kvplane.routing.abandoned.qps";

    public static final String ROUTING_SUCCESS_QPS = "kvplane.routing.success.qps";

    public static final String ROUTING_FAILURE_QPS = "kvplane.routing.failure.qps";

    public static final String ROUTING_FALLBACK_QPS = "kvplane.routing.fallback.qps";

    public static final String ROUTING_ACTIVE_DECODE_BLOCKS = "kvplane.routing.active.decode.blocks";

    public static final String ROUTING_ACTIVE_PREFILL_TOKENS = "kvplane.routing.active.prefill.tokens";

    public static final String ROUTING_LIVE_WORKERS = "kvplane.routing.live.workers";

    /*------------------------------------------------ planner ------------------------------------------------------*/

    public static final String PLANNER_TARGET_REPLICAS = "kvplane.planner.target.replicas";

    public static final String PLANNER_CORRECTION_FACTOR = "kvplane.planner.correction.factor";

    public static final String PLANNER_PREDICTED_REQUESTS = "kvplane.planner.predicted.requests";

    public static final String PLANNER_CAPACITY_INFEASIBLE_QPS = "kvplane.planner.capacity.infeasible.qps";

    public static final String PLANNER_CYCLE_FAILURE_QPS = "kvplane.planner.cycle.failure.qps";

    public static final String PLANNER_CYCLE_SKIPPED_QPS = "kvplane.planner.cycle.skipped.qps";

    public static final String PLANNER_CONNECTOR_FAILURE_QPS = "kvplane.planner.connector.failure.qps";
}
