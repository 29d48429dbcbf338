package org.kvplane.balance.router;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.balance.scheduler.KvScheduler;
import org.kvplane.balance.scheduler.SchedulerCommand;
import org.kvplane.balance.scheduler.SchedulingRequest;
import org.kvplane.cache.core.KvIndexer;
import org.kvplane.cache.hash.BlockHasher;
import org.kvplane.cache.monitor.CacheMetricsReporter;
import org.kvplane.config.RouterConfig;
import org.kvplane.dao.cache.KvCacheEvent;
import org.kvplane.dao.routing.PotentialLoad;
import org.kvplane.dao.routing.RouterConfigOverride;
import org.kvplane.dao.routing.RoutingDecision;
import org.kvplane.dao.worker.WorkerRef;
import org.kvplane.enums.StatusEnum;
import org.kvplane.registry.WorkerRegistry;
import org.kvplane.util.Logger;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * KV-aware router: hashes the prompt, looks up cached prefixes and asks the scheduler for a worker.
 * <p>
 * Every wait on the scheduler is bounded by {@code schedulerTimeoutMs}. A command the caller stopped waiting for is
 * abandoned, so the scheduler either skips it or undoes its reservation.
 */
@Slf4j
public class KvRouter {

    private final RouterConfig config;

    private final BlockHasher blockHasher;

    private final KvIndexer indexer;

    private final WorkerRegistry registry;

    private final KvScheduler scheduler;

    private final CacheMetricsReporter cacheMetricsReporter;

    public KvRouter(RouterConfig config, BlockHasher blockHasher, KvIndexer indexer, WorkerRegistry registry,
                    KvScheduler scheduler, CacheMetricsReporter cacheMetricsReporter) {
        this.config = config;
        this.blockHasher = blockHasher;
        this.indexer = indexer;
        this.registry = registry;
        this.scheduler = scheduler;
        this.cacheMetricsReporter = cacheMetricsReporter;
    }

    /**
     * Pick the best worker for a token sequence
     *
     * @param requestId    reservation key, null for query-only
     * @param tokens       prompt token ids
     * @param override     per-request scoring overrides, nullable
     * @param updateStates reserve load on the chosen worker and record the decision in the indexer
     */
    public Mono<RoutingDecision> findBestMatch(String requestId, List<Integer> tokens, RouterConfigOverride override,
                                               boolean updateStates) {
        return Mono.defer(() -> {
            List<Integer> sequence = tokens == null ? Collections.emptyList() : tokens;
            List<Long> blockHashes = blockHasher.computeBlockHashes(sequence);
            SchedulingRequest request = buildRequest(requestId, sequence, blockHashes, override, updateStates);
            return await(scheduler.schedule(request))
                    .doOnNext(decision -> afterDecision(decision, blockHashes, updateStates));
        });
    }

    /**
     * Query-only variant of {@link #findBestMatch}, changes no state
     */
    public Mono<RoutingDecision> bestWorker(List<Integer> tokens, RouterConfigOverride override) {
        return findBestMatch(null, tokens, override, false);
    }

    public Mono<Boolean> free(String requestId) {
        return Mono.defer(() -> await(scheduler.free(requestId)));
    }

    public Mono<Boolean> markPrefillComplete(String requestId) {
        return Mono.defer(() -> await(scheduler.markPrefillComplete(requestId)));
    }

    /**
     * Load every live worker would carry if the sequence were routed to it
     */
    public Mono<List<PotentialLoad>> potentialLoads(List<Integer> tokens) {
        return Mono.defer(() -> {
            List<Integer> sequence = tokens == null ? Collections.emptyList() : tokens;
            List<Long> blockHashes = blockHasher.computeBlockHashes(sequence);
            return await(scheduler.potentialLoads(buildRequest(null, sequence, blockHashes, null, false)));
        });
    }

    public List<KvCacheEvent> dumpEvents() {
        return indexer.dumpEvents();
    }

    /**
     * Clear the indexer and the scheduler's load state
     */
    public Mono<Void> resetStates() {
        return Mono.defer(() -> {
            indexer.clear();
            log.info("Router state reset requested");
            return Mono.fromFuture(scheduler.reset())
                    .timeout(Duration.ofMillis(config.getSchedulerTimeoutMs()))
                    .onErrorMap(TimeoutException.class, e -> StatusEnum.SCHEDULER_UNAVAILABLE.toException(
                            "reset not applied within " + config.getSchedulerTimeoutMs() + "ms", e));
        });
    }

    private SchedulingRequest buildRequest(String requestId, List<Integer> tokens, List<Long> blockHashes,
                                           RouterConfigOverride override, boolean updateStates) {
        Map<WorkerRef, Integer> overlaps = indexer.lookupOverlap(blockHashes);
        Set<WorkerRef> candidates = registry.snapshot();
        return SchedulingRequest.builder()
                .requestId(requestId)
                .blockHashes(blockHashes)
                .inputLength(tokens.size())
                .overlaps(overlaps)
                .candidates(candidates)
                .override(override)
                .updateStates(updateStates)
                .build();
    }

    private <T> Mono<T> await(SchedulerCommand<T> command) {
        long timeoutMs = config.getSchedulerTimeoutMs();
        return Mono.fromFuture(command.getFuture())
                .doOnCancel(command::abandon)
                .timeout(Duration.ofMillis(timeoutMs))
                .onErrorMap(TimeoutException.class, e -> {
                    command.abandon();
                    Logger.warn("Scheduler did not answer {} within {}ms", command.getName(), timeoutMs);
                    return StatusEnum.SCHEDULER_UNAVAILABLE.toException(
                            command.getName() + " timed out after " + timeoutMs + "ms", e);
                });
    }

    private void afterDecision(RoutingDecision decision, List<Long> blockHashes, boolean updateStates) {
        if (updateStates) {
            indexer.applyRoutingDecision(decision.getWorker(), blockHashes);
        }
        if (!blockHashes.isEmpty()) {
            cacheMetricsReporter.reportOverlapRatio((double) decision.getOverlapBlocks() / blockHashes.size());
        }
    }
}
