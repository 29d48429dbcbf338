package org.kvplane.service;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.balance.router.KvRouter;
import org.kvplane.balance.strategy.LoadBalanceStrategyFactory;
import org.kvplane.config.ConfigService;
import org.kvplane.config.RouterConfig;
import org.kvplane.dao.routing.RouterConfigOverride;
import org.kvplane.dao.routing.RoutingDecision;
import org.kvplane.dao.worker.WorkerRef;
import org.kvplane.enums.RouterMode;
import org.kvplane.exception.KvPlaneException;
import org.kvplane.exception.NoEligibleWorkerException;
import org.kvplane.exception.SchedulerUnavailableException;
import org.kvplane.registry.WorkerRegistry;
import org.kvplane.service.monitor.RoutingReporter;
import org.kvplane.util.Logger;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;

/**
 * Caller-side routing entry. Applies the configured router mode and, in KV mode, falls back to round robin when
 * the KV router cannot answer.
 */
@Slf4j
@Component
public class RouteService {

    private static final RouterMode FALLBACK_MODE = RouterMode.ROUND_ROBIN;

    private final RouterConfig config;

    private final KvRouter router;

    private final WorkerRegistry registry;

    private final RoutingReporter reporter;

    public RouteService(ConfigService configService, KvRouter router, WorkerRegistry registry,
                        RoutingReporter reporter) {
        this.config = configService.routerConfig();
        this.router = router;
        this.registry = registry;
        this.reporter = reporter;
    }

    /**
     * Route a request
     *
     * @param requestId request id, the key for {@link #release} and {@link #markPrefillComplete}
     * @param tokens    prompt token ids
     * @param override  per-request scoring overrides, nullable
     * @return routing decision
     */
    public Mono<RoutingDecision> route(String requestId, List<Integer> tokens, RouterConfigOverride override) {
        RouterMode mode = config.getRouterMode();
        Mono<RoutingDecision> result;
        if (mode == RouterMode.KV) {
            result = router.findBestMatch(requestId, tokens, override, true)
                    .onErrorResume(RouteService::isFallbackError, e -> fallback(requestId, e));
        } else {
            result = Mono.fromCallable(() -> naive(mode, requestId));
        }
        return result
                .doOnNext(decision -> reporter.reportRoutingSuccess())
                .doOnError(KvPlaneException.class, e -> onRoutingFailure(requestId, e));
    }

    private void onRoutingFailure(String requestId, KvPlaneException e) {
        if (e.isSimpleException()) {
            Logger.warn("Routing request {} failed: {}", requestId, e.getMessage());
        } else {
            Logger.error("Routing request {} failed", requestId, e);
        }
        reporter.reportRoutingFailure(e.getCode());
    }

    /**
     * Release the load reserved for a finished request. A no-op outside KV mode.
     */
    public Mono<Void> release(String requestId) {
        if (config.getRouterMode() != RouterMode.KV) {
            return Mono.empty();
        }
        return router.free(requestId).then();
    }

    public Mono<Void> markPrefillComplete(String requestId) {
        if (config.getRouterMode() != RouterMode.KV) {
            return Mono.empty();
        }
        return router.markPrefillComplete(requestId).then();
    }

    private Mono<RoutingDecision> fallback(String requestId, Throwable cause) {
        Set<WorkerRef> workers = registry.snapshot();
        if (workers.isEmpty()) {
            return Mono.error(cause);
        }
        WorkerRef worker = LoadBalanceStrategyFactory.getLoadBalancer(FALLBACK_MODE).select(workers);
        Logger.warn("KV routing failed for request {}: {}, falling back to {} on {}",
                requestId, cause.getMessage(), FALLBACK_MODE, worker);
        reporter.reportFallback(FALLBACK_MODE);
        return Mono.just(RoutingDecision.builder()
                .worker(worker)
                .requestId(requestId)
                .fallback(true)
                .build());
    }

    private RoutingDecision naive(RouterMode mode, String requestId) {
        WorkerRef worker = LoadBalanceStrategyFactory.getLoadBalancer(mode).select(registry.snapshot());
        return RoutingDecision.builder()
                .worker(worker)
                .requestId(requestId)
                .build();
    }

    private static boolean isFallbackError(Throwable e) {
        return e instanceof SchedulerUnavailableException || e instanceof NoEligibleWorkerException;
    }
}
