package org.kvplane.httpserver;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.balance.router.KvRouter;
import org.kvplane.cache.service.KvEventConsumer;
import org.kvplane.dao.cache.KvCacheEvent;
import org.kvplane.dao.cache.KvCacheSnapshot;
import org.kvplane.dao.worker.WorkerInfo;
import org.kvplane.registry.WorkerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.springframework.web.reactive.function.server.RequestPredicates.accept;
import static org.springframework.web.reactive.function.server.RouterFunctions.route;

/**
 * Operational endpoints of the router plus the HTTP entry of the KV-cache event channel
 */
@Slf4j
@Component
public class RouterAdminServer {

    private static final ParameterizedTypeReference<List<KvCacheEvent>> EVENT_LIST =
            new ParameterizedTypeReference<List<KvCacheEvent>>() {
            };

    private final KvRouter kvRouter;

    private final WorkerRegistry workerRegistry;

    private final KvEventConsumer kvEventConsumer;

    public RouterAdminServer(KvRouter kvRouter, WorkerRegistry workerRegistry, KvEventConsumer kvEventConsumer) {
        this.kvRouter = kvRouter;
        this.workerRegistry = workerRegistry;
        this.kvEventConsumer = kvEventConsumer;
    }

    @Bean
    public RouterFunction<ServerResponse> routerAdmin() {
        return route()
                .POST("/v1/router/reset", accept(MediaType.ALL), this::reset)
                .GET("/v1/router/events", accept(MediaType.ALL), this::dumpEvents)
                .GET("/v1/router/workers", accept(MediaType.ALL), this::workers)
                .POST("/v1/cache/events", accept(MediaType.APPLICATION_JSON), this::applyEvents)
                .POST("/v1/cache/snapshot", accept(MediaType.APPLICATION_JSON), this::applySnapshot)
                .build();
    }

    public Mono<ServerResponse> reset(ServerRequest request) {
        log.warn("recv router reset request");
        return kvRouter.resetStates()
                .then(ServerResponses.json(Collections.singletonMap("reset", true)))
                .onErrorResume(e -> {
                    log.error("router reset failed", e);
                    return ServerResponses.error(e);
                });
    }

    public Mono<ServerResponse> dumpEvents(ServerRequest request) {
        return Mono.fromCallable(kvRouter::dumpEvents)
                .flatMap(ServerResponses::json)
                .onErrorResume(ServerResponses::error);
    }

    public Mono<ServerResponse> workers(ServerRequest request) {
        List<WorkerInfo> workers = workerRegistry.snapshot().stream()
                .sorted()
                .map(ref -> WorkerInfo.of(ref, workerRegistry.runtimeConfig(ref)))
                .collect(Collectors.toList());
        return ServerResponses.json(workers);
    }

    public Mono<ServerResponse> applyEvents(ServerRequest request) {
        return request.bodyToMono(EVENT_LIST)
                .map(events -> Collections.singletonMap("applied", kvEventConsumer.onEvents(events)))
                .flatMap(ServerResponses::json)
                .onErrorResume(e -> {
                    log.error("apply kv cache events failed", e);
                    return ServerResponses.error(e);
                });
    }

    public Mono<ServerResponse> applySnapshot(ServerRequest request) {
        return request.bodyToMono(KvCacheSnapshot.class)
                .flatMap(snapshot -> {
                    kvEventConsumer.onSnapshot(snapshot.workerRef(), snapshot.getBlockHashes());
                    return ServerResponses.json(Collections.singletonMap("worker", snapshot.workerRef().toString()));
                })
                .onErrorResume(ServerResponses::error);
    }
}
