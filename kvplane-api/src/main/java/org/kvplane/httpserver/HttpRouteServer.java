package org.kvplane.httpserver;

import org.apache.commons.lang3.StringUtils;
import org.kvplane.balance.router.KvRouter;
import org.kvplane.dao.routing.RequestIdBody;
import org.kvplane.dao.routing.RouteRequest;
import org.kvplane.service.RouteService;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

import java.util.Collections;

import static org.springframework.web.reactive.function.server.RequestPredicates.accept;
import static org.springframework.web.reactive.function.server.RouterFunctions.route;

/**
 * Request path used by the serving frontend: route a prompt, then report prefill completion and release
 */
@Component
public class HttpRouteServer {

    private final RouteService routeService;

    private final KvRouter kvRouter;

    public HttpRouteServer(RouteService routeService, KvRouter kvRouter) {
        this.routeService = routeService;
        this.kvRouter = kvRouter;
    }

    @Bean
    public RouterFunction<ServerResponse> routing() {
        return route()
                .POST("/v1/router/route", accept(MediaType.APPLICATION_JSON), this::routeRequest)
                .POST("/v1/router/best_worker", accept(MediaType.APPLICATION_JSON), this::bestWorker)
                .POST("/v1/router/potential_loads", accept(MediaType.APPLICATION_JSON), this::potentialLoads)
                .POST("/v1/router/free", accept(MediaType.APPLICATION_JSON), this::free)
                .POST("/v1/router/prefill_complete", accept(MediaType.APPLICATION_JSON), this::prefillComplete)
                .build();
    }

    public Mono<ServerResponse> routeRequest(ServerRequest request) {
        return request.bodyToMono(RouteRequest.class)
                .flatMap(req -> {
                    if (StringUtils.isBlank(req.getRequestId())) {
                        return ServerResponses.badRequest("requestId is required");
                    }
                    return routeService.route(req.getRequestId(), req.getTokens(), req.override())
                            .flatMap(ServerResponses::json);
                })
                .onErrorResume(ServerResponses::error);
    }

    public Mono<ServerResponse> bestWorker(ServerRequest request) {
        return request.bodyToMono(RouteRequest.class)
                .flatMap(req -> kvRouter.bestWorker(req.getTokens(), req.override()))
                .flatMap(ServerResponses::json)
                .onErrorResume(ServerResponses::error);
    }

    public Mono<ServerResponse> potentialLoads(ServerRequest request) {
        return request.bodyToMono(RouteRequest.class)
                .flatMap(req -> kvRouter.potentialLoads(req.getTokens()))
                .flatMap(ServerResponses::json)
                .onErrorResume(ServerResponses::error);
    }

    public Mono<ServerResponse> free(ServerRequest request) {
        return request.bodyToMono(RequestIdBody.class)
                .flatMap(req -> StringUtils.isBlank(req.getRequestId())
                        ? ServerResponses.badRequest("requestId is required")
                        : routeService.release(req.getRequestId())
                        .then(ServerResponses.json(Collections.singletonMap("requestId", req.getRequestId()))))
                .onErrorResume(ServerResponses::error);
    }

    public Mono<ServerResponse> prefillComplete(ServerRequest request) {
        return request.bodyToMono(RequestIdBody.class)
                .flatMap(req -> StringUtils.isBlank(req.getRequestId())
                        ? ServerResponses.badRequest("requestId is required")
                        : routeService.markPrefillComplete(req.getRequestId())
                        .then(ServerResponses.json(Collections.singletonMap("requestId", req.getRequestId()))))
                .onErrorResume(ServerResponses::error);
    }
}
