package org.kvplane.httpserver;

import org.kvplane.planner.core.SlaPlanner;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

import static org.springframework.web.reactive.function.server.RequestPredicates.accept;
import static org.springframework.web.reactive.function.server.RouterFunctions.route;

@Component
public class PlannerAdminServer {

    private final SlaPlanner slaPlanner;

    public PlannerAdminServer(SlaPlanner slaPlanner) {
        this.slaPlanner = slaPlanner;
    }

    @Bean
    public RouterFunction<ServerResponse> plannerAdmin() {
        return route()
                .GET("/v1/planner/status", accept(MediaType.ALL), this::status)
                .build();
    }

    public Mono<ServerResponse> status(ServerRequest request) {
        return ServerResponses.json(slaPlanner.status());
    }
}
