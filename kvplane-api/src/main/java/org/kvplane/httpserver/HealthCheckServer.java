package org.kvplane.httpserver;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.balance.scheduler.KvScheduler;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

import static org.springframework.web.reactive.function.server.RequestPredicates.accept;
import static org.springframework.web.reactive.function.server.RouterFunctions.route;

@Slf4j
@Component
public class HealthCheckServer {

    private final KvScheduler kvScheduler;

    public HealthCheckServer(KvScheduler kvScheduler) {
        this.kvScheduler = kvScheduler;
    }

    @Bean
    public RouterFunction<ServerResponse> healthCheck() {
        return route()
                .path("/health", b -> b.GET(accept(MediaType.APPLICATION_JSON, MediaType.TEXT_PLAIN),
                        serverRequest -> this.healthHandler()))
                .build();
    }

    /**
     * Unhealthy once the scheduler loop has stopped
     */
    public Mono<ServerResponse> healthHandler() {
        if (!kvScheduler.isRunning()) {
            log.info("health check failed, scheduler loop is not running");
            return ServerResponse.status(404).body(Mono.just("scheduler stopped"), String.class);
        }
        return ServerResponse.ok().body(Mono.just("success"), String.class);
    }
}
