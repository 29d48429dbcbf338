package org.kvplane.httpserver;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.kvplane.balance.router.KvRouter;
import org.kvplane.cache.hash.BlockHasher;
import org.kvplane.config.ConfigService;
import org.kvplane.dao.cache.KvCacheEvent;
import org.kvplane.dao.routing.RequestIdBody;
import org.kvplane.dao.routing.RouteRequest;
import org.kvplane.dao.worker.RuntimeConfig;
import org.kvplane.dao.worker.WorkerInfo;
import org.kvplane.dao.worker.WorkerRef;
import org.kvplane.registry.WorkerRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;

@AutoConfigureWebTestClient
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class AdminApiIntegrationTest {

    private static final WorkerRef W1 = WorkerRef.of(1);
    private static final WorkerRef W2 = WorkerRef.of(2);
    private static final List<Integer> PROMPT = IntStream.range(0, 32).boxed().collect(Collectors.toList());

    @TestConfiguration
    static class TestConfig {

        @Bean
        @Primary
        public ConfigService testConfigService() {
            return new ConfigService(Map.of("KVPLANE_SCHEDULER_TIMEOUT_MS", "2000")::get);
        }
    }

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private WorkerRegistry workerRegistry;

    @Autowired
    private KvRouter kvRouter;

    @Autowired
    private BlockHasher blockHasher;

    @BeforeEach
    void setUp() {
        workerRegistry.reconcile(List.of(
                WorkerInfo.of(W1, RuntimeConfig.defaults()),
                WorkerInfo.of(W2, RuntimeConfig.defaults())));
        kvRouter.resetStates().block();
    }

    private void storePromptOn(WorkerRef worker) {
        List<KvCacheEvent> events = blockHasher.computeBlockHashes(PROMPT).stream()
                .map(hash -> KvCacheEvent.stored(worker, hash))
                .collect(Collectors.toList());
        webTestClient.post().uri("/v1/cache/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(events)
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.applied").isEqualTo(2);
    }

    @Test
    void should_report_healthy() {
        webTestClient.get().uri("/health")
                .accept(MediaType.TEXT_PLAIN)
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo("success");
    }

    @Test
    @DisplayName("cached prefix routes to its worker and the reservation can be released")
    void should_route_to_worker_holding_prefix() {
        storePromptOn(W2);

        webTestClient.post().uri("/v1/router/route")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(RouteRequest.builder().requestId("req-1").tokens(PROMPT).build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.worker.workerId").isEqualTo(2)
                .jsonPath("$.overlapBlocks").isEqualTo(2)
                .jsonPath("$.reserved").isEqualTo(true)
                .jsonPath("$.fallback").isEqualTo(false);

        webTestClient.post().uri("/v1/router/prefill_complete")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new RequestIdBody("req-1"))
                .exchange()
                .expectStatus().isOk();
        webTestClient.post().uri("/v1/router/free")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new RequestIdBody("req-1"))
                .exchange()
                .expectStatus().isOk();
    }

    @Test
    void should_reject_duplicate_request_id() {
        RouteRequest request = RouteRequest.builder().requestId("req-dup").tokens(PROMPT).build();
        webTestClient.post().uri("/v1/router/route")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .exchange()
                .expectStatus().isOk();

        webTestClient.post().uri("/v1/router/route")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody().jsonPath("$.name").isEqualTo("DuplicateRequest");
    }

    @Test
    void should_require_request_id_for_route() {
        webTestClient.post().uri("/v1/router/route")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(RouteRequest.builder().tokens(PROMPT).build())
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void should_list_workers_and_potential_loads() {
        webTestClient.get().uri("/v1/router/workers")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].workerRef.workerId").isEqualTo(1);

        webTestClient.post().uri("/v1/router/potential_loads")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(RouteRequest.builder().tokens(PROMPT).build())
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.length()").isEqualTo(2);
    }

    @Test
    void should_dump_and_reset_indexed_events() {
        storePromptOn(W1);

        webTestClient.get().uri("/v1/router/events")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.length()").isEqualTo(2);

        webTestClient.post().uri("/v1/router/reset")
                .exchange()
                .expectStatus().isOk();

        List<KvCacheEvent> events = kvRouter.dumpEvents();
        assertEquals(0, events.size());
    }

    @Test
    void should_expose_planner_status() {
        webTestClient.get().uri("/v1/planner/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.running").isEqualTo(false)
                .jsonPath("$.predictor").isEqualTo("AUTOREGRESSIVE");
    }
}
