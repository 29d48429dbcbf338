package org.kvplane.planner.connector;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.kvplane.enums.StatusEnum;
import org.kvplane.exception.KvPlaneException;
import org.kvplane.planner.domain.DeploymentStatus;
import org.kvplane.util.JsonUtils;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collections;

/**
 * JSON over HTTP: {@code PATCH /deployments/{name}/roles/{role}} with {@code {"replicas": n}} and
 * {@code GET /deployments/{name}/status} answering {@code {"status": "READY" | "PENDING"}}.
 */
@Slf4j
public class HttpOrchestrationClient implements OrchestrationClient {

    private final WebClient webClient;

    private final Duration timeout;

    public HttpOrchestrationClient(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    @Override
    public Mono<Void> patchReplicas(String deployment, String role, int replicas) {
        return webClient.patch()
                .uri("/deployments/{name}/roles/{role}", deployment, role)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Collections.singletonMap("replicas", replicas))
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .doOnSuccess(response -> log.info("patched {}/{} to {} replicas", deployment, role, replicas))
                .then()
                .onErrorMap(e -> !(e instanceof KvPlaneException), e -> StatusEnum.SCALING_CONNECTOR_ERROR
                        .toException("patch " + deployment + "/" + role + " to " + replicas + " failed", e));
    }

    @Override
    public Mono<DeploymentStatus> getStatus(String deployment) {
        return webClient.get()
                .uri("/deployments/{name}/status", deployment)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .map(HttpOrchestrationClient::parseStatus)
                .onErrorMap(e -> !(e instanceof KvPlaneException), e -> StatusEnum.SCALING_CONNECTOR_ERROR
                        .toException("status of " + deployment + " unavailable", e));
    }

    /**
     * Anything other than {@code READY} counts as pending
     */
    static DeploymentStatus parseStatus(String body) {
        JsonNode root = JsonUtils.toTreeNode(body);
        String status = root.path("status").asText();
        return DeploymentStatus.READY.name().equalsIgnoreCase(status) ? DeploymentStatus.READY : DeploymentStatus.PENDING;
    }
}
