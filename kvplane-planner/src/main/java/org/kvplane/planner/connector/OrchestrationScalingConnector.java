package org.kvplane.planner.connector;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.config.PlannerConfig;
import org.kvplane.dao.route.RoleType;
import org.kvplane.enums.StatusEnum;
import org.kvplane.exception.KvPlaneException;
import org.kvplane.planner.domain.DeploymentStatus;
import org.kvplane.planner.domain.ReplicaTarget;
import org.kvplane.planner.monitor.PlannerReporter;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives replica counts through the orchestration API, retrying rejected patches with exponential backoff
 */
@Slf4j
public class OrchestrationScalingConnector implements ScalingConnector {

    private final OrchestrationClient client;

    private final PlannerConfig config;

    private final PlannerReporter reporter;

    private final Map<RoleType, Integer> requested = new ConcurrentHashMap<>();

    private final AtomicInteger inFlight = new AtomicInteger();

    public OrchestrationScalingConnector(OrchestrationClient client, PlannerConfig config, PlannerReporter reporter) {
        this.client = client;
        this.config = config;
        this.reporter = reporter;
    }

    @Override
    public void setReplicas(ReplicaTarget target) {
        Integer previous = requested.put(target.getRole(), target.getCount());
        if (Objects.equals(previous, target.getCount())) {
            log.debug("{} already at {} replicas", target.getRole(), target.getCount());
            return;
        }
        log.info("scaling {} from {} to {} replicas", target.getRole(), previous, target.getCount());
        apply(target).subscribe();
    }

    /**
     * Patch with bounded retries. Completes empty on exhaustion after forgetting the target, so the next interval
     * asserts it again.
     */
    Mono<Void> apply(ReplicaTarget target) {
        String role = roleName(target.getRole());
        return Mono.defer(() -> client.patchReplicas(config.getDeploymentName(), role, target.getCount()))
                .retryWhen(Retry.backoff(config.getConnectorMaxRetries(),
                                Duration.ofMillis(config.getConnectorBackoffMs()))
                        .doBeforeRetry(signal -> log.warn("retry #{} patching {} to {} replicas: {}",
                                signal.totalRetries() + 1, role, target.getCount(),
                                signal.failure().getMessage())))
                .onErrorResume(e -> {
                    KvPlaneException failure = StatusEnum.SCALING_CONNECTOR_ERROR.toException(
                            "gave up scaling " + role + " to " + target.getCount(), e);
                    log.error("scaling connector failure", failure);
                    reporter.reportConnectorFailure(target.getRole());
                    requested.remove(target.getRole(), target.getCount());
                    return Mono.empty();
                })
                .doOnSubscribe(subscription -> inFlight.incrementAndGet())
                .doFinally(signal -> inFlight.decrementAndGet());
    }

    @Override
    public boolean isConverged() {
        if (inFlight.get() > 0) {
            return false;
        }
        DeploymentStatus status = client.getStatus(config.getDeploymentName())
                .onErrorResume(e -> {
                    log.warn("cannot read deployment status: {}", e.getMessage());
                    return Mono.just(DeploymentStatus.PENDING);
                })
                .block();
        return status == DeploymentStatus.READY;
    }

    private String roleName(RoleType role) {
        return role == RoleType.PREFILL ? config.getPrefillRoleName() : config.getDecodeRoleName();
    }
}
