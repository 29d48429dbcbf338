package org.kvplane.planner.connector;

import org.kvplane.planner.domain.DeploymentStatus;
import reactor.core.publisher.Mono;

/**
 * Deployment API of the orchestration layer
 */
public interface OrchestrationClient {

    Mono<Void> patchReplicas(String deployment, String role, int replicas);

    Mono<DeploymentStatus> getStatus(String deployment);
}
