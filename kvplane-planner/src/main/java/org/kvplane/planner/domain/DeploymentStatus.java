package org.kvplane.planner.domain;

/**
 * Rollout state reported by the orchestration layer
 */
public enum DeploymentStatus {
    READY,
    PENDING
}
