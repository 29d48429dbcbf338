package org.kvplane.planner.connector;

import org.kvplane.planner.domain.ReplicaTarget;

/**
 * Applies replica targets to whatever runs the workers
 */
public interface ScalingConnector {

    /**
     * Request a replica count. Returns without waiting for the change. Re-asserting an accepted, unchanged target
     * does nothing.
     */
    void setReplicas(ReplicaTarget target);

    /**
     * @return false while a previous change is still being applied
     */
    boolean isConverged();
}
