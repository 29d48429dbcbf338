package org.kvplane.balance.strategy;

import org.kvplane.dao.worker.WorkerRef;

import java.util.Collection;

/**
 * Naive worker selection, used directly or as the KV router's fallback
 */
public interface LoadBalancer {

    /**
     * @param workers live workers
     * @return the chosen worker
     * @throws org.kvplane.exception.NoEligibleWorkerException when {@code workers} is empty
     */
    WorkerRef select(Collection<WorkerRef> workers);
}
