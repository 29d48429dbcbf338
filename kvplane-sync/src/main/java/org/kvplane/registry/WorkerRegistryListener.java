package org.kvplane.registry;

import org.kvplane.dao.worker.RuntimeConfig;
import org.kvplane.dao.worker.WorkerRef;

/**
 * Receives worker membership changes. Callbacks run on the thread that changed the registry, after the change is
 * visible through {@link WorkerRegistry#contains}.
 */
public interface WorkerRegistryListener {

    /**
     * A worker joined, or re-registered with a changed runtime config
     */
    void onWorkerAdded(WorkerRef worker, RuntimeConfig runtimeConfig);

    void onWorkerRemoved(WorkerRef worker);
}
