package org.kvplane.discovery;

import org.kvplane.dao.worker.WorkerInfo;

import java.util.List;

/**
 * ServiceDiscovery - source of the live worker set
 */
public interface ServiceDiscovery {

    /**
     * Fetch the current worker list synchronously
     *
     * @return worker list
     */
    List<WorkerInfo> getWorkers();

    /**
     * Watch for worker changes
     *
     * @param listener change listener
     */
    void listen(WorkerChangeListener listener);

    /**
     * Stop all watches
     */
    void shutdown();
}
