package org.kvplane.discovery;

import org.kvplane.dao.worker.WorkerInfo;

import java.util.List;

/**
 * WorkerChangeListener - fired with the full worker list whenever discovery sees a change
 */
@FunctionalInterface
public interface WorkerChangeListener {

    /**
     * @param workers the complete current worker list
     */
    void onWorkersChanged(List<WorkerInfo> workers);
}
