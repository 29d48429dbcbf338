package org.kvplane.dao.worker;

import java.util.Set;

/**
 * Read view over the live worker set
 */
public interface WorkerMembership {

    /**
     * @return immutable copy of the live workers
     */
    Set<WorkerRef> snapshot();

    boolean contains(WorkerRef workerRef);
}
