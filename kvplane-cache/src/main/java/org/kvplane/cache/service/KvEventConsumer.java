package org.kvplane.cache.service;

import org.kvplane.dao.cache.KvCacheEvent;
import org.kvplane.dao.worker.WorkerRef;

import java.util.List;
import java.util.Set;

/**
 * Entry point of the KV-cache event channel. Delivery is at-least-once.
 */
public interface KvEventConsumer {

    /**
     * @return false when the event was dropped
     */
    boolean onEvent(KvCacheEvent event);

    /**
     * @return number of applied events
     */
    int onEvents(List<KvCacheEvent> events);

    /**
     * Full listing of the blocks a worker currently holds
     */
    void onSnapshot(WorkerRef worker, Set<Long> blockHashes);
}
