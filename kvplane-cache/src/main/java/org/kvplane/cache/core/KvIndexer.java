package org.kvplane.cache.core;

import org.kvplane.dao.cache.KvCacheEvent;
import org.kvplane.dao.worker.WorkerRef;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps content-addressed KV blocks to the workers holding them.
 * <p>
 * Lookups never fail on unknown workers: every live worker is present in the result and a worker the registry
 * does not know never gets a non-zero overlap.
 */
public interface KvIndexer {

    /**
     * Matched prefix length in blocks for every live worker
     *
     * @param blockHashes chained block hashes of the request, in order
     * @return live worker -> number of leading blocks it holds
     */
    Map<WorkerRef, Integer> lookupOverlap(List<Long> blockHashes);

    /**
     * Apply a stored or removed event
     *
     * @return false when the event was dropped
     */
    boolean applyEvent(KvCacheEvent event);

    /**
     * Reconcile the full block listing reported by a worker
     */
    default void applySnapshot(WorkerRef worker, Set<Long> blockHashes) {
    }

    /**
     * Record that a request with these blocks was routed to the worker
     */
    default void applyRoutingDecision(WorkerRef worker, List<Long> blockHashes) {
    }

    /**
     * Drop every entry of the worker. Called synchronously on registry removal.
     */
    void evictWorker(WorkerRef worker);

    /**
     * One STORED event per indexed (block, worker) pair. Replaying the dump into an empty indexer rebuilds it.
     */
    List<KvCacheEvent> dumpEvents();

    void clear();

    /**
     * Number of indexed (block, worker) pairs
     */
    long mappingCount();
}
