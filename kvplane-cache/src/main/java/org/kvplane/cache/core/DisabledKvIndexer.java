package org.kvplane.cache.core;

import org.kvplane.dao.cache.KvCacheEvent;
import org.kvplane.dao.worker.WorkerMembership;
import org.kvplane.dao.worker.WorkerRef;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Indexer that never reports overlap, routing falls back to load only
 */
public class DisabledKvIndexer implements KvIndexer {

    private final WorkerMembership membership;

    public DisabledKvIndexer(WorkerMembership membership) {
        this.membership = membership;
    }

    @Override
    public Map<WorkerRef, Integer> lookupOverlap(List<Long> blockHashes) {
        Map<WorkerRef, Integer> zeros = new HashMap<>();
        membership.snapshot().forEach(worker -> zeros.put(worker, 0));
        return zeros;
    }

    @Override
    public boolean applyEvent(KvCacheEvent event) {
        return false;
    }

    @Override
    public void evictWorker(WorkerRef worker) {
        // nothing indexed
    }

    @Override
    public List<KvCacheEvent> dumpEvents() {
        return Collections.emptyList();
    }

    @Override
    public void clear() {
        // nothing indexed
    }

    @Override
    public long mappingCount() {
        return 0;
    }
}
