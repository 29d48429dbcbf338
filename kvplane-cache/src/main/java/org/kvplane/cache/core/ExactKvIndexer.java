package org.kvplane.cache.core;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.cache.domain.DiffResult;
import org.kvplane.cache.monitor.CacheMetricsReporter;
import org.kvplane.dao.cache.KvCacheAction;
import org.kvplane.dao.cache.KvCacheEvent;
import org.kvplane.dao.worker.WorkerMembership;
import org.kvplane.dao.worker.WorkerRef;
import org.kvplane.util.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Indexer fed by explicit stored/removed events from the workers.
 * <p>
 * Keeps two views, block -> workers for prefix lookups and worker -> blocks for eviction and reconciliation.
 * All writes, including the registry membership check of an event, happen under one lock. The event stream is
 * at-least-once, so duplicate STORED and REMOVED events are no-ops.
 */
@Slf4j
public class ExactKvIndexer implements KvIndexer {

    private final GlobalBlockIndex globalIndex = new GlobalBlockIndex();

    private final WorkerLocalView localView = new WorkerLocalView();

    private final ReentrantLock lock = new ReentrantLock();

    private final WorkerMembership membership;

    private final CacheMetricsReporter reporter;

    public ExactKvIndexer(WorkerMembership membership, CacheMetricsReporter reporter) {
        this.membership = membership;
        this.reporter = reporter;
    }

    @Override
    public Map<WorkerRef, Integer> lookupOverlap(List<Long> blockHashes) {
        Set<WorkerRef> workers = membership.snapshot();
        if (blockHashes == null || blockHashes.isEmpty()) {
            Map<WorkerRef, Integer> zeros = new HashMap<>(workers.size() * 2);
            workers.forEach(worker -> zeros.put(worker, 0));
            return zeros;
        }
        return globalIndex.prefixMatch(workers, blockHashes);
    }

    @Override
    public boolean applyEvent(KvCacheEvent event) {
        if (event == null || event.getAction() == null) {
            log.warn("Invalid kv cache event: {}", event);
            return false;
        }
        WorkerRef worker = event.workerRef();
        lock.lock();
        try {
            if (!membership.contains(worker)) {
                Logger.debug("Dropping {} event of block {} for unknown worker {}",
                        event.getAction(), event.getBlockHash(), worker);
                reporter.reportEventDropped();
                return false;
            }
            if (event.getAction() == KvCacheAction.STORED) {
                if (localView.addBlock(worker, event.getBlockHash())) {
                    globalIndex.addBlock(event.getBlockHash(), worker);
                }
            } else if (localView.removeBlock(worker, event.getBlockHash())) {
                globalIndex.removeBlock(event.getBlockHash(), worker);
            }
        } finally {
            lock.unlock();
        }
        reporter.reportEventApplied(event.getAction());
        return true;
    }

    @Override
    public void applySnapshot(WorkerRef worker, Set<Long> blockHashes) {
        if (worker == null || blockHashes == null) {
            return;
        }
        DiffResult diff;
        lock.lock();
        try {
            if (!membership.contains(worker)) {
                Logger.debug("Dropping cache snapshot of unknown worker {}", worker);
                reporter.reportEventDropped();
                return;
            }
            diff = localView.calculateDiff(worker, blockHashes);
            for (Long added : diff.getAddedBlocks()) {
                localView.addBlock(worker, added);
                globalIndex.addBlock(added, worker);
            }
            for (Long removed : diff.getRemovedBlocks()) {
                localView.removeBlock(worker, removed);
                globalIndex.removeBlock(removed, worker);
            }
        } finally {
            lock.unlock();
        }
        if (diff.hasChanges()) {
            reporter.reportSnapshotDiff(worker, diff.getAddedBlocks().size(), diff.getRemovedBlocks().size());
        }
    }

    @Override
    public void evictWorker(WorkerRef worker) {
        if (worker == null) {
            return;
        }
        int evicted;
        lock.lock();
        try {
            Set<Long> blocks = localView.removeWorker(worker);
            for (Long block : blocks) {
                globalIndex.removeBlock(block, worker);
            }
            evicted = blocks.size();
        } finally {
            lock.unlock();
        }
        log.info("Evicted worker {} from exact indexer, {} blocks dropped, {} blocks still indexed",
                worker, evicted, blockCount());
        reporter.reportWorkerEvicted();
    }

    @Override
    public List<KvCacheEvent> dumpEvents() {
        List<KvCacheEvent> events = new ArrayList<>();
        lock.lock();
        try {
            localView.views().forEach((worker, blocks) -> {
                for (Long block : blocks) {
                    events.add(KvCacheEvent.stored(worker, block));
                }
            });
        } finally {
            lock.unlock();
        }
        return events;
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            globalIndex.clear();
            localView.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long mappingCount() {
        return globalIndex.totalMappings();
    }

    public long blockCount() {
        return globalIndex.totalBlocks();
    }
}
