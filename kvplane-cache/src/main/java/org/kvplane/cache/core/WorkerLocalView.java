package org.kvplane.cache.core;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.cache.domain.DiffResult;
import org.kvplane.dao.worker.WorkerRef;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-worker view: worker -> block hashes it holds. Mirrors {@link GlobalBlockIndex} so that a worker can be evicted
 * without scanning every block.
 */
@Slf4j
class WorkerLocalView {

    private final ConcurrentHashMap<WorkerRef, Set<Long>> workerViews = new ConcurrentHashMap<>();

    /**
     * @return true if the block was not recorded yet
     */
    boolean addBlock(WorkerRef worker, long blockHash) {
        return workerViews.computeIfAbsent(worker, k -> ConcurrentHashMap.newKeySet()).add(blockHash);
    }

    /**
     * @return true if the block was recorded
     */
    boolean removeBlock(WorkerRef worker, long blockHash) {
        Set<Long> blocks = workerViews.get(worker);
        if (blocks == null || !blocks.remove(blockHash)) {
            return false;
        }
        if (blocks.isEmpty()) {
            workerViews.remove(worker);
        }
        return true;
    }

    /**
     * @return the blocks the worker held, empty when unknown
     */
    Set<Long> removeWorker(WorkerRef worker) {
        Set<Long> removed = workerViews.remove(worker);
        return removed == null ? Collections.emptySet() : removed;
    }

    DiffResult calculateDiff(WorkerRef worker, Set<Long> newBlocks) {
        if (worker == null || newBlocks == null) {
            return DiffResult.empty(worker);
        }
        Set<Long> oldBlocks = blocksOf(worker);

        Set<Long> added = new HashSet<>();
        for (Long block : newBlocks) {
            if (!oldBlocks.contains(block)) {
                added.add(block);
            }
        }
        Set<Long> removed = new HashSet<>();
        for (Long block : oldBlocks) {
            if (!newBlocks.contains(block)) {
                removed.add(block);
            }
        }
        return DiffResult.builder()
                .worker(worker)
                .addedBlocks(added)
                .removedBlocks(removed)
                .build();
    }

    Set<Long> blocksOf(WorkerRef worker) {
        Set<Long> blocks = workerViews.get(worker);
        return blocks == null ? Collections.emptySet() : blocks;
    }

    Map<WorkerRef, Set<Long>> views() {
        return Collections.unmodifiableMap(workerViews);
    }

    void clear() {
        workerViews.clear();
        log.info("Cleared worker local view");
    }
}
