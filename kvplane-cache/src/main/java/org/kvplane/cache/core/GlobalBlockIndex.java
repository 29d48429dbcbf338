package org.kvplane.cache.core;

import com.google.common.collect.Sets;
import lombok.extern.slf4j.Slf4j;
import org.kvplane.dao.worker.WorkerRef;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Global block index: block hash -> workers holding the block.
 * <p>
 * Reads are lock-free. Writers must be serialized by the owning indexer.
 */
@Slf4j
class GlobalBlockIndex {

    private final ConcurrentHashMap<Long, Set<WorkerRef>> blockToWorkers = new ConcurrentHashMap<>();

    private final LongAdder totalBlocks = new LongAdder();
    private final LongAdder totalMappings = new LongAdder();

    void addBlock(long blockHash, WorkerRef worker) {
        Set<WorkerRef> workers = blockToWorkers.computeIfAbsent(blockHash, k -> {
            totalBlocks.increment();
            return Sets.newConcurrentHashSet();
        });
        if (workers.add(worker)) {
            totalMappings.increment();
        }
    }

    void removeBlock(long blockHash, WorkerRef worker) {
        Set<WorkerRef> workers = blockToWorkers.get(blockHash);
        if (workers == null) {
            return;
        }
        if (workers.remove(worker)) {
            totalMappings.decrement();
            // drop the entry once no worker holds the block
            if (workers.isEmpty()) {
                blockToWorkers.remove(blockHash);
                totalBlocks.decrement();
            }
        }
    }

    /**
     * Prefix match of every worker against the ordered block hashes. Candidates are narrowed block by block and a
     * worker's length is fixed at the first block it does not hold.
     *
     * @param workers     workers to report on, all of them appear in the result
     * @param blockHashes ordered block hashes
     * @return worker -> matched prefix length in blocks
     */
    Map<WorkerRef, Integer> prefixMatch(Collection<WorkerRef> workers, List<Long> blockHashes) {
        if (workers == null || workers.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<WorkerRef, Integer> result = new HashMap<>(workers.size() * 2);
        Set<WorkerRef> candidates = new HashSet<>(workers);

        for (int i = 0; i < blockHashes.size() && !candidates.isEmpty(); i++) {
            Set<WorkerRef> owners = blockToWorkers.getOrDefault(blockHashes.get(i), Collections.emptySet());
            int matched = i;
            candidates.removeIf(candidate -> {
                if (!owners.contains(candidate)) {
                    result.put(candidate, matched);
                    return true;
                }
                return false;
            });
        }

        // the rest matched every block
        for (WorkerRef remaining : candidates) {
            result.put(remaining, blockHashes.size());
        }
        return result;
    }

    void clear() {
        blockToWorkers.clear();
        totalBlocks.reset();
        totalMappings.reset();
        log.info("Cleared global block index");
    }

    long totalBlocks() {
        return totalBlocks.sum();
    }

    long totalMappings() {
        return totalMappings.sum();
    }
}
