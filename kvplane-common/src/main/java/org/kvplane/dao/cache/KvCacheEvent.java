package org.kvplane.dao.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.kvplane.dao.worker.WorkerRef;

/**
 * A KV block stored on, or removed from, a worker
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KvCacheEvent {

    private long blockHash;

    private long workerId;

    private int dpRank;

    private KvCacheAction action;

    /**
     * Epoch millis at which the worker emitted the event
     */
    private long timestamp;

    public WorkerRef workerRef() {
        return WorkerRef.of(workerId, dpRank);
    }

    public static KvCacheEvent stored(WorkerRef worker, long blockHash) {
        return of(worker, blockHash, KvCacheAction.STORED);
    }

    public static KvCacheEvent removed(WorkerRef worker, long blockHash) {
        return of(worker, blockHash, KvCacheAction.REMOVED);
    }

    private static KvCacheEvent of(WorkerRef worker, long blockHash, KvCacheAction action) {
        return KvCacheEvent.builder()
                .blockHash(blockHash)
                .workerId(worker.getWorkerId())
                .dpRank(worker.getDpRank())
                .action(action)
                .timestamp(System.currentTimeMillis())
                .build();
    }
}
