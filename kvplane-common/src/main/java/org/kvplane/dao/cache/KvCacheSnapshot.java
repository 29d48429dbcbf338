package org.kvplane.dao.cache;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.kvplane.dao.worker.WorkerRef;

import java.util.HashSet;
import java.util.Set;

/**
 * Every block a worker holds at one point in time
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class KvCacheSnapshot {

    private long workerId;

    private int dpRank;

    private Set<Long> blockHashes = new HashSet<>();

    public WorkerRef workerRef() {
        return WorkerRef.of(workerId, dpRank);
    }
}
