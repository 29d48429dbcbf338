package org.kvplane.registry;

import org.kvplane.cache.core.KvIndexer;
import org.kvplane.dao.worker.RuntimeConfig;
import org.kvplane.dao.worker.WorkerRef;

/**
 * Drops a worker's index entries as part of its removal from the registry
 */
public class IndexerEvictionListener implements WorkerRegistryListener {

    private final KvIndexer indexer;

    public IndexerEvictionListener(KvIndexer indexer) {
        this.indexer = indexer;
    }

    @Override
    public void onWorkerAdded(WorkerRef worker, RuntimeConfig runtimeConfig) {
        // a new worker starts with an empty cache
    }

    @Override
    public void onWorkerRemoved(WorkerRef worker) {
        indexer.evictWorker(worker);
    }
}
