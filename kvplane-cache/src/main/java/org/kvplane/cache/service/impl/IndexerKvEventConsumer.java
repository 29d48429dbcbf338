package org.kvplane.cache.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.cache.core.KvIndexer;
import org.kvplane.cache.monitor.CacheMetricsReporter;
import org.kvplane.cache.service.KvEventConsumer;
import org.kvplane.dao.cache.KvCacheEvent;
import org.kvplane.dao.worker.WorkerRef;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Feeds the event channel into the indexer
 */
@Slf4j
@Component
public class IndexerKvEventConsumer implements KvEventConsumer {

    private final KvIndexer indexer;

    private final CacheMetricsReporter reporter;

    public IndexerKvEventConsumer(KvIndexer indexer, CacheMetricsReporter reporter) {
        this.indexer = indexer;
        this.reporter = reporter;
    }

    @Override
    public boolean onEvent(KvCacheEvent event) {
        return indexer.applyEvent(event);
    }

    @Override
    public int onEvents(List<KvCacheEvent> events) {
        if (events == null) {
            return 0;
        }
        int applied = 0;
        for (KvCacheEvent event : events) {
            if (indexer.applyEvent(event)) {
                applied++;
            }
        }
        reporter.reportIndexSize(indexer.mappingCount());
        return applied;
    }

    @Override
    public void onSnapshot(WorkerRef worker, Set<Long> blockHashes) {
        indexer.applySnapshot(worker, blockHashes);
        reporter.reportIndexSize(indexer.mappingCount());
    }
}
