package org.kvplane.cache.core;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.cache.monitor.CacheMetricsReporter;
import org.kvplane.config.RouterConfig;
import org.kvplane.dao.worker.WorkerMembership;

import java.time.Duration;

/**
 * Picks the indexer variant once, from the configured {@link org.kvplane.enums.IndexerMode}
 */
@Slf4j
public class KvIndexerFactory {

    private KvIndexerFactory() {
    }

    public static KvIndexer create(RouterConfig config, WorkerMembership membership, CacheMetricsReporter reporter) {
        KvIndexer indexer;
        switch (config.getIndexerMode()) {
            case APPROXIMATE:
                indexer = new ApproxKvIndexer(membership, reporter, Duration.ofSeconds(config.getApproxTtlSecs()));
                break;
            case NONE:
                indexer = new DisabledKvIndexer(membership);
                break;
            case EXACT:
            default:
                indexer = new ExactKvIndexer(membership, reporter);
                break;
        }
        log.info("Created {} for indexer mode {}", indexer.getClass().getSimpleName(), config.getIndexerMode());
        return indexer;
    }
}
