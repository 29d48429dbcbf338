package org.kvplane.cache.core;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.kvplane.cache.monitor.CacheMetricsReporter;
import org.kvplane.dao.cache.KvCacheAction;
import org.kvplane.dao.cache.KvCacheEvent;
import org.kvplane.dao.worker.WorkerMembership;
import org.kvplane.dao.worker.WorkerRef;
import org.kvplane.util.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Indexer for engines that publish no eviction events.
 * <p>
 * A worker is assumed to hold a block for {@code ttl} after it was last routed a request containing it. Each worker
 * has its own Caffeine cache with write expiry, so every routing refreshes the TTL. Expiry is checked on read, an
 * expired block is never reported as cached.
 */
@Slf4j
public class ApproxKvIndexer implements KvIndexer {

    private final ConcurrentHashMap<WorkerRef, Cache<Long, Boolean>> workerCaches = new ConcurrentHashMap<>();

    private final ReentrantLock lock = new ReentrantLock();

    private final WorkerMembership membership;

    private final CacheMetricsReporter reporter;

    private final Duration ttl;

    private final Ticker ticker;

    public ApproxKvIndexer(WorkerMembership membership, CacheMetricsReporter reporter, Duration ttl) {
        this(membership, reporter, ttl, Ticker.systemTicker());
    }

    public ApproxKvIndexer(WorkerMembership membership, CacheMetricsReporter reporter, Duration ttl, Ticker ticker) {
        this.membership = membership;
        this.reporter = reporter;
        this.ttl = ttl;
        this.ticker = ticker;
    }

    @Override
    public Map<WorkerRef, Integer> lookupOverlap(List<Long> blockHashes) {
        Set<WorkerRef> workers = membership.snapshot();
        Map<WorkerRef, Integer> result = new HashMap<>(workers.size() * 2);
        for (WorkerRef worker : workers) {
            Cache<Long, Boolean> cache = workerCaches.get(worker);
            int matched = 0;
            if (cache != null && blockHashes != null) {
                while (matched < blockHashes.size() && cache.getIfPresent(blockHashes.get(matched)) != null) {
                    matched++;
                }
            }
            result.put(worker, matched);
        }
        return result;
    }

    @Override
    public void applyRoutingDecision(WorkerRef worker, List<Long> blockHashes) {
        if (worker == null || blockHashes == null || blockHashes.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            if (!membership.contains(worker)) {
                return;
            }
            Cache<Long, Boolean> cache = cacheOf(worker);
            for (Long block : blockHashes) {
                cache.put(block, Boolean.TRUE);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean applyEvent(KvCacheEvent event) {
        if (event == null || event.getAction() == null) {
            return false;
        }
        WorkerRef worker = event.workerRef();
        lock.lock();
        try {
            if (!membership.contains(worker)) {
                reporter.reportEventDropped();
                return false;
            }
            if (event.getAction() == KvCacheAction.STORED) {
                cacheOf(worker).put(event.getBlockHash(), Boolean.TRUE);
            } else {
                Cache<Long, Boolean> cache = workerCaches.get(worker);
                if (cache != null) {
                    cache.invalidate(event.getBlockHash());
                }
            }
        } finally {
            lock.unlock();
        }
        reporter.reportEventApplied(event.getAction());
        return true;
    }

    @Override
    public void evictWorker(WorkerRef worker) {
        if (worker == null) {
            return;
        }
        lock.lock();
        try {
            Cache<Long, Boolean> removed = workerCaches.remove(worker);
            if (removed != null) {
                removed.invalidateAll();
            }
        } finally {
            lock.unlock();
        }
        log.info("Evicted worker {} from approximate indexer", worker);
        reporter.reportWorkerEvicted();
    }

    @Override
    public List<KvCacheEvent> dumpEvents() {
        List<KvCacheEvent> events = new ArrayList<>();
        workerCaches.forEach((worker, cache) -> {
            cache.cleanUp();
            for (Long block : cache.asMap().keySet()) {
                events.add(KvCacheEvent.stored(worker, block));
            }
        });
        return events;
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            workerCaches.values().forEach(Cache::invalidateAll);
            workerCaches.clear();
        } finally {
            lock.unlock();
        }
        log.info("Cleared approximate indexer");
    }

    @Override
    public long mappingCount() {
        long count = 0;
        for (Cache<Long, Boolean> cache : workerCaches.values()) {
            count += cache.estimatedSize();
        }
        return count;
    }

    private Cache<Long, Boolean> cacheOf(WorkerRef worker) {
        return workerCaches.computeIfAbsent(worker, this::newWorkerCache);
    }

    private Cache<Long, Boolean> newWorkerCache(WorkerRef worker) {
        return Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .<Long, Boolean>removalListener((block, value, cause) -> {
                    if (cause == RemovalCause.EXPIRED) {
                        Logger.debug("Block {} on worker {} expired after {}s", block, worker, ttl.getSeconds());
                    }
                })
                .build();
    }
}
