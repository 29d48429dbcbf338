package org.kvplane.cache.core;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.kvplane.cache.monitor.CacheMetricsReporter;
import org.kvplane.dao.cache.KvCacheEvent;
import org.kvplane.dao.worker.WorkerRef;
import org.kvplane.metric.NoOpKvMonitor;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApproxKvIndexerTest {

    private static final WorkerRef W1 = WorkerRef.of(1);
    private static final WorkerRef W2 = WorkerRef.of(2);
    private static final List<Long> REQUEST = Arrays.asList(1L, 2L, 3L);

    private final AtomicLong nanos = new AtomicLong();

    private final Ticker ticker = nanos::get;

    private MutableMembership membership;

    private ApproxKvIndexer indexer;

    @BeforeEach
    void setUp() {
        membership = new MutableMembership(W1, W2);
        indexer = new ApproxKvIndexer(membership, new CacheMetricsReporter(NoOpKvMonitor.getInstance()),
                Duration.ofSeconds(120), ticker);
    }

    private void advanceSeconds(long seconds) {
        nanos.addAndGet(TimeUnit.SECONDS.toNanos(seconds));
    }

    @Test
    void should_report_routed_blocks_until_ttl_elapses() {
        indexer.applyRoutingDecision(W1, REQUEST);

        assertEquals(3, indexer.lookupOverlap(REQUEST).get(W1));
        assertEquals(0, indexer.lookupOverlap(REQUEST).get(W2));

        advanceSeconds(119);
        assertEquals(3, indexer.lookupOverlap(REQUEST).get(W1));

        advanceSeconds(2);
        assertEquals(0, indexer.lookupOverlap(REQUEST).get(W1));
    }

    @Test
    void should_refresh_ttl_on_each_routing() {
        indexer.applyRoutingDecision(W1, REQUEST);
        advanceSeconds(100);

        indexer.applyRoutingDecision(W1, Arrays.asList(1L, 2L));
        advanceSeconds(30);

        // blocks 1 and 2 were refreshed, block 3 expired
        assertEquals(2, indexer.lookupOverlap(REQUEST).get(W1));
    }

    @Test
    void should_ignore_routing_to_unknown_worker() {
        WorkerRef stranger = WorkerRef.of(9);

        indexer.applyRoutingDecision(stranger, REQUEST);
        membership.add(stranger);

        assertEquals(0, indexer.lookupOverlap(REQUEST).get(stranger));
    }

    @Test
    void should_apply_explicit_events() {
        assertTrue(indexer.applyEvent(KvCacheEvent.stored(W2, 1L)));
        assertEquals(1, indexer.lookupOverlap(REQUEST).get(W2));

        assertTrue(indexer.applyEvent(KvCacheEvent.removed(W2, 1L)));
        assertEquals(0, indexer.lookupOverlap(REQUEST).get(W2));

        assertFalse(indexer.applyEvent(KvCacheEvent.stored(WorkerRef.of(5), 1L)));
    }

    @Test
    void should_evict_worker_and_dump_live_entries_only() {
        indexer.applyRoutingDecision(W1, REQUEST);
        indexer.applyRoutingDecision(W2, List.of(1L));

        assertEquals(4, indexer.dumpEvents().size());

        membership.remove(W1);
        indexer.evictWorker(W1);
        assertEquals(1, indexer.dumpEvents().size());

        advanceSeconds(121);
        assertTrue(indexer.dumpEvents().isEmpty());
    }
}
