package org.kvplane.balance.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.kvplane.config.RouterConfig;
import org.kvplane.dao.routing.PotentialLoad;
import org.kvplane.dao.routing.RouterConfigOverride;
import org.kvplane.dao.routing.RoutingDecision;
import org.kvplane.dao.worker.RuntimeConfig;
import org.kvplane.dao.worker.WorkerMembership;
import org.kvplane.dao.worker.WorkerRef;
import org.kvplane.exception.DuplicateRequestException;
import org.kvplane.exception.NoEligibleWorkerException;
import org.kvplane.exception.SchedulerUnavailableException;
import org.kvplane.metric.NoOpKvMonitor;
import org.kvplane.registry.WorkerRegistry;
import org.kvplane.service.monitor.RoutingReporter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KvSchedulerTest {

    private static final WorkerRef W1 = WorkerRef.of(1);
    private static final WorkerRef W2 = WorkerRef.of(2);
    private static final WorkerRef W3 = WorkerRef.of(3);
    private static final WorkerRef W4 = WorkerRef.of(4);

    private final RoutingReporter reporter = new RoutingReporter(NoOpKvMonitor.getInstance());

    private RouterConfig config;

    private WorkerRegistry registry;

    private KvScheduler scheduler;

    @BeforeEach
    void setUp() {
        config = new RouterConfig();
        registry = new WorkerRegistry();
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    private void start(WorkerMembership membership) {
        scheduler = new KvScheduler(config, membership, reporter);
        scheduler.start();
        registry.subscribe(scheduler);
    }

    private void startWithWorkers(WorkerRef... workers) {
        for (WorkerRef worker : workers) {
            registry.register(worker, RuntimeConfig.defaults());
        }
        start(registry);
    }

    private static <T> T await(SchedulerCommand<T> command) throws Exception {
        return command.getFuture().get(5, TimeUnit.SECONDS);
    }

    private SchedulingRequest request(String requestId, long inputLength, Map<WorkerRef, Integer> overlaps) {
        int blocks = (int) (inputLength / config.getBlockSize());
        List<Long> hashes = new ArrayList<>();
        for (long i = 0; i < blocks; i++) {
            hashes.add(i);
        }
        return SchedulingRequest.builder()
                .requestId(requestId)
                .blockHashes(hashes)
                .inputLength(inputLength)
                .overlaps(overlaps)
                .candidates(registry.snapshot())
                .updateStates(requestId != null)
                .build();
    }

    private RoutingDecision schedule(String requestId, long inputLength) throws Exception {
        return await(scheduler.schedule(request(requestId, inputLength, Collections.emptyMap())));
    }

    @Test
    @DisplayName("with zero overlap and T=0 the least loaded worker wins, ties broken by worker id")
    void should_pick_lowest_load_then_lowest_id_at_zero_temperature() throws Exception {
        startWithWorkers(W3, W1, W2);

        assertEquals(W1, schedule("a", 64).getWorker());
        assertEquals(W2, schedule("b", 64).getWorker());
        assertEquals(W3, schedule("c", 64).getWorker());
        assertEquals(W1, schedule("d", 64).getWorker());

        assertTrue(await(scheduler.free("b")));
        assertEquals(W2, schedule(null, 64).getWorker());
    }

    @Test
    void should_prefer_cached_prefix_unless_overridden() throws Exception {
        startWithWorkers(W1, W2);

        RoutingDecision cached = await(scheduler.schedule(request("r1", 64, Map.of(W1, 4))));
        assertEquals(W1, cached.getWorker());
        assertEquals(4, cached.getOverlapBlocks());

        SchedulingRequest loadOnly = request("r2", 64, Map.of(W1, 4));
        loadOnly.setOverride(new RouterConfigOverride(0.0, null));
        assertEquals(W2, await(scheduler.schedule(loadOnly)).getWorker());
    }

    @Test
    @DisplayName("equal block cost is broken by KV utilization, so larger workers absorb more")
    void should_break_ties_by_kv_utilization_when_costs_are_equal() throws Exception {
        registry.register(W1, RuntimeConfig.builder().totalKvBlocks(100).build());
        registry.register(W2, RuntimeConfig.builder().totalKvBlocks(1000).build());
        start(registry);

        assertEquals(W1, schedule("r1", 32).getWorker());
        assertEquals(W2, schedule("r2", 32).getWorker());
        // equal absolute load, W2 has ten times the capacity
        assertEquals(W2, schedule("r3", 32).getWorker());
    }

    @Test
    @DisplayName("100 concurrent uncached requests spread evenly over 4 identical workers")
    void should_spread_concurrent_requests_evenly_when_nothing_is_cached() throws Exception {
        startWithWorkers(W1, W2, W3, W4);
        ExecutorService pool = Executors.newFixedThreadPool(16);
        try {
            List<Future<RoutingDecision>> futures = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                String requestId = "req-" + i;
                futures.add(pool.submit(() -> schedule(requestId, 48)));
            }
            Map<WorkerRef, Integer> counts = new HashMap<>();
            for (Future<RoutingDecision> future : futures) {
                counts.merge(future.get(10, TimeUnit.SECONDS).getWorker(), 1, Integer::sum);
            }
            assertEquals(Map.of(W1, 25, W2, 25, W3, 25, W4, 25), counts);
            assertEquals(100, scheduler.getLoadTracker().reservationCount());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void should_move_to_next_worker_when_cached_worker_cost_reaches_cold_cost() throws Exception {
        startWithWorkers(W1, W2, W3, W4);

        // 16 cached blocks: W1 costs 16 decode blocks, a cold worker 16 prefill plus 16 decode
        assertEquals(W1, await(scheduler.schedule(request("r1", 256, Map.of(W1, 16)))).getWorker());
        assertEquals(W2, await(scheduler.schedule(request("r2", 256, Map.of(W1, 16)))).getWorker());
        assertEquals(W3, await(scheduler.schedule(request("r3", 256, Map.of(W1, 16)))).getWorker());
        assertEquals(W4, await(scheduler.schedule(request("r4", 256, Map.of(W1, 16)))).getWorker());
        assertEquals(W1, await(scheduler.schedule(request("r5", 256, Map.of(W1, 16)))).getWorker());
    }

    @Test
    @DisplayName("100 concurrent requests fully cached on one worker still spread over all 4 workers")
    void should_spread_concurrent_requests_when_prefix_is_cached_on_one_worker() throws Exception {
        startWithWorkers(W1, W2, W3, W4);
        ExecutorService pool = Executors.newFixedThreadPool(16);
        try {
            List<Future<RoutingDecision>> futures = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                String requestId = "req-" + i;
                futures.add(pool.submit(() -> await(scheduler.schedule(request(requestId, 256, Map.of(W1, 16))))));
            }
            Map<WorkerRef, Integer> counts = new HashMap<>();
            for (Future<RoutingDecision> future : futures) {
                counts.merge(future.get(10, TimeUnit.SECONDS).getWorker(), 1, Integer::sum);
            }
            assertEquals(4, counts.size());
            int cached = counts.get(W1);
            assertTrue(cached < 100);
            for (WorkerRef cold : Arrays.asList(W2, W3, W4)) {
                assertTrue(counts.get(cold) > 0);
                assertTrue(cached > counts.get(cold));
            }
            assertEquals(100, scheduler.getLoadTracker().reservationCount());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void should_fail_when_no_candidate_is_live() throws Exception {
        startWithWorkers(W1);
        SchedulingRequest request = request("r1", 32, Collections.emptyMap());
        request.setCandidates(Set.of(WorkerRef.of(9)));

        ExecutionException e = assertThrows(ExecutionException.class, () -> await(scheduler.schedule(request)));
        assertInstanceOf(NoEligibleWorkerException.class, e.getCause());
    }

    @Test
    void should_reject_duplicate_request_id() throws Exception {
        startWithWorkers(W1, W2);
        schedule("dup", 32);

        ExecutionException e = assertThrows(ExecutionException.class, () -> schedule("dup", 32));
        assertInstanceOf(DuplicateRequestException.class, e.getCause());
        assertEquals(1, scheduler.getLoadTracker().reservationCount());
    }

    @Test
    void should_release_prefill_tokens_then_decode_blocks() throws Exception {
        startWithWorkers(W1);

        RoutingDecision decision = await(scheduler.schedule(request("r1", 100, Map.of(W1, 2))));
        assertTrue(decision.isReserved());
        ActiveLoadTracker tracker = scheduler.getLoadTracker();
        // ceil(100 / 16) decode blocks, 100 - 2 * 16 prefill tokens
        assertEquals(7, tracker.loadOf(W1).getDecodeBlocks());
        assertEquals(68, tracker.loadOf(W1).getPrefillTokens());

        assertTrue(await(scheduler.markPrefillComplete("r1")));
        assertFalse(await(scheduler.markPrefillComplete("r1")));
        assertEquals(7, tracker.loadOf(W1).getDecodeBlocks());
        assertEquals(0, tracker.loadOf(W1).getPrefillTokens());

        assertTrue(await(scheduler.free("r1")));
        assertFalse(await(scheduler.free("r1")));
        assertEquals(0, tracker.loadOf(W1).getDecodeBlocks());
        assertEquals(0, tracker.reservationCount());
    }

    @Test
    void should_not_reserve_when_tracking_is_disabled() throws Exception {
        config.setTrackActiveBlocks(false);
        startWithWorkers(W1, W2);

        RoutingDecision first = schedule("r1", 64);
        RoutingDecision second = schedule("r2", 64);

        assertFalse(first.isReserved());
        assertEquals(W1, first.getWorker());
        assertEquals(W1, second.getWorker());
        assertEquals(0, scheduler.getLoadTracker().reservationCount());
    }

    @Test
    void should_report_potential_loads_without_reserving() throws Exception {
        startWithWorkers(W1, W2);
        schedule("r1", 32);

        List<PotentialLoad> loads = await(scheduler.potentialLoads(request(null, 32, Map.of(W2, 1))));

        assertEquals(Arrays.asList(new PotentialLoad(W1, 4, 64), new PotentialLoad(W2, 2, 16)), loads);
        assertEquals(1, scheduler.getLoadTracker().reservationCount());
    }

    @Test
    void should_drop_reservations_of_removed_worker() throws Exception {
        startWithWorkers(W1, W2);
        schedule("r1", 32);
        schedule("r2", 32);

        registry.deregister(W1);
        // control commands run before the next request command
        await(scheduler.free("unknown"));

        assertEquals(1, scheduler.getLoadTracker().reservationCount());
        assertEquals(0, scheduler.getLoadTracker().loadOf(W1).getDecodeBlocks());
    }

    @Test
    void should_clear_load_on_reset() throws Exception {
        startWithWorkers(W1);
        schedule("r1", 32);

        scheduler.reset().get(5, TimeUnit.SECONDS);

        assertEquals(0, scheduler.getLoadTracker().reservationCount());
        assertEquals(0, scheduler.getLoadTracker().totalDecodeBlocks());
    }

    @Test
    @DisplayName("abandoned commands are skipped before running and rolled back after reserving")
    void should_roll_back_or_skip_abandoned_commands() throws Exception {
        registry.register(W1, RuntimeConfig.defaults());
        GatedMembership gate = new GatedMembership(registry);
        start(gate);

        SchedulerCommand<RoutingDecision> running = scheduler.schedule(request("r1", 32, Collections.emptyMap()));
        assertTrue(gate.entered.await(5, TimeUnit.SECONDS));
        SchedulerCommand<RoutingDecision> queued = scheduler.schedule(request("r2", 32, Collections.emptyMap()));

        running.abandon();
        queued.abandon();
        gate.release.countDown();
        await(scheduler.free("barrier"));

        assertTrue(running.getFuture().isCancelled());
        assertTrue(queued.getFuture().isCancelled());
        assertEquals(0, scheduler.getLoadTracker().reservationCount());
        assertEquals(0, scheduler.getLoadTracker().totalDecodeBlocks());
    }

    @Test
    void should_fail_fast_when_queue_is_full() throws Exception {
        config.setSchedulerQueueSize(1);
        registry.register(W1, RuntimeConfig.defaults());
        GatedMembership gate = new GatedMembership(registry);
        start(gate);

        SchedulerCommand<RoutingDecision> first = scheduler.schedule(request("r1", 32, Collections.emptyMap()));
        assertTrue(gate.entered.await(5, TimeUnit.SECONDS));
        SchedulerCommand<RoutingDecision> second = scheduler.schedule(request("r2", 32, Collections.emptyMap()));

        assertThrows(SchedulerUnavailableException.class,
                () -> scheduler.schedule(request("r3", 32, Collections.emptyMap())));

        gate.release.countDown();
        assertEquals(W1, await(first).getWorker());
        assertEquals(W1, await(second).getWorker());
    }

    @Test
    void should_fail_queued_and_new_commands_on_shutdown() throws Exception {
        registry.register(W1, RuntimeConfig.defaults());
        GatedMembership gate = new GatedMembership(registry);
        start(gate);

        scheduler.schedule(request("r1", 32, Collections.emptyMap()));
        assertTrue(gate.entered.await(5, TimeUnit.SECONDS));
        SchedulerCommand<RoutingDecision> queued = scheduler.schedule(request("r2", 32, Collections.emptyMap()));

        gate.release.countDown();
        scheduler.shutdown();

        assertFalse(scheduler.isRunning());
        assertThrows(SchedulerUnavailableException.class, () -> scheduler.free("r1"));
        if (queued.getFuture().isCompletedExceptionally()) {
            ExecutionException e = assertThrows(ExecutionException.class, () -> await(queued));
            assertInstanceOf(SchedulerUnavailableException.class, e.getCause());
        }
    }

    @Test
    void should_fail_control_commands_when_scheduler_is_stopped() throws Exception {
        startWithWorkers(W1);
        scheduler.shutdown();

        ExecutionException reset = assertThrows(ExecutionException.class,
                () -> scheduler.reset().get(5, TimeUnit.SECONDS));
        assertInstanceOf(SchedulerUnavailableException.class, reset.getCause());
        ExecutionException removed = assertThrows(ExecutionException.class,
                () -> scheduler.workerRemoved(W1).get(5, TimeUnit.SECONDS));
        assertInstanceOf(SchedulerUnavailableException.class, removed.getCause());
    }

    @Test
    void should_sample_by_softmax_when_temperature_is_positive() {
        AtomicReference<Double> draw = new AtomicReference<>(0.0);
        scheduler = new KvScheduler(config, registry, reporter, draw::get);
        List<ScoredWorker> even = Arrays.asList(new ScoredWorker(W1, 0, 0, 0.0), new ScoredWorker(W2, 0, 0, 0.0));

        assertEquals(W1, scheduler.select(even, 1.0).getWorker());
        draw.set(0.99);
        assertEquals(W2, scheduler.select(even, 1.0).getWorker());

        List<ScoredWorker> skewed = Arrays.asList(new ScoredWorker(W1, 4, 0, 1.0), new ScoredWorker(W2, 0, 0, 0.0));
        draw.set(0.5);
        assertEquals(W1, scheduler.select(skewed, 0.01).getWorker());
    }

    /**
     * Blocks the loop inside the first membership check until released
     */
    private static class GatedMembership implements WorkerMembership {

        private final WorkerMembership delegate;

        private final CountDownLatch entered = new CountDownLatch(1);

        private final CountDownLatch release = new CountDownLatch(1);

        GatedMembership(WorkerMembership delegate) {
            this.delegate = delegate;
        }

        @Override
        public Set<WorkerRef> snapshot() {
            return delegate.snapshot();
        }

        @Override
        public boolean contains(WorkerRef workerRef) {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return delegate.contains(workerRef);
        }
    }
}
