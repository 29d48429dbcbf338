package org.kvplane.balance.scheduler;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.kvplane.config.RouterConfig;
import org.kvplane.dao.routing.PotentialLoad;
import org.kvplane.dao.routing.RouterConfigOverride;
import org.kvplane.dao.routing.RoutingDecision;
import org.kvplane.dao.worker.RuntimeConfig;
import org.kvplane.dao.worker.WorkerMembership;
import org.kvplane.dao.worker.WorkerRef;
import org.kvplane.enums.StatusEnum;
import org.kvplane.registry.WorkerRegistryListener;
import org.kvplane.service.monitor.RoutingReporter;
import org.kvplane.util.Logger;
import org.springframework.scheduling.annotation.Scheduled;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;
import java.util.stream.Collectors;

/**
 * Single-writer scheduling loop.
 * <p>
 * Callers enqueue commands; one daemon thread runs them in order. The loop thread is the only writer of the load
 * tracker and of the per-worker runtime config map, so decisions need no locking. Request commands go through a
 * bounded queue and fail fast when it is full. Membership and reset commands use a separate unbounded queue that
 * the loop drains before every request command, so a worker change is never rejected.
 */
@Slf4j
public class KvScheduler implements WorkerRegistryListener {

    private static final double TIE_EPSILON = 1e-9;

    private static final long POLL_TIMEOUT_MS = 10;

    private final RouterConfig config;

    private final WorkerMembership membership;

    private final RoutingReporter reporter;

    private final DoubleSupplier random;

    private final BlockingDeque<SchedulerCommand<?>> queue;

    private final Queue<SchedulerCommand<?>> controlQueue = new ConcurrentLinkedQueue<>();

    @Getter
    private final ActiveLoadTracker loadTracker = new ActiveLoadTracker();

    private final Map<WorkerRef, RuntimeConfig> runtimeConfigs = new HashMap<>();

    private volatile boolean running;

    private Thread loopThread;

    public KvScheduler(RouterConfig config, WorkerMembership membership, RoutingReporter reporter) {
        this(config, membership, reporter, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random uniform source in [0, 1) for temperature sampling
     */
    public KvScheduler(RouterConfig config, WorkerMembership membership, RoutingReporter reporter,
                       DoubleSupplier random) {
        this.config = config;
        this.membership = membership;
        this.reporter = reporter;
        this.random = random;
        this.queue = new LinkedBlockingDeque<>(config.getSchedulerQueueSize());
    }

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        loopThread = new Thread(this::loop, "kv-scheduler-loop");
        loopThread.setDaemon(true);
        loopThread.start();
        Logger.info("KvScheduler loop started, queue capacity: {}", config.getSchedulerQueueSize());
    }

    /**
     * Stop accepting work, fail queued commands with SchedulerUnavailableException and stop the loop
     */
    @PreDestroy
    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        running = false;
        if (loopThread != null) {
            loopThread.interrupt();
            try {
                loopThread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        int failed = failPending(queue) + failPending(controlQueue);
        Logger.info("KvScheduler stopped, {} queued commands failed, {} reservations dropped",
                failed, loadTracker.reservationCount());
    }

    public boolean isRunning() {
        return running;
    }

    /*------------------------------------------------ commands -----------------------------------------------------*/

    public SchedulerCommand<RoutingDecision> schedule(SchedulingRequest request) {
        SchedulerCommand<RoutingDecision> command = new SchedulerCommand<>("schedule",
                () -> doSchedule(request), this::rollback);
        return submit(command);
    }

    public SchedulerCommand<Boolean> free(String requestId) {
        return submit(new SchedulerCommand<>("free", () -> loadTracker.release(requestId)));
    }

    public SchedulerCommand<Boolean> markPrefillComplete(String requestId) {
        return submit(new SchedulerCommand<>("markPrefillComplete", () -> loadTracker.markPrefillComplete(requestId)));
    }

    public SchedulerCommand<List<PotentialLoad>> potentialLoads(SchedulingRequest request) {
        return submit(new SchedulerCommand<>("potentialLoads", () -> doPotentialLoads(request)));
    }

    public CompletableFuture<Void> workerAdded(WorkerRef worker, RuntimeConfig runtimeConfig) {
        return submitControl(new SchedulerCommand<>("workerAdded", () -> {
            runtimeConfigs.put(worker, runtimeConfig == null ? RuntimeConfig.defaults() : runtimeConfig);
            return null;
        }));
    }

    public CompletableFuture<Void> workerRemoved(WorkerRef worker) {
        return submitControl(new SchedulerCommand<>("workerRemoved", () -> {
            runtimeConfigs.remove(worker);
            loadTracker.removeWorker(worker);
            return null;
        }));
    }

    public CompletableFuture<Void> reset() {
        return submitControl(new SchedulerCommand<>("reset", () -> {
            loadTracker.clear();
            log.info("Scheduler load state reset");
            return null;
        }));
    }

    @Override
    public void onWorkerAdded(WorkerRef worker, RuntimeConfig runtimeConfig) {
        workerAdded(worker, runtimeConfig);
    }

    @Override
    public void onWorkerRemoved(WorkerRef worker) {
        workerRemoved(worker);
    }

    @Scheduled(fixedRate = 1000)
    public void reportQueueSize() {
        reporter.reportQueueSize(queue.size());
        reporter.reportLiveWorkers(membership.snapshot().size());
        reporter.reportActiveLoad(loadTracker.totalDecodeBlocks(), loadTracker.totalPrefillTokens());
    }

    /*------------------------------------------------ loop ---------------------------------------------------------*/

    private <T> SchedulerCommand<T> submit(SchedulerCommand<T> command) {
        if (!running) {
            throw StatusEnum.SCHEDULER_UNAVAILABLE.toException("scheduler is stopped");
        }
        command.markEnqueued();
        if (!queue.offerLast(command)) {
            Logger.warn("Scheduler queue is full, rejecting {}, current size: {}", command.getName(), queue.size());
            reporter.reportRejected();
            throw StatusEnum.SCHEDULER_UNAVAILABLE.toException("scheduler queue is full");
        }
        // the loop may have drained the queue and exited between the check and the offer
        if (!running && queue.remove(command)) {
            throw StatusEnum.SCHEDULER_UNAVAILABLE.toException("scheduler is stopped");
        }
        return command;
    }

    private CompletableFuture<Void> submitControl(SchedulerCommand<Void> command) {
        if (!running) {
            command.getFuture().completeExceptionally(
                    StatusEnum.SCHEDULER_UNAVAILABLE.toException("scheduler is stopped"));
            return command.getFuture();
        }
        command.markEnqueued();
        controlQueue.offer(command);
        // shutdown may have failed the pending commands between the check and the offer
        if (!running && controlQueue.remove(command)) {
            command.getFuture().completeExceptionally(
                    StatusEnum.SCHEDULER_UNAVAILABLE.toException("scheduler is stopped"));
        }
        return command.getFuture();
    }

    private void loop() {
        while (running) {
            try {
                drainControl();
                SchedulerCommand<?> command = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                drainControl();
                if (command != null) {
                    run(command);
                }
            } catch (InterruptedException e) {
                if (running) {
                    Logger.warn("Scheduler loop interrupted while running, continuing");
                } else {
                    Thread.currentThread().interrupt();
                }
            } catch (RuntimeException e) {
                Logger.error("Scheduler loop encountered error", e);
            }
        }
        Logger.info("Scheduler loop exited");
    }

    private void drainControl() {
        SchedulerCommand<?> command;
        while ((command = controlQueue.poll()) != null) {
            run(command);
        }
    }

    private <T> void run(SchedulerCommand<T> command) {
        if (command.getFuture().isDone()) {
            Logger.debug("Skipping abandoned {}", command.getName());
            reporter.reportAbandoned();
            return;
        }
        reporter.reportQueueWaitTime(System.currentTimeMillis() - command.getEnqueueTime());
        T result;
        try {
            result = command.execute();
        } catch (RuntimeException e) {
            command.getFuture().completeExceptionally(e);
            return;
        }
        if (!command.getFuture().complete(result)) {
            // the caller gave up while the command ran
            command.rollback(result);
            reporter.reportAbandoned();
        }
    }

    private int failPending(Queue<SchedulerCommand<?>> pending) {
        int failed = 0;
        SchedulerCommand<?> command;
        while ((command = pending.poll()) != null) {
            if (command.getFuture().completeExceptionally(
                    StatusEnum.SCHEDULER_UNAVAILABLE.toException("scheduler is shutting down"))) {
                failed++;
            }
        }
        return failed;
    }

    /*------------------------------------------------ decisions ----------------------------------------------------*/

    private RoutingDecision doSchedule(SchedulingRequest request) {
        boolean track = config.isTrackActiveBlocks();
        if (track && request.isMutating() && loadTracker.hasReservation(request.getRequestId())) {
            throw StatusEnum.DUPLICATE_REQUEST.toException("request id " + request.getRequestId());
        }
        List<ScoredWorker> scored = score(request);
        ScoredWorker chosen = select(scored, temperatureOf(request.getOverride()));

        boolean reserved = false;
        if (track && request.isMutating()) {
            long inputLength = request.getInputLength();
            loadTracker.reserve(request.getRequestId(), chosen.getWorker(),
                    decodeBlocksFor(inputLength), prefillTokensFor(inputLength, chosen.getOverlapBlocks()));
            reserved = true;
        }
        Logger.debug("Request {} scheduled to {}, overlap {} blocks, score {}",
                request.getRequestId(), chosen.getWorker(), chosen.getOverlapBlocks(), chosen.getScore());
        return RoutingDecision.builder()
                .worker(chosen.getWorker())
                .overlapBlocks(chosen.getOverlapBlocks())
                .requestId(request.getRequestId())
                .reserved(reserved)
                .build();
    }

    private void rollback(RoutingDecision decision) {
        if (decision != null && decision.isReserved() && loadTracker.release(decision.getRequestId())) {
            Logger.warn("Rolled back reservation of abandoned request {} on {}",
                    decision.getRequestId(), decision.getWorker());
        }
    }

    private List<PotentialLoad> doPotentialLoads(SchedulingRequest request) {
        long inputLength = request.getInputLength();
        List<PotentialLoad> result = new ArrayList<>();
        for (WorkerRef worker : eligible(request)) {
            WorkerLoad load = loadTracker.loadOf(worker);
            result.add(new PotentialLoad(worker,
                    load.getDecodeBlocks() + decodeBlocksFor(inputLength),
                    load.getPrefillTokens() + prefillTokensFor(inputLength, request.overlapOf(worker))));
        }
        return result;
    }

    /**
     * Candidates still in the registry, in worker order
     */
    private List<WorkerRef> eligible(SchedulingRequest request) {
        List<WorkerRef> workers = request.getCandidates().stream()
                .filter(membership::contains)
                .sorted()
                .collect(Collectors.toList());
        if (workers.isEmpty()) {
            throw StatusEnum.NO_ELIGIBLE_WORKER.toException(
                    "none of " + request.getCandidates().size() + " candidates is live");
        }
        return workers;
    }

    /**
     * Score is the negated block cost {@code overlapWeight * prefillBlocks + decodeBlocks}. Prefill blocks are the
     * uncached blocks of this request plus the prefill tokens in flight on the worker, decode blocks are the active
     * decode blocks plus this request's blocks.
     */
    private List<ScoredWorker> score(SchedulingRequest request) {
        long inputLength = request.getInputLength();
        int requestBlocks = request.getBlockHashes().size();
        double overlapWeight = overlapWeightOf(request.getOverride());
        boolean track = config.isTrackActiveBlocks();
        List<ScoredWorker> scored = new ArrayList<>();
        for (WorkerRef worker : eligible(request)) {
            int overlap = Math.min(request.overlapOf(worker), requestBlocks);
            WorkerLoad load = track ? loadTracker.loadOf(worker) : WorkerLoad.EMPTY;
            double prefillBlocks = (double) (prefillTokensFor(inputLength, overlap) + load.getPrefillTokens())
                    / config.getBlockSize();
            double decodeBlocks = load.getDecodeBlocks() + decodeBlocksFor(inputLength);
            double cost = overlapWeight * prefillBlocks + decodeBlocks;
            scored.add(new ScoredWorker(worker, overlap, utilization(worker, load), -cost));
        }
        return scored;
    }

    /**
     * Active blocks over KV capacity, only used to break ties
     */
    private double utilization(WorkerRef worker, WorkerLoad load) {
        double blocks = load.getDecodeBlocks() + (double) load.getPrefillTokens() / config.getBlockSize();
        RuntimeConfig runtimeConfig = runtimeConfigs.getOrDefault(worker, RuntimeConfig.defaults());
        return blocks / runtimeConfig.kvCapacityBlocks(config.getDefaultKvBlocksPerGpu());
    }

    /**
     * Arg-max at temperature 0, softmax sampling otherwise. Scores within 1e-9 of each other are ties. Before
     * sampling, scores are rescaled to [0, 1] so the temperature does not depend on request size.
     */
    ScoredWorker select(List<ScoredWorker> scored, double temperature) {
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (ScoredWorker candidate : scored) {
            max = Math.max(max, candidate.getScore());
            min = Math.min(min, candidate.getScore());
        }
        if (temperature <= 0) {
            ScoredWorker best = null;
            for (ScoredWorker candidate : scored) {
                if (max - candidate.getScore() <= TIE_EPSILON
                        && (best == null || ScoredWorker.TIE_BREAK.compare(candidate, best) < 0)) {
                    best = candidate;
                }
            }
            return best;
        }
        double range = max - min > TIE_EPSILON ? max - min : 1.0;
        double[] weights = new double[scored.size()];
        double total = 0;
        for (int i = 0; i < scored.size(); i++) {
            weights[i] = Math.exp((scored.get(i).getScore() - max) / range / temperature);
            total += weights[i];
        }
        double target = random.getAsDouble() * total;
        double cumulative = 0;
        for (int i = 0; i < scored.size(); i++) {
            cumulative += weights[i];
            if (target < cumulative) {
                return scored.get(i);
            }
        }
        return scored.get(scored.size() - 1);
    }

    private long decodeBlocksFor(long inputLength) {
        int blockSize = config.getBlockSize();
        return (Math.max(0, inputLength) + blockSize - 1) / blockSize;
    }

    private long prefillTokensFor(long inputLength, int overlapBlocks) {
        return Math.max(0, inputLength - (long) overlapBlocks * config.getBlockSize());
    }

    private double overlapWeightOf(RouterConfigOverride override) {
        return override == null ? config.getOverlapScoreWeight() : override.overlapScoreWeightOr(config.getOverlapScoreWeight());
    }

    private double temperatureOf(RouterConfigOverride override) {
        return override == null ? config.getTemperature() : override.temperatureOr(config.getTemperature());
    }
}
