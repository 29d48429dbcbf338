package org.kvplane.planner.core;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.config.PlannerConfig;
import org.kvplane.enums.StatusEnum;
import org.kvplane.exception.KvPlaneException;
import org.kvplane.exception.MetricsSourceException;
import org.kvplane.planner.connector.ScalingConnector;
import org.kvplane.planner.domain.CorrectionFactors;
import org.kvplane.planner.domain.LoadForecast;
import org.kvplane.planner.domain.MetricsSample;
import org.kvplane.planner.domain.PlannerStatus;
import org.kvplane.planner.domain.ReplicaPlan;
import org.kvplane.planner.domain.ReplicaTarget;
import org.kvplane.planner.domain.SlaTarget;
import org.kvplane.planner.metrics.MetricsWindow;
import org.kvplane.planner.metrics.TrafficMetricsCollector;
import org.kvplane.planner.monitor.PlannerReporter;
import org.kvplane.planner.predictor.LoadPredictorService;
import org.kvplane.util.JsonUtils;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic planning loop: sample traffic, update correction factors, forecast, plan and assert replica targets.
 * <p>
 * Cycles run one at a time on a single daemon thread. A failed cycle is logged and reported and the next one runs
 * on schedule.
 */
@Slf4j
public class SlaPlanner {

    static final String SKIP_NOT_CONVERGED = "not_converged";

    static final String SKIP_NO_SAMPLES = "no_samples";

    private final PlannerConfig config;

    private final TrafficMetricsCollector collector;

    private final MetricsWindow window;

    private final LoadPredictorService predictorService;

    private final CapacityPlanner capacityPlanner;

    private final CorrectionFactorTracker correctionTracker;

    private final ScalingConnector connector;

    private final PlannerReporter reporter;

    private final SlaTarget slaTarget;

    private ScheduledExecutorService plannerScheduler;

    private volatile boolean stopped = false;

    private volatile Instant lastCycleTime;

    private volatile LoadForecast lastForecast;

    private volatile ReplicaPlan lastPlan;

    private volatile boolean connectorConverged = true;

    private volatile String lastError;

    public SlaPlanner(PlannerConfig config, TrafficMetricsCollector collector, MetricsWindow window,
                      LoadPredictorService predictorService, CapacityPlanner capacityPlanner,
                      CorrectionFactorTracker correctionTracker, ScalingConnector connector,
                      PlannerReporter reporter) {
        this.config = config;
        this.collector = collector;
        this.window = window;
        this.predictorService = predictorService;
        this.capacityPlanner = capacityPlanner;
        this.correctionTracker = correctionTracker;
        this.connector = connector;
        this.reporter = reporter;
        this.slaTarget = new SlaTarget(config.getTtftMs(), config.getItlMs());
    }

    public synchronized void start() {
        if (!config.isPlannerEnabled()) {
            log.info("SLA planner disabled");
            return;
        }
        if (plannerScheduler != null) {
            return;
        }
        plannerScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sla-planner-loop");
            t.setDaemon(true);
            return t;
        });
        long interval = config.getAdjustmentIntervalSecs();
        plannerScheduler.scheduleWithFixedDelay(this::runScheduledCycle, interval, interval, TimeUnit.SECONDS);
        log.info("SLA planner started, interval: {}s, predictor: {}", interval,
                predictorService.getPredictor().type());
    }

    /**
     * Stop scheduling. A cycle already running completes.
     */
    public synchronized void shutdown() {
        stopped = true;
        if (plannerScheduler == null || plannerScheduler.isShutdown()) {
            return;
        }
        plannerScheduler.shutdown();
        try {
            if (!plannerScheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                plannerScheduler.shutdownNow();
            }
            log.info("SLA planner stopped");
        } catch (InterruptedException e) {
            plannerScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void runScheduledCycle() {
        if (stopped) {
            return;
        }
        try {
            runCycle(Instant.now());
        } catch (KvPlaneException e) {
            lastError = e.getMessage();
            log.error("planner cycle failed", e);
            reporter.reportCycleFailure(e.getCode());
        } catch (RuntimeException e) {
            lastError = e.toString();
            log.error("planner cycle failed", e);
            reporter.reportCycleFailure(StatusEnum.INTERNAL_ERROR.getCode());
        }
    }

    /**
     * Run one planning cycle at {@code now}.
     *
     * @return the plan asserted, or null when the cycle was skipped
     */
    public ReplicaPlan runCycle(Instant now) {
        lastCycleTime = now;
        MetricsSample sample = sample(now);
        if (sample != null) {
            window.add(sample);
            CorrectionFactors factors = correctionTracker.update(sample, slaTarget);
            reporter.reportCorrectionFactors(factors);
        }

        connectorConverged = connector.isConverged();
        if (!connectorConverged) {
            log.info("previous scaling still in progress, skip planning");
            reporter.reportCycleSkipped(SKIP_NOT_CONVERGED);
            return null;
        }

        List<MetricsSample> samples = window.snapshot();
        if (samples.isEmpty()) {
            log.info("no traffic sample collected yet, skip planning");
            reporter.reportCycleSkipped(SKIP_NO_SAMPLES);
            return null;
        }

        LoadForecast forecast = predictorService.predict(samples);
        ReplicaPlan plan = capacityPlanner.plan(forecast, slaTarget, correctionTracker.current());
        lastForecast = forecast;
        lastPlan = plan;
        reporter.reportForecast(forecast);
        reporter.reportPlan(plan);
        if (plan.isCapacityInfeasible()) {
            log.warn("capacity infeasible, asserting minimum replicas {}", plan);
        }
        for (ReplicaTarget target : plan.targets()) {
            connector.setReplicas(target);
        }
        log.info("planner cycle asserted {}", JsonUtils.toString(plan));
        lastError = null;
        return plan;
    }

    private MetricsSample sample(Instant now) {
        try {
            return collector.collect(now);
        } catch (MetricsSourceException e) {
            lastError = e.getMessage();
            log.warn("skip traffic sampling: {}", e.getMessage());
            reporter.reportCycleFailure(e.getCode());
            return null;
        }
    }

    public PlannerStatus status() {
        return PlannerStatus.builder()
                .running(plannerScheduler != null && !stopped)
                .lastCycleTime(lastCycleTime)
                .windowSamples(window.size())
                .predictor(predictorService.getPredictor().type().name())
                .lastForecast(lastForecast)
                .lastPlan(lastPlan)
                .correctionFactors(correctionTracker.current())
                .connectorConverged(connectorConverged)
                .lastError(lastError)
                .build();
    }
}
