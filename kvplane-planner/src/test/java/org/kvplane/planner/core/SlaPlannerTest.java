package org.kvplane.planner.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.kvplane.config.PlannerConfig;
import org.kvplane.dao.route.RoleType;
import org.kvplane.enums.StatusEnum;
import org.kvplane.planner.connector.ScalingConnector;
import org.kvplane.planner.domain.MetricsSample;
import org.kvplane.planner.domain.PlannerStatus;
import org.kvplane.planner.domain.ReplicaPlan;
import org.kvplane.planner.domain.ReplicaTarget;
import org.kvplane.planner.metrics.MetricsWindow;
import org.kvplane.planner.metrics.TrafficMetricsCollector;
import org.kvplane.planner.monitor.PlannerReporter;
import org.kvplane.planner.predictor.AutoRegressivePredictor;
import org.kvplane.planner.predictor.LoadPredictorService;
import org.kvplane.planner.profile.PerformanceProfile;
import org.kvplane.planner.profile.PerformanceProfile.DecodePoint;
import org.kvplane.planner.profile.PerformanceProfile.DecodeRow;
import org.kvplane.planner.profile.PerformanceProfile.PrefillPoint;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SlaPlannerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:03:00Z");

    // 10 prefill and 6 decode replicas on the flat profile below
    private static final MetricsSample BUSY = MetricsSample.builder()
            .timestamp(NOW).requestCount(1000).inputLen(1000).outputLen(120).ttftMs(500).itlMs(50).build();

    @Mock
    private TrafficMetricsCollector collector;

    @Mock
    private ScalingConnector connector;

    @Mock
    private PlannerReporter reporter;

    private PlannerConfig config;

    private MetricsWindow window;

    private SlaPlanner planner;

    @BeforeEach
    void setUp() {
        config = new PlannerConfig();
        config.setAdjustmentIntervalSecs(100);
        config.setGpuBudget(8);
        window = new MetricsWindow(config.getWindowSize());
        PerformanceProfile profile = new PerformanceProfile(
                new ArrayList<>(List.of(new PrefillPoint(100, 1000), new PrefillPoint(10000, 1000))),
                new ArrayList<>(List.of(new DecodeRow(100, new ArrayList<>(List.of(
                        new DecodePoint(10, 200), new DecodePoint(100, 200)))))));
        planner = new SlaPlanner(config, collector, window,
                new LoadPredictorService(new AutoRegressivePredictor(config.getArOrder())),
                new CapacityPlanner(config, profile),
                new CorrectionFactorTracker(config),
                connector,
                reporter);
    }

    @Test
    void should_assert_both_targets_when_converged() {
        when(collector.collect(NOW)).thenReturn(BUSY);
        when(connector.isConverged()).thenReturn(true);

        ReplicaPlan plan = planner.runCycle(NOW);

        assertEquals(5, plan.getPrefillReplicas());
        assertEquals(3, plan.getDecodeReplicas());
        verify(connector).setReplicas(new ReplicaTarget(RoleType.PREFILL, 5));
        verify(connector).setReplicas(new ReplicaTarget(RoleType.DECODE, 3));
        verify(reporter).reportPlan(plan);
    }

    @Test
    void should_sample_but_skip_planning_when_not_converged() {
        when(collector.collect(NOW)).thenReturn(BUSY);
        when(connector.isConverged()).thenReturn(false);

        assertNull(planner.runCycle(NOW));

        assertEquals(1, window.size());
        verify(connector, never()).setReplicas(any());
        verify(reporter).reportCycleSkipped(SlaPlanner.SKIP_NOT_CONVERGED);
        assertFalse(planner.status().isConnectorConverged());
    }

    @Test
    void should_skip_planning_without_any_sample() {
        when(collector.collect(NOW)).thenThrow(StatusEnum.METRICS_SOURCE_ERROR.toException("prometheus down"));
        when(connector.isConverged()).thenReturn(true);

        assertNull(planner.runCycle(NOW));

        verify(connector, never()).setReplicas(any());
        verify(reporter).reportCycleSkipped(SlaPlanner.SKIP_NO_SAMPLES);
        assertNotNull(planner.status().getLastError());
    }

    @Test
    void should_plan_from_window_when_sampling_fails() {
        when(collector.collect(any())).thenReturn(BUSY)
                .thenThrow(StatusEnum.METRICS_SOURCE_ERROR.toException("prometheus down"));
        when(connector.isConverged()).thenReturn(true);
        planner.runCycle(NOW);

        ReplicaPlan plan = planner.runCycle(NOW.plusSeconds(100));

        assertEquals(5, plan.getPrefillReplicas());
        assertEquals(1, window.size());
    }

    @Test
    void should_expose_last_cycle_in_status() {
        when(collector.collect(NOW)).thenReturn(BUSY);
        when(connector.isConverged()).thenReturn(true);

        planner.runCycle(NOW);
        PlannerStatus status = planner.status();

        assertFalse(status.isRunning());
        assertEquals(NOW, status.getLastCycleTime());
        assertEquals(1, status.getWindowSamples());
        assertEquals("AUTOREGRESSIVE", status.getPredictor());
        assertEquals(1000, status.getLastForecast().getRequestCount(), 1e-9);
        assertEquals(3, status.getLastPlan().getDecodeReplicas());
        assertEquals(1.0, status.getCorrectionFactors().getPrefill(), 1e-9);
    }

    @Test
    void should_not_schedule_when_disabled() {
        planner.start();

        assertFalse(planner.status().isRunning());
        planner.shutdown();
        verify(reporter, never()).reportCycleSkipped(anyString());
    }
}
