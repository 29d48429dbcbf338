package org.kvplane.planner.monitor;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.dao.route.RoleType;
import org.kvplane.enums.KvMetricType;
import org.kvplane.metric.KvMonitor;
import org.kvplane.metric.MetricTags;
import org.kvplane.planner.domain.CorrectionFactors;
import org.kvplane.planner.domain.LoadForecast;
import org.kvplane.planner.domain.ReplicaPlan;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;

import static org.kvplane.constant.MetricConstant.PLANNER_CAPACITY_INFEASIBLE_QPS;
import static org.kvplane.constant.MetricConstant.PLANNER_CONNECTOR_FAILURE_QPS;
import static org.kvplane.constant.MetricConstant.PLANNER_CORRECTION_FACTOR;
import static org.kvplane.constant.MetricConstant.PLANNER_CYCLE_FAILURE_QPS;
import static org.kvplane.constant.MetricConstant.PLANNER_CYCLE_SKIPPED_QPS;
import static org.kvplane.constant.MetricConstant.PLANNER_PREDICTED_REQUESTS;
import static org.kvplane.constant.MetricConstant.PLANNER_TARGET_REPLICAS;

@Slf4j
@Component
public class PlannerReporter {

    private final KvMonitor monitor;

    private final MetricTags tags = MetricTags.of();

    public PlannerReporter(KvMonitor monitor) {
        this.monitor = monitor;
    }

    @PostConstruct
    public void init() {
        monitor.register(PLANNER_TARGET_REPLICAS, KvMetricType.GAUGE);
        monitor.register(PLANNER_CORRECTION_FACTOR, KvMetricType.GAUGE);
        monitor.register(PLANNER_PREDICTED_REQUESTS, KvMetricType.GAUGE);
        monitor.register(PLANNER_CAPACITY_INFEASIBLE_QPS, KvMetricType.QPS);
        monitor.register(PLANNER_CYCLE_FAILURE_QPS, KvMetricType.QPS);
        monitor.register(PLANNER_CYCLE_SKIPPED_QPS, KvMetricType.QPS);
        monitor.register(PLANNER_CONNECTOR_FAILURE_QPS, KvMetricType.QPS);
        log.info("PlannerReporter initialized and metrics registered");
    }

    public void reportPlan(ReplicaPlan plan) {
        monitor.report(PLANNER_TARGET_REPLICAS, roleTags(RoleType.PREFILL), plan.getPrefillReplicas());
        monitor.report(PLANNER_TARGET_REPLICAS, roleTags(RoleType.DECODE), plan.getDecodeReplicas());
        if (plan.isCapacityInfeasible()) {
            monitor.report(PLANNER_CAPACITY_INFEASIBLE_QPS, tags, 1.0);
        }
    }

    public void reportForecast(LoadForecast forecast) {
        monitor.report(PLANNER_PREDICTED_REQUESTS, tags, forecast.getRequestCount());
    }

    public void reportCorrectionFactors(CorrectionFactors factors) {
        monitor.report(PLANNER_CORRECTION_FACTOR, roleTags(RoleType.PREFILL), factors.getPrefill());
        monitor.report(PLANNER_CORRECTION_FACTOR, roleTags(RoleType.DECODE), factors.getDecode());
    }

    public void reportCycleFailure(int code) {
        monitor.report(PLANNER_CYCLE_FAILURE_QPS, MetricTags.of("code", String.valueOf(code)), 1.0);
    }

    public void reportCycleSkipped(String reason) {
        monitor.report(PLANNER_CYCLE_SKIPPED_QPS, MetricTags.of("reason", reason), 1.0);
    }

    public void reportConnectorFailure(RoleType role) {
        monitor.report(PLANNER_CONNECTOR_FAILURE_QPS, roleTags(role), 1.0);
    }

    private static MetricTags roleTags(RoleType role) {
        return MetricTags.of("role", role.name());
    }
}
