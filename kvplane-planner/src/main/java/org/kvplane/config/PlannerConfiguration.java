package org.kvplane.config;

import org.kvplane.enums.ConnectorType;
import org.kvplane.planner.connector.HttpOrchestrationClient;
import org.kvplane.planner.connector.NotificationScalingConnector;
import org.kvplane.planner.connector.OrchestrationScalingConnector;
import org.kvplane.planner.connector.ScalingConnector;
import org.kvplane.planner.core.CapacityPlanner;
import org.kvplane.planner.core.CorrectionFactorTracker;
import org.kvplane.planner.core.SlaPlanner;
import org.kvplane.planner.metrics.MetricsWindow;
import org.kvplane.planner.metrics.PrometheusMetricsSource;
import org.kvplane.planner.metrics.TrafficMetricsCollector;
import org.kvplane.planner.monitor.PlannerReporter;
import org.kvplane.planner.predictor.LoadPredictorFactory;
import org.kvplane.planner.predictor.LoadPredictorService;
import org.kvplane.planner.profile.PerformanceProfile;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the SLA planner. The loop only schedules cycles when {@code plannerEnabled} is set, the status stays
 * readable either way.
 */
@Configuration
public class PlannerConfiguration {

    @Bean
    public PerformanceProfile performanceProfile(ConfigService configService) {
        return PerformanceProfile.load(configService.plannerConfig().getProfilePath());
    }

    @Bean
    public ScalingConnector scalingConnector(ConfigService configService, WebClient.Builder webClientBuilder,
                                             ApplicationEventPublisher publisher, PlannerReporter plannerReporter) {
        PlannerConfig config = configService.plannerConfig();
        if (config.getConnectorType() == ConnectorType.ORCHESTRATION) {
            WebClient webClient = webClientBuilder.clone().baseUrl(config.getOrchestrationUrl()).build();
            HttpOrchestrationClient client =
                    new HttpOrchestrationClient(webClient, Duration.ofMillis(config.getConnectorTimeoutMs()));
            return new OrchestrationScalingConnector(client, config, plannerReporter);
        }
        return new NotificationScalingConnector(publisher);
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public SlaPlanner slaPlanner(ConfigService configService, WebClient.Builder webClientBuilder,
                                 PerformanceProfile performanceProfile, ScalingConnector scalingConnector,
                                 PlannerReporter plannerReporter) {
        PlannerConfig config = configService.plannerConfig();
        WebClient prometheus = webClientBuilder.clone().baseUrl(config.getPrometheusUrl()).build();
        // ten points per interval
        Duration step = Duration.ofSeconds(Math.max(1, config.getAdjustmentIntervalSecs() / 10));
        PrometheusMetricsSource metricsSource = new PrometheusMetricsSource(prometheus, step,
                Duration.ofMillis(config.getMetricsQueryTimeoutMs()));
        return new SlaPlanner(config,
                new TrafficMetricsCollector(metricsSource, config),
                new MetricsWindow(config.getWindowSize()),
                new LoadPredictorService(LoadPredictorFactory.create(config.getPredictorType(), config)),
                new CapacityPlanner(config, performanceProfile),
                new CorrectionFactorTracker(config),
                scalingConnector,
                plannerReporter);
    }
}
