package org.kvplane.config;

import lombok.Getter;
import lombok.Setter;
import org.kvplane.dao.route.RoleType;
import org.kvplane.enums.ConnectorType;
import org.kvplane.enums.PredictorType;

/**
 * SLA planner settings, loaded from {@code KVPLANE_PLANNER_CONFIG}
 */
@Getter
@Setter
public class PlannerConfig {

    /**
     * Replaced in every traffic query by the adjustment interval, e.g. {@code 180s}
     */
    public static final String INTERVAL_PLACEHOLDER = "$interval";

    private boolean plannerEnabled = false;

    private long adjustmentIntervalSecs = 180;

    /**
     * Number of interval samples kept for forecasting
     */
    private int windowSize = 50;

    private PredictorType predictorType = PredictorType.AUTOREGRESSIVE;

    private int arOrder = 3;

    private int seasonLength = 8;

    /*------------------------------------------------ SLA targets ---------------------------------------------------*/

    private double ttftMs = 500;

    private double itlMs = 50;

    /*------------------------------------------------ capacity ------------------------------------------------------*/

    /**
     * Total GPUs the planner may hand out, 0 or less disables the budget
     */
    private int gpuBudget = 8;

    private int prefillGpusPerReplica = 1;

    private int decodeGpusPerReplica = 1;

    private int minPrefillReplicas = 1;

    private int minDecodeReplicas = 1;

    /**
     * Classpath resource or file path of the performance profile
     */
    private String profilePath = "classpath:performance-profile.json";

    /*------------------------------------------------ correction ----------------------------------------------------*/

    private double correctionAlpha = 0.5;

    private double correctionMin = 0.1;

    private double correctionMax = 10.0;

    /*------------------------------------------------ metrics source ------------------------------------------------*/

    private String prometheusUrl = "http://127.0.0.1:9090";

    private long metricsQueryTimeoutMs = 5000;

    private String requestCountQuery = "sum(increase(kvplane_frontend_requests_total[$interval]))";

    private String inputLenQuery = "sum(rate(kvplane_frontend_input_tokens_sum[$interval])) / sum(rate(kvplane_frontend_input_tokens_count[$interval]))";

    private String outputLenQuery = "sum(rate(kvplane_frontend_output_tokens_sum[$interval])) / sum(rate(kvplane_frontend_output_tokens_count[$interval]))";

    private String ttftQuery = "1000 * sum(rate(kvplane_frontend_ttft_seconds_sum[$interval])) / sum(rate(kvplane_frontend_ttft_seconds_count[$interval]))";

    private String itlQuery = "1000 * sum(rate(kvplane_frontend_itl_seconds_sum[$interval])) / sum(rate(kvplane_frontend_itl_seconds_count[$interval]))";

    public String getRequestCountQuery() {
        return withInterval(requestCountQuery);
    }

    public String getInputLenQuery() {
        return withInterval(inputLenQuery);
    }

    public String getOutputLenQuery() {
        return withInterval(outputLenQuery);
    }

    public String getTtftQuery() {
        return withInterval(ttftQuery);
    }

    public String getItlQuery() {
        return withInterval(itlQuery);
    }

    private String withInterval(String query) {
        return query == null ? null : query.replace(INTERVAL_PLACEHOLDER, adjustmentIntervalSecs + "s");
    }

    /*------------------------------------------------ scaling connector ---------------------------------------------*/

    private ConnectorType connectorType = ConnectorType.NOTIFICATION;

    private String orchestrationUrl = "http://127.0.0.1:8000";

    private String deploymentName = "kvplane-llm";

    private String prefillRoleName = RoleType.PREFILL.getDefaultRoleName();

    private String decodeRoleName = RoleType.DECODE.getDefaultRoleName();

    private int connectorMaxRetries = 3;

    private long connectorBackoffMs = 500;

    private long connectorTimeoutMs = 5000;
}
