package org.kvplane.planner.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * State of the planner loop after its last cycle
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlannerStatus {

    private boolean running;

    private Instant lastCycleTime;

    private int windowSamples;

    private String predictor;

    private LoadForecast lastForecast;

    private ReplicaPlan lastPlan;

    private CorrectionFactors correctionFactors;

    private boolean connectorConverged;

    private String lastError;
}
