package org.kvplane.planner.predictor;

import org.kvplane.enums.PredictorType;
import org.kvplane.planner.domain.LoadForecast;
import org.kvplane.planner.domain.MetricsSample;

import java.util.List;

/**
 * Forecasts next interval traffic from a window of past samples
 */
public interface LoadPredictor {

    PredictorType type();

    /**
     * @param samples window, oldest first, with at least {@link #minimumSamples()} entries
     */
    LoadForecast fitPredict(List<MetricsSample> samples);

    int minimumSamples();
}
